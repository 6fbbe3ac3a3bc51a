package com.example.reviewharvester.browser;

import io.github.bonigarcia.wdm.WebDriverManager;
import org.openqa.selenium.PageLoadStrategy;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Chrome driver factory tuned for harvesting: DOM-ready page loads, no images.
 */
public class DriverManager {
    private static final Logger log = LoggerFactory.getLogger(DriverManager.class);

    private static volatile boolean driverResolved;

    public static WebDriver createChromeDriver(boolean headless, String language, String proxyServer,
                                               Duration pageLoadTimeout) {
        resolveDriverBinary();
        ChromeDriver driver = new ChromeDriver(chromeOptions(headless, language, proxyServer));
        driver.manage().timeouts().pageLoadTimeout(pageLoadTimeout);
        return driver;
    }

    static ChromeOptions chromeOptions(boolean headless, String language, String proxyServer) {
        ChromeOptions options = new ChromeOptions();

        // Basic options
        if (headless) {
            options.addArguments("--headless=new");
        }
        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-gpu");
        options.addArguments("--disable-extensions");
        options.addArguments("--disable-notifications");
        options.addArguments("--window-size=1400,900");
        if (language != null && !language.isBlank()) {
            // label texts in the site profile depend on the UI language
            options.addArguments("--lang=" + language);
        }

        if (proxyServer != null && !proxyServer.isEmpty()) {
            options.addArguments("--proxy-server=" + proxyServer);
            log.info("Using proxy: {}", proxyServer);
        }

        // continue as soon as the DOM is ready; reviews are loaded by scrolling anyway
        options.setPageLoadStrategy(PageLoadStrategy.EAGER);

        Map<String, Object> prefs = new HashMap<>();
        prefs.put("profile.managed_default_content_settings.images", 2);
        prefs.put("profile.default_content_setting_values.notifications", 2);
        options.setExperimentalOption("prefs", prefs);
        return options;
    }

    private static synchronized void resolveDriverBinary() {
        if (!driverResolved) {
            WebDriverManager.chromedriver().setup();
            driverResolved = true;
        }
    }
}
