package com.example.reviewharvester.browser;

import com.example.reviewharvester.scraper.HarvestConfig;
import com.example.reviewharvester.scraper.HarvestException;
import com.example.reviewharvester.scraper.SessionCrashException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/** Opens one local Chrome per session. */
public class ChromeSessionFactory implements SessionFactory {
    private static final Logger log = LoggerFactory.getLogger(ChromeSessionFactory.class);

    private final HarvestConfig config;

    public ChromeSessionFactory(HarvestConfig config) {
        this.config = config;
    }

    @Override
    public BrowserSession open() throws HarvestException {
        try {
            WebDriver driver = DriverManager.createChromeDriver(
                    config.isHeadless(),
                    config.getLanguage(),
                    config.getProxy(),
                    Duration.ofMillis(config.getPageLoadTimeoutMs()));
            log.debug("Started Chrome session (headless={})", config.isHeadless());
            return new SeleniumBrowserSession(driver);
        } catch (WebDriverException e) {
            throw new SessionCrashException("Could not start browser: " + e.getMessage(), e);
        }
    }
}
