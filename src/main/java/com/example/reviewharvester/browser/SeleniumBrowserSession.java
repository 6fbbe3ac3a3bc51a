package com.example.reviewharvester.browser;

import com.example.reviewharvester.scraper.HarvestException;
import com.example.reviewharvester.scraper.NavigationException;
import com.example.reviewharvester.scraper.ScriptExecutionException;
import com.example.reviewharvester.scraper.SessionCrashException;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.remote.UnreachableBrowserException;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * {@link BrowserSession} on top of a Selenium {@link WebDriver}.
 */
public class SeleniumBrowserSession implements BrowserSession {
    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserSession.class);

    // 0 when the browser doesn't report a status for the main document
    static final String STATUS_SCRIPT =
            "var e = performance.getEntriesByType('navigation');"
            + "return (e.length > 0 && e[0].responseStatus) ? e[0].responseStatus : 0;";

    private final WebDriver driver;
    private volatile boolean closed;

    public SeleniumBrowserSession(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public void navigate(String url) throws HarvestException {
        try {
            driver.get(url);
        } catch (TimeoutException e) {
            throw NavigationException.timeout(url, e);
        } catch (WebDriverException e) {
            throw translate("navigate to " + url, e);
        }
        Object status = evaluate(STATUS_SCRIPT);
        if (status instanceof Number && ((Number) status).intValue() >= 400) {
            throw NavigationException.httpStatus(url, ((Number) status).intValue());
        }
    }

    @Override
    public Object evaluate(String script, Object... args) throws HarvestException {
        try {
            return ((JavascriptExecutor) driver).executeScript(script, args);
        } catch (WebDriverException e) {
            throw translate("evaluate script", e);
        }
    }

    @Override
    public boolean waitForPresent(String cssSelector, Duration timeout) throws HarvestException {
        try {
            WebDriverWait w = new WebDriverWait(driver, timeout);
            w.until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(cssSelector)));
            return true;
        } catch (TimeoutException te) {
            return false;
        } catch (WebDriverException e) {
            throw translate("wait for " + cssSelector, e);
        }
    }

    @Override
    public String currentUrl() throws HarvestException {
        try {
            return driver.getCurrentUrl();
        } catch (WebDriverException e) {
            throw translate("read current url", e);
        }
    }

    @Override
    public boolean isAlive() {
        if (closed) return false;
        try {
            driver.getWindowHandle();
            return true;
        } catch (WebDriverException e) {
            log.debug("Browser session no longer answers: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.debug("Ignoring error while quitting browser: {}", e.getMessage());
        }
    }

    private HarvestException translate(String action, WebDriverException e) {
        if (e instanceof NoSuchSessionException || e instanceof UnreachableBrowserException || !isAlive()) {
            return new SessionCrashException("Browser session died during " + action, e);
        }
        String message = e.getMessage() == null ? "" : e.getMessage();
        if (message.contains("net::ERR_")) {
            // DNS failure, refused connection and the like: the page is unreachable
            return NavigationException.unreachable(action, e);
        }
        return new ScriptExecutionException("Failed to " + action + ": " + firstLine(message), e);
    }

    private static String firstLine(String message) {
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
