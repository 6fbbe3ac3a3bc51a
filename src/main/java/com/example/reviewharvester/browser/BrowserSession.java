package com.example.reviewharvester.browser;

import com.example.reviewharvester.scraper.HarvestException;

import java.time.Duration;

/**
 * One controllable browser instance, exclusively owned by a single worker.
 * Implementations translate driver failures into {@link HarvestException} subtypes.
 */
public interface BrowserSession extends AutoCloseable {

    /**
     * Load a URL in the main frame.
     * @throws com.example.reviewharvester.scraper.NavigationException on HTTP error status or timeout
     */
    void navigate(String url) throws HarvestException;

    /**
     * Run a script in the page. Arguments follow WebDriver's executeScript conversion rules
     * (strings, numbers, booleans, lists and maps).
     */
    Object evaluate(String script, Object... args) throws HarvestException;

    /** Wait until at least one element matches; false when the timeout elapses first. */
    boolean waitForPresent(String cssSelector, Duration timeout) throws HarvestException;

    String currentUrl() throws HarvestException;

    /** Whether the underlying browser still answers. Never throws. */
    boolean isAlive();

    /** Release the browser. Safe to call more than once; never throws. */
    @Override
    void close();
}
