package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.SortOrder;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scalar knobs for a harvesting run. Field initializers are the defaults; a JSON file
 * may override any subset of them (see {@link #load(Path)}).
 */
public class HarvestConfig {
    private Integer maxReviews;             // null = no cap
    private int workers = 1;
    private boolean headless = true;
    private String language = "ko-KR";
    private String proxy;
    private long actionDelayMs = 800;

    // shard window over the input list
    private int startFrom = 0;
    private Integer limit;

    // scroll controller
    private int stagnationLimit = 3;
    private int maxScrollAttempts = 200;
    private int scrollBatchPages = 1;
    private double loadFactor = 1.5;
    private long scrollWaitInitialMs = 800;
    private long scrollWaitStepMs = 400;
    private long scrollWaitMaxMs = 2500;

    // retry wrapper
    private int retryAttempts = 3;
    private long retryBackoffMs = 500;

    private long pageLoadTimeoutMs = 30_000;
    private long panelTimeoutMs = 7_000;

    private List<SortOrder> sortPasses = defaultSortPasses();
    private boolean retryFailedOnResume = true;

    private static final Gson GSON = new Gson();

    /** Defaults overlaid with whatever the JSON file sets. */
    public static HarvestConfig load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            HarvestConfig cfg = GSON.fromJson(reader, HarvestConfig.class);
            if (cfg == null) {
                return new HarvestConfig();
            }
            if (cfg.sortPasses == null) {
                cfg.sortPasses = defaultSortPasses();
            }
            return cfg;
        } catch (JsonParseException e) {
            throw new IOException("Invalid config file " + file + ": " + e.getMessage(), e);
        }
    }

    /** Throws IllegalArgumentException describing the first invalid knob. */
    public HarvestConfig validate() {
        require(maxReviews == null || maxReviews > 0, "maxReviews must be positive (or unset for no cap)");
        require(workers > 0, "workers must be positive");
        require(startFrom >= 0, "startFrom must be >= 0");
        require(limit == null || limit >= 0, "limit must be >= 0");
        require(stagnationLimit > 0, "stagnationLimit must be positive");
        require(maxScrollAttempts > 0, "maxScrollAttempts must be positive");
        require(scrollBatchPages > 0, "scrollBatchPages must be positive");
        require(loadFactor >= 1.0, "loadFactor must be >= 1.0");
        require(scrollWaitInitialMs >= 0 && scrollWaitStepMs >= 0, "scroll waits must be >= 0");
        require(scrollWaitMaxMs >= scrollWaitInitialMs, "scrollWaitMaxMs must be >= scrollWaitInitialMs");
        require(retryAttempts > 0, "retryAttempts must be positive");
        require(retryBackoffMs >= 0, "retryBackoffMs must be >= 0");
        require(pageLoadTimeoutMs > 0 && panelTimeoutMs > 0, "timeouts must be positive");
        require(sortPasses != null && !sortPasses.isEmpty(), "sortPasses must name at least one order");
        // gson maps an unknown order name to null
        require(!sortPasses.contains(null), "sortPasses contains an unknown order (use newest or relevant)");
        return this;
    }

    /** Newest first, then relevance, which surfaces older reviews the newest pass stops short of. */
    private static List<SortOrder> defaultSortPasses() {
        return new ArrayList<>(List.of(SortOrder.NEWEST, SortOrder.RELEVANT));
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public Duration actionDelay() { return Duration.ofMillis(actionDelayMs); }
    public Duration pageLoadTimeout() { return Duration.ofMillis(pageLoadTimeoutMs); }
    public Duration panelTimeout() { return Duration.ofMillis(panelTimeoutMs); }

    // getters / setters
    public Integer getMaxReviews() { return maxReviews; }
    public void setMaxReviews(Integer maxReviews) { this.maxReviews = maxReviews; }

    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }

    public boolean isHeadless() { return headless; }
    public void setHeadless(boolean headless) { this.headless = headless; }

    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }

    public String getProxy() { return proxy; }
    public void setProxy(String proxy) { this.proxy = proxy; }

    public long getActionDelayMs() { return actionDelayMs; }
    public void setActionDelayMs(long actionDelayMs) { this.actionDelayMs = actionDelayMs; }

    public int getStartFrom() { return startFrom; }
    public void setStartFrom(int startFrom) { this.startFrom = startFrom; }

    public Integer getLimit() { return limit; }
    public void setLimit(Integer limit) { this.limit = limit; }

    public int getStagnationLimit() { return stagnationLimit; }
    public void setStagnationLimit(int stagnationLimit) { this.stagnationLimit = stagnationLimit; }

    public int getMaxScrollAttempts() { return maxScrollAttempts; }
    public void setMaxScrollAttempts(int maxScrollAttempts) { this.maxScrollAttempts = maxScrollAttempts; }

    public int getScrollBatchPages() { return scrollBatchPages; }
    public void setScrollBatchPages(int scrollBatchPages) { this.scrollBatchPages = scrollBatchPages; }

    public double getLoadFactor() { return loadFactor; }
    public void setLoadFactor(double loadFactor) { this.loadFactor = loadFactor; }

    public long getScrollWaitInitialMs() { return scrollWaitInitialMs; }
    public void setScrollWaitInitialMs(long scrollWaitInitialMs) { this.scrollWaitInitialMs = scrollWaitInitialMs; }

    public long getScrollWaitStepMs() { return scrollWaitStepMs; }
    public void setScrollWaitStepMs(long scrollWaitStepMs) { this.scrollWaitStepMs = scrollWaitStepMs; }

    public long getScrollWaitMaxMs() { return scrollWaitMaxMs; }
    public void setScrollWaitMaxMs(long scrollWaitMaxMs) { this.scrollWaitMaxMs = scrollWaitMaxMs; }

    public int getRetryAttempts() { return retryAttempts; }
    public void setRetryAttempts(int retryAttempts) { this.retryAttempts = retryAttempts; }

    public long getRetryBackoffMs() { return retryBackoffMs; }
    public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }

    public long getPageLoadTimeoutMs() { return pageLoadTimeoutMs; }
    public void setPageLoadTimeoutMs(long pageLoadTimeoutMs) { this.pageLoadTimeoutMs = pageLoadTimeoutMs; }

    public long getPanelTimeoutMs() { return panelTimeoutMs; }
    public void setPanelTimeoutMs(long panelTimeoutMs) { this.panelTimeoutMs = panelTimeoutMs; }

    public List<SortOrder> getSortPasses() { return sortPasses; }
    public void setSortPasses(List<SortOrder> sortPasses) { this.sortPasses = new ArrayList<>(sortPasses); }

    public boolean isRetryFailedOnResume() { return retryFailedOnResume; }
    public void setRetryFailedOnResume(boolean retryFailedOnResume) { this.retryFailedOnResume = retryFailedOnResume; }
}
