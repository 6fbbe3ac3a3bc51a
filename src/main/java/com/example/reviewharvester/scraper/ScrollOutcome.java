package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.ScrollTermination;

/** Result of one scroll loop: why it stopped, after how many actions, with how much loaded. */
public final class ScrollOutcome {
    private final ScrollTermination termination;
    private final int attempts;
    private final int loadedCount;

    public ScrollOutcome(ScrollTermination termination, int attempts, int loadedCount) {
        this.termination = termination;
        this.attempts = attempts;
        this.loadedCount = loadedCount;
    }

    public ScrollTermination getTermination() { return termination; }
    public int getAttempts() { return attempts; }
    public int getLoadedCount() { return loadedCount; }
}
