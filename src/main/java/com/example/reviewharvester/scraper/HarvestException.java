package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.FailureKind;

/**
 * Base of every failure a browser interaction can raise. Retryable failures may be
 * attempted again by {@link Retrier}; fatal ones short-circuit the target to Failed.
 */
public class HarvestException extends Exception {
    private final FailureKind kind;
    private final boolean retryable;

    public HarvestException(FailureKind kind, boolean retryable, String message) {
        super(message);
        this.kind = kind;
        this.retryable = retryable;
    }

    public HarvestException(FailureKind kind, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    public FailureKind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
