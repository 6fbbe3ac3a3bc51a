package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.FailureKind;

/**
 * Page unreachable. An HTTP error status is fatal; a page that never showed its
 * loaded marker in time may be retried.
 */
public class NavigationException extends HarvestException {
    private final int httpStatus;

    private NavigationException(String message, boolean retryable, int httpStatus, Throwable cause) {
        super(FailureKind.NAVIGATION, retryable, message, cause);
        this.httpStatus = httpStatus;
    }

    public static NavigationException httpStatus(String url, int status) {
        return new NavigationException("HTTP " + status + " for " + url, false, status, null);
    }

    public static NavigationException timeout(String url, Throwable cause) {
        return new NavigationException("Timed out loading " + url, true, 0, cause);
    }

    public static NavigationException unreachable(String action, Throwable cause) {
        return new NavigationException("Page unreachable during " + action, false, 0, cause);
    }

    public int httpStatus() {
        return httpStatus;
    }
}
