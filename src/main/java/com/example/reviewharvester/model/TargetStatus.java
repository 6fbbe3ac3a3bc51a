package com.example.reviewharvester.model;

public enum TargetStatus {
    COMPLETE,
    PARTIAL_TIMEOUT,
    FAILED;

    /** Whether a stored result with this status counts as done on resume. */
    public boolean isSettled() {
        return this != FAILED;
    }
}
