package com.example.reviewharvester.model;

public enum RunOutcome {
    CLEAN(0),
    PARTIAL_FAILURES(1),
    ABORTED(2);

    private final int exitCode;

    RunOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
