package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.FailureKind;

/** In-page script failed or returned something unusable (stale node, transient empty read). */
public class ScriptExecutionException extends HarvestException {
    public ScriptExecutionException(String message) {
        super(FailureKind.EXECUTION, true, message);
    }

    public ScriptExecutionException(String message, Throwable cause) {
        super(FailureKind.EXECUTION, true, message, cause);
    }
}
