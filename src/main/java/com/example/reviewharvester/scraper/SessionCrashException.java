package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.FailureKind;

/** The browser process behind a session died or stopped answering. */
public class SessionCrashException extends HarvestException {
    public SessionCrashException(String message, Throwable cause) {
        super(FailureKind.SESSION_CRASH, false, message, cause);
    }
}
