package com.example.reviewharvester.scraper;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-wide stop request. Once raised, workers finish the target in hand and dispatch
 * nothing further. Cannot be lowered again.
 */
public class StopSignal {
    private final AtomicBoolean raised = new AtomicBoolean();

    public void raise() {
        raised.set(true);
    }

    public boolean isRaised() {
        return raised.get();
    }
}
