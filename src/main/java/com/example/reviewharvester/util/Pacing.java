package com.example.reviewharvester.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sleeps for the requested interval plus a small random jitter so consecutive
 * actions don't land on a fixed cadence.
 */
public class Pacing implements Sleeper {

    private final double jitterRatio;

    public Pacing() {
        this(0.2);
    }

    public Pacing(double jitterRatio) {
        if (jitterRatio < 0) {
            throw new IllegalArgumentException("jitterRatio must be >= 0");
        }
        this.jitterRatio = jitterRatio;
    }

    @Override
    public void sleep(Duration duration) {
        long baseMs = duration.toMillis();
        if (baseMs <= 0) return;
        long jitter = (long) (baseMs * jitterRatio * ThreadLocalRandom.current().nextDouble());
        try {
            Thread.sleep(baseMs + jitter);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
