package com.example.reviewharvester.scraper;

import com.example.reviewharvester.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Bounded retry with linear backoff for browser interactions. Fatal failures are
 * rethrown immediately; retryable ones are attempted up to {@code maxAttempts} times
 * and the last failure is rethrown when the budget is spent.
 */
public class Retrier {
    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    /** A fallible interaction producing a value. */
    @FunctionalInterface
    public interface Interaction<T> {
        T run() throws HarvestException;
    }

    /** A fallible interaction without a value. */
    @FunctionalInterface
    public interface Step {
        void run() throws HarvestException;
    }

    private final int maxAttempts;
    private final Duration backoff;
    private final Sleeper sleeper;

    public Retrier(int maxAttempts, Duration backoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public static Retrier from(HarvestConfig config, Sleeper sleeper) {
        return new Retrier(config.getRetryAttempts(), Duration.ofMillis(config.getRetryBackoffMs()), sleeper);
    }

    public <T> T call(String action, Interaction<T> interaction) throws HarvestException {
        HarvestException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return interaction.run();
            } catch (HarvestException e) {
                if (!e.isRetryable()) {
                    log.warn("{} failed with fatal {}: {}", action, e.kind(), e.getMessage());
                    throw e;
                }
                last = e;
                if (attempt >= maxAttempts) {
                    break;
                }
                log.debug("{} failed (attempt {}/{}): {}", action, attempt, maxAttempts, e.getMessage());
                sleeper.sleep(backoff.multipliedBy(attempt));
            }
        }
        log.warn("{} gave up after {} attempts: {}", action, maxAttempts, last.getMessage());
        throw last;
    }

    public void run(String action, Step step) throws HarvestException {
        call(action, () -> {
            step.run();
            return null;
        });
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
