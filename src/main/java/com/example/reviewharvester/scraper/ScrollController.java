package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.ScrollTermination;
import com.example.reviewharvester.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Decides when a page has loaded enough. Repeats scroll, wait, read-count until the
 * requested count (times the load factor) is reached, the count stops growing for
 * {@code stagnationLimit} attempts in a row, or {@code maxAttempts} actions were issued.
 * The wait starts short and grows by a fixed step while the count is stagnant, up to
 * a bound; it drops back once new content shows up.
 */
public class ScrollController {
    private static final Logger log = LoggerFactory.getLogger(ScrollController.class);

    private final int stagnationLimit;
    private final int maxAttempts;
    private final int batchPages;
    private final double loadFactor;
    private final Duration initialWait;
    private final Duration waitStep;
    private final Duration maxWait;
    private final Sleeper sleeper;

    public ScrollController(int stagnationLimit, int maxAttempts, int batchPages, double loadFactor,
                            Duration initialWait, Duration waitStep, Duration maxWait, Sleeper sleeper) {
        this.stagnationLimit = stagnationLimit;
        this.maxAttempts = maxAttempts;
        this.batchPages = batchPages;
        this.loadFactor = loadFactor;
        this.initialWait = initialWait;
        this.waitStep = waitStep;
        this.maxWait = maxWait;
        this.sleeper = sleeper;
    }

    public static ScrollController from(HarvestConfig config, Sleeper sleeper) {
        return new ScrollController(
                config.getStagnationLimit(),
                config.getMaxScrollAttempts(),
                config.getScrollBatchPages(),
                config.getLoadFactor(),
                Duration.ofMillis(config.getScrollWaitInitialMs()),
                Duration.ofMillis(config.getScrollWaitStepMs()),
                Duration.ofMillis(config.getScrollWaitMaxMs()),
                sleeper);
    }

    /** Count at which loading stops early; unbounded when nothing was requested. */
    int loadTarget(Integer requested) {
        if (requested == null) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.min(Integer.MAX_VALUE, (long) Math.ceil(requested * loadFactor));
    }

    public ScrollOutcome scroll(ScrollablePage page, Integer requested) throws HarvestException {
        int target = loadTarget(requested);
        int count = page.loadedCount();
        if (count >= target) {
            return new ScrollOutcome(ScrollTermination.TARGET_REACHED, 0, count);
        }

        Duration wait = initialWait;
        int stagnant = 0;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            page.advance(batchPages);
            sleeper.sleep(wait);
            int now = page.loadedCount();

            if (now >= target) {
                log.debug("Loaded {} reviews after {} scrolls, target {} reached", now, attempt, target);
                return new ScrollOutcome(ScrollTermination.TARGET_REACHED, attempt, now);
            }
            if (now <= count) {
                stagnant++;
                if (stagnant >= stagnationLimit) {
                    log.debug("No new reviews for {} scrolls, stopping at {}", stagnant, now);
                    return new ScrollOutcome(ScrollTermination.STAGNATION, attempt, now);
                }
                Duration grown = wait.plus(waitStep);
                wait = grown.compareTo(maxWait) > 0 ? maxWait : grown;
            } else {
                stagnant = 0;
                wait = initialWait;
            }
            count = now;
        }
        log.warn("Scroll attempt cap of {} reached with {} reviews loaded", maxAttempts, count);
        return new ScrollOutcome(ScrollTermination.ATTEMPT_CAP, maxAttempts, count);
    }
}
