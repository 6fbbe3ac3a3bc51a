package com.example.reviewharvester.model;

import java.util.List;

/**
 * Run-level counters, written once when the run ends.
 */
public final class CollectionLog {
    private final String startedAt;
    private final String finishedAt;
    private final long elapsedMillis;
    private final int targetsAttempted;
    private final int targetsSucceeded;
    private final int targetsFailed;
    private final int targetsSkipped;
    private final int targetsNotDispatched;
    private final int reviewsCollected;
    private final RunOutcome outcome;
    private final List<FailedTarget> failures;
    private final List<String> collisions;

    public CollectionLog(String startedAt, String finishedAt, long elapsedMillis,
                         int targetsAttempted, int targetsSucceeded, int targetsFailed,
                         int targetsSkipped, int targetsNotDispatched, int reviewsCollected,
                         RunOutcome outcome, List<FailedTarget> failures, List<String> collisions) {
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.elapsedMillis = elapsedMillis;
        this.targetsAttempted = targetsAttempted;
        this.targetsSucceeded = targetsSucceeded;
        this.targetsFailed = targetsFailed;
        this.targetsSkipped = targetsSkipped;
        this.targetsNotDispatched = targetsNotDispatched;
        this.reviewsCollected = reviewsCollected;
        this.outcome = outcome;
        this.failures = List.copyOf(failures);
        this.collisions = List.copyOf(collisions);
    }

    public String getStartedAt() { return startedAt; }
    public String getFinishedAt() { return finishedAt; }
    public long getElapsedMillis() { return elapsedMillis; }
    public int getTargetsAttempted() { return targetsAttempted; }
    public int getTargetsSucceeded() { return targetsSucceeded; }
    public int getTargetsFailed() { return targetsFailed; }
    public int getTargetsSkipped() { return targetsSkipped; }
    public int getTargetsNotDispatched() { return targetsNotDispatched; }
    public int getReviewsCollected() { return reviewsCollected; }
    public RunOutcome getOutcome() { return outcome; }
    public List<FailedTarget> getFailures() { return failures; }
    public List<String> getCollisions() { return collisions; }

    public double reviewsPerSecond() {
        return elapsedMillis <= 0 ? 0.0 : reviewsCollected / (elapsedMillis / 1000.0);
    }

    @Override
    public String toString() {
        return "%s (%d attempted, %d succeeded, %d failed, %d skipped, %d reviews in %.1fs)"
                .formatted(outcome, targetsAttempted, targetsSucceeded, targetsFailed, targetsSkipped,
                        reviewsCollected, elapsedMillis / 1000.0);
    }
}
