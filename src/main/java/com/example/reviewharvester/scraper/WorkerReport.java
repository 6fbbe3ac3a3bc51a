package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.CollectionResult;
import com.example.reviewharvester.model.FailedTarget;

import java.util.List;

/**
 * What a worker hands back once its shard is done: its partial results and the
 * counters it kept locally while processing.
 */
public final class WorkerReport {
    private final String worker;
    private final CollectionResult results;
    private final int attempted;
    private final int succeeded;
    private final int failed;
    private final int reviewsCollected;
    private final int notDispatched;
    private final List<FailedTarget> failures;

    public WorkerReport(String worker, CollectionResult results, int attempted, int succeeded, int failed,
                        int reviewsCollected, int notDispatched, List<FailedTarget> failures) {
        this.worker = worker;
        this.results = results;
        this.attempted = attempted;
        this.succeeded = succeeded;
        this.failed = failed;
        this.reviewsCollected = reviewsCollected;
        this.notDispatched = notDispatched;
        this.failures = List.copyOf(failures);
    }

    public String getWorker() { return worker; }
    public CollectionResult getResults() { return results; }
    public int getAttempted() { return attempted; }
    public int getSucceeded() { return succeeded; }
    public int getFailed() { return failed; }
    public int getReviewsCollected() { return reviewsCollected; }
    public int getNotDispatched() { return notDispatched; }
    public List<FailedTarget> getFailures() { return failures; }
}
