package com.example.reviewharvester.scraper;

import com.example.reviewharvester.browser.SessionFactory;
import com.example.reviewharvester.io.JsonResultStore;
import com.example.reviewharvester.model.CollectionLog;
import com.example.reviewharvester.model.CollectionResult;
import com.example.reviewharvester.model.FailedTarget;
import com.example.reviewharvester.model.RunOutcome;
import com.example.reviewharvester.model.TargetRecord;
import com.example.reviewharvester.model.TargetResult;
import com.example.reviewharvester.util.Pacing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Windows the target list, skips targets already settled in the store, shards the rest
 * over workers running in parallel and merges what they return into one
 * {@link CollectionResult} plus the run's {@link CollectionLog}.
 */
public class Coordinator {
    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private final HarvestConfig config;
    private final SessionFactory sessions;
    private final JsonResultStore store;
    private final PageDriver driver;
    private final StopSignal stopSignal = new StopSignal();

    public Coordinator(HarvestConfig config, SessionFactory sessions, JsonResultStore store, PageDriver driver) {
        this.config = config;
        this.sessions = sessions;
        this.store = store;
        this.driver = driver;
    }

    public static Coordinator create(HarvestConfig config, SessionFactory sessions, JsonResultStore store)
            throws IOException {
        return new Coordinator(config, sessions, store, PageDriver.create(SiteProfile.load(), config, new Pacing()));
    }

    /** Ask workers to stop after the target they are on. */
    public void stop() {
        if (!stopSignal.isRaised()) {
            log.warn("Stop requested, no further targets will be dispatched");
        }
        stopSignal.raise();
    }

    public StopSignal stopSignal() {
        return stopSignal;
    }

    public CollectionRun run(List<TargetRecord> targets) {
        Instant started = Instant.now();
        List<TargetRecord> window = ShardPlanner.window(targets, config.getStartFrom(), config.getLimit());
        log.info("Window of {} targets (startFrom={}, limit={}) out of {}",
                window.size(), config.getStartFrom(), config.getLimit(), targets.size());

        CollectionResult merged = new CollectionResult();
        List<TargetRecord> pending = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int skipped = 0;
        for (TargetRecord target : window) {
            if (!seen.add(target.getId())) {
                merged.flagCollision(target.getId());
                continue;
            }
            Optional<TargetResult> stored = store.read(target);
            if (stored.isPresent() && (stored.get().getStatus().isSettled() || !config.isRetryFailedOnResume())) {
                merged.put(stored.get());
                skipped++;
                continue;
            }
            pending.add(target);
        }
        if (skipped > 0) {
            log.info("Skipping {} targets already in {}", skipped, store.outputDir());
        }
        return dispatch(ShardPlanner.partition(pending, config.getWorkers()), merged, skipped, started);
    }

    /** Run pre-planned shards as they are, one worker each. Shards must be disjoint. */
    public CollectionRun runShards(List<List<TargetRecord>> shards) {
        return dispatch(shards, new CollectionResult(), 0, Instant.now());
    }

    private CollectionRun dispatch(List<List<TargetRecord>> shards, CollectionResult merged, int skipped,
                                   Instant started) {
        List<WorkerReport> reports = new ArrayList<>();
        int notDispatched = 0;
        int abortedWorkers = 0;

        if (!shards.isEmpty()) {
            log.info("Dispatching {} shards", shards.size());
            ExecutorService pool = Executors.newFixedThreadPool(shards.size(), workerThreads());
            try {
                List<Future<WorkerReport>> futures = new ArrayList<>();
                for (int i = 0; i < shards.size(); i++) {
                    futures.add(pool.submit(new Worker("worker-" + (i + 1), shards.get(i), sessions, driver,
                            store, stopSignal)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    try {
                        WorkerReport report = futures.get(i).get();
                        reports.add(report);
                        merged.merge(report.getResults());
                        notDispatched += report.getNotDispatched();
                    } catch (ExecutionException e) {
                        log.error("worker-{} terminated abnormally", i + 1, e.getCause());
                        abortedWorkers++;
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        stop();
                        log.error("Interrupted while waiting for workers, {} shards not collected", futures.size() - i);
                        abortedWorkers += futures.size() - i;
                        break;
                    }
                }
            } finally {
                pool.shutdown();
            }
        }

        CollectionLog runLog = summarize(started, reports, merged, skipped, notDispatched, abortedWorkers);
        try {
            store.writeRunLog(runLog);
        } catch (IOException e) {
            log.error("Could not write run log: {}", e.getMessage(), e);
        }
        log.info("Run finished: {}", runLog);
        return new CollectionRun(merged, runLog, reports);
    }

    private CollectionLog summarize(Instant started, List<WorkerReport> reports, CollectionResult merged,
                                    int skipped, int notDispatched, int abortedWorkers) {
        int attempted = 0;
        int succeeded = 0;
        int failed = 0;
        int reviews = 0;
        List<FailedTarget> failures = new ArrayList<>();
        for (WorkerReport r : reports) {
            attempted += r.getAttempted();
            succeeded += r.getSucceeded();
            failed += r.getFailed();
            reviews += r.getReviewsCollected();
            failures.addAll(r.getFailures());
        }

        RunOutcome outcome;
        if (notDispatched > 0 || abortedWorkers > 0) {
            outcome = RunOutcome.ABORTED;
        } else if (failed > 0 || !merged.getCollisions().isEmpty()) {
            outcome = RunOutcome.PARTIAL_FAILURES;
        } else {
            outcome = RunOutcome.CLEAN;
        }

        Instant finished = Instant.now();
        return new CollectionLog(started.toString(), finished.toString(),
                Duration.between(started, finished).toMillis(),
                attempted, succeeded, failed, skipped, notDispatched, reviews,
                outcome, failures, merged.getCollisions());
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> new Thread(r, "harvest-worker-" + n.incrementAndGet());
    }
}
