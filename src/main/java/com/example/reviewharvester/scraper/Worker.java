package com.example.reviewharvester.scraper;

import com.example.reviewharvester.browser.BrowserSession;
import com.example.reviewharvester.browser.SessionFactory;
import com.example.reviewharvester.io.JsonResultStore;
import com.example.reviewharvester.model.CollectionResult;
import com.example.reviewharvester.model.FailedTarget;
import com.example.reviewharvester.model.FailureKind;
import com.example.reviewharvester.model.TargetRecord;
import com.example.reviewharvester.model.TargetResult;
import com.example.reviewharvester.model.TargetStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Processes one shard sequentially with its own browser session. Each finished target
 * is written to the store right away. A crashed session is replaced before the next
 * target; no failure of a single target ends the shard.
 */
public class Worker implements Callable<WorkerReport> {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final String name;
    private final List<TargetRecord> shard;
    private final SessionFactory sessions;
    private final PageDriver driver;
    private final JsonResultStore store;
    private final StopSignal stop;

    private final CollectionResult results = new CollectionResult();
    private final List<FailedTarget> failures = new ArrayList<>();
    private int attempted;
    private int succeeded;
    private int failed;
    private int reviews;

    private BrowserSession session;

    public Worker(String name, List<TargetRecord> shard, SessionFactory sessions, PageDriver driver,
                  JsonResultStore store, StopSignal stop) {
        this.name = name;
        this.shard = List.copyOf(shard);
        this.sessions = sessions;
        this.driver = driver;
        this.store = store;
        this.stop = stop;
    }

    @Override
    public WorkerReport call() {
        MDC.put("worker", name);
        int notDispatched = 0;
        try {
            log.info("Starting shard of {} targets", shard.size());
            for (int i = 0; i < shard.size(); i++) {
                if (stop.isRaised() || Thread.currentThread().isInterrupted()) {
                    notDispatched = shard.size() - i;
                    log.warn("Stop requested, leaving {} targets undispatched", notDispatched);
                    break;
                }
                TargetRecord target = shard.get(i);
                MDC.put("target", target.getId());
                try {
                    log.info("[{}/{}] {}", i + 1, shard.size(), target.label());
                    record(process(target));
                } finally {
                    MDC.remove("target");
                }
            }
            log.info("Shard done: {} succeeded, {} failed, {} reviews", succeeded, failed, reviews);
        } finally {
            closeSession();
            MDC.remove("worker");
        }
        return new WorkerReport(name, results, attempted, succeeded, failed, reviews, notDispatched, failures);
    }

    private TargetResult process(TargetRecord target) {
        TargetResult result;
        try {
            result = driver.harvest(target, session());
        } catch (HarvestException e) {
            log.error("Could not open a browser session: {}", e.getMessage());
            result = TargetResult.failed(target, e.kind(), "session: " + e.getMessage(), false, List.of());
        } catch (RuntimeException e) {
            log.error("Unexpected failure", e);
            result = TargetResult.failed(target, FailureKind.UNEXPECTED, e.toString(), false, List.of());
        }
        if (result.getFailureKind() == FailureKind.SESSION_CRASH) {
            log.warn("Browser session lost, a fresh one will be opened for the next target");
            closeSession();
        }
        return result;
    }

    private BrowserSession session() throws HarvestException {
        if (session != null && !session.isAlive()) {
            log.warn("Browser session stopped responding, replacing it");
            closeSession();
        }
        if (session == null) {
            session = sessions.open();
        }
        return session;
    }

    private void closeSession() {
        if (session != null) {
            session.close();
            session = null;
        }
    }

    private void record(TargetResult result) {
        attempted++;
        if (result.getStatus() == TargetStatus.FAILED) {
            failed++;
            failures.add(new FailedTarget(result.getTargetId(), result.getFailureKind(), result.getErrorDetail()));
        } else {
            succeeded++;
        }
        reviews += result.getReviewCount();
        results.put(result);
        try {
            store.write(result);
        } catch (IOException e) {
            log.error("Could not persist result for {}: {}", result.getTargetId(), e.getMessage(), e);
        }
    }
}
