package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.CollectionLog;
import com.example.reviewharvester.model.CollectionResult;

import java.util.List;

/** Merged results of a coordinator run, its log and the per-worker reports behind them. */
public final class CollectionRun {
    private final CollectionResult result;
    private final CollectionLog log;
    private final List<WorkerReport> reports;

    public CollectionRun(CollectionResult result, CollectionLog log, List<WorkerReport> reports) {
        this.result = result;
        this.log = log;
        this.reports = List.copyOf(reports);
    }

    public CollectionResult getResult() { return result; }
    public CollectionLog getLog() { return log; }
    public List<WorkerReport> getReports() { return reports; }
}
