package com.example.reviewharvester.scraper;

import com.example.reviewharvester.model.ReviewRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reviews of one target keyed by fingerprint, in first-seen order. Re-reading a node
 * (overshoot, virtualized re-render, a later sort pass) never adds it twice.
 */
public class ReviewAccumulator {
    private final Map<String, ReviewRecord> byFingerprint = new LinkedHashMap<>();

    /** Add a record unless its fingerprint was seen before. */
    public boolean add(ReviewRecord record) {
        return byFingerprint.putIfAbsent(record.getFingerprint(), record) == null;
    }

    /** Add the records not seen before; returns how many were new. */
    public int addAll(Collection<ReviewRecord> batch) {
        int added = 0;
        for (ReviewRecord r : batch) {
            if (add(r)) {
                added++;
            }
        }
        return added;
    }

    public int size() {
        return byFingerprint.size();
    }

    /** Earliest-extracted records first, capped when {@code max} is set. */
    public List<ReviewRecord> snapshot(Integer max) {
        List<ReviewRecord> all = new ArrayList<>(byFingerprint.values());
        if (max != null && all.size() > max) {
            return new ArrayList<>(all.subList(0, max));
        }
        return all;
    }
}
