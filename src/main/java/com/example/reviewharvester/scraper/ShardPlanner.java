package com.example.reviewharvester.scraper;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a target list into disjoint contiguous shards.
 */
public final class ShardPlanner {

    private ShardPlanner() {
    }

    /** The sub-list starting at {@code startFrom} holding at most {@code limit} entries (all when null). */
    public static <T> List<T> window(List<T> items, int startFrom, Integer limit) {
        if (startFrom < 0) {
            throw new IllegalArgumentException("startFrom must be >= 0");
        }
        int from = Math.min(startFrom, items.size());
        int to = limit == null ? items.size() : (int) Math.min(items.size(), (long) from + limit);
        return List.copyOf(items.subList(from, to));
    }

    /**
     * Balanced partition into at most {@code workers} shards; sizes differ by at most one
     * and empty shards are never produced.
     */
    public static <T> List<List<T>> partition(List<T> items, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1");
        }
        int shards = Math.min(workers, items.size());
        List<List<T>> out = new ArrayList<>(shards);
        int start = 0;
        for (int i = 0; i < shards; i++) {
            int size = items.size() / shards + (i < items.size() % shards ? 1 : 0);
            out.add(List.copyOf(items.subList(start, start + size)));
            start += size;
        }
        return out;
    }

    /** Partition with explicit shard sizes, which must add up to the list size. */
    public static <T> List<List<T>> bySizes(List<T> items, int... sizes) {
        int total = 0;
        for (int size : sizes) {
            if (size < 0) {
                throw new IllegalArgumentException("shard sizes must be >= 0");
            }
            total += size;
        }
        if (total != items.size()) {
            throw new IllegalArgumentException("shard sizes add up to " + total + ", expected " + items.size());
        }
        List<List<T>> out = new ArrayList<>(sizes.length);
        int start = 0;
        for (int size : sizes) {
            out.add(List.copyOf(items.subList(start, start + size)));
            start += size;
        }
        return out;
    }
}
