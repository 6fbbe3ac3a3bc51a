package com.example.reviewharvester.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Target id to {@link TargetResult}. Keys are unique; a second result for a key that is
 * already present is never dropped silently but recorded as a collision.
 */
public class CollectionResult {
    private static final Logger log = LoggerFactory.getLogger(CollectionResult.class);

    private final Map<String, TargetResult> results = new LinkedHashMap<>();
    private final List<String> collisions = new ArrayList<>();

    /**
     * Add a result. Returns false (and flags a collision) when the key was already taken;
     * the first result is kept.
     */
    public boolean put(TargetResult result) {
        String key = result.getTargetId();
        if (results.containsKey(key)) {
            collisions.add(key);
            log.error("Invariant violation: target {} produced more than one result, keeping the first", key);
            return false;
        }
        results.put(key, result);
        return true;
    }

    /** Flag a key that showed up twice before any result was produced for the duplicate. */
    public void flagCollision(String key) {
        collisions.add(key);
        log.error("Invariant violation: target {} appears more than once in the input", key);
    }

    /** Merge a worker's partial result into this one. */
    public void merge(CollectionResult partial) {
        for (TargetResult r : partial.results.values()) {
            put(r);
        }
        collisions.addAll(partial.collisions);
    }

    public Optional<TargetResult> get(String targetId) {
        return Optional.ofNullable(results.get(targetId));
    }

    public boolean contains(String targetId) {
        return results.containsKey(targetId);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(results.keySet());
    }

    public Collection<TargetResult> values() {
        return Collections.unmodifiableCollection(results.values());
    }

    public int size() {
        return results.size();
    }

    public List<String> getCollisions() {
        return Collections.unmodifiableList(collisions);
    }
}
