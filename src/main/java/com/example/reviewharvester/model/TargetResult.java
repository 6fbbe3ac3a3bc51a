package com.example.reviewharvester.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-target outcome: the deduplicated reviews in extraction order plus status.
 * Owned by the worker that produced it until handed to the coordinator.
 */
public final class TargetResult {
    private final String targetId;
    private final String name;
    private final String address;
    private final String grid;
    private final Double rating;
    private final Integer knownReviewCount;
    private final String phoneNumber;

    private final TargetStatus status;
    private final boolean sortApplied;
    private final ScrollTermination termination;
    private final FailureKind failureKind;
    private final String errorDetail;
    private final String collectedAt;

    private final int reviewCount;
    private final List<ReviewRecord> reviews;

    private TargetResult(TargetRecord target, TargetStatus status, boolean sortApplied,
                         ScrollTermination termination, FailureKind failureKind, String errorDetail,
                         List<ReviewRecord> reviews) {
        this.targetId = target.getId();
        this.name = target.getName();
        this.address = target.getAddress();
        this.grid = target.getGrid();
        this.rating = target.getRating();
        this.knownReviewCount = target.getKnownReviewCount();
        this.phoneNumber = target.getPhoneNumber();
        this.status = status;
        this.sortApplied = sortApplied;
        this.termination = termination;
        this.failureKind = failureKind;
        this.errorDetail = errorDetail;
        this.collectedAt = Instant.now().toString();
        this.reviews = Collections.unmodifiableList(new ArrayList<>(reviews));
        this.reviewCount = this.reviews.size();
    }

    public static TargetResult finished(TargetRecord target, TargetStatus status, boolean sortApplied,
                                        ScrollTermination termination, List<ReviewRecord> reviews) {
        if (status == TargetStatus.FAILED) {
            throw new IllegalArgumentException("use failed(...) for failed targets");
        }
        return new TargetResult(target, status, sortApplied, termination, null, null, reviews);
    }

    public static TargetResult failed(TargetRecord target, FailureKind kind, String detail,
                                      boolean sortApplied, List<ReviewRecord> partialReviews) {
        return new TargetResult(target, TargetStatus.FAILED, sortApplied, null, kind, detail, partialReviews);
    }

    public String getTargetId() { return targetId; }
    public String getName() { return name; }
    public String getAddress() { return address; }
    public String getGrid() { return grid; }
    public Double getRating() { return rating; }
    public Integer getKnownReviewCount() { return knownReviewCount; }
    public String getPhoneNumber() { return phoneNumber; }
    public TargetStatus getStatus() { return status; }
    public boolean isSortApplied() { return sortApplied; }
    public ScrollTermination getTermination() { return termination; }
    public FailureKind getFailureKind() { return failureKind; }
    public String getErrorDetail() { return errorDetail; }
    public String getCollectedAt() { return collectedAt; }
    public int getReviewCount() { return reviewCount; }

    public List<ReviewRecord> getReviews() {
        // results loaded from disk by Gson bypass the constructor
        return reviews == null ? List.of() : reviews;
    }

    @Override
    public String toString() {
        return status == TargetStatus.FAILED
                ? "%s FAILED (%s: %s)".formatted(targetId, failureKind, errorDetail)
                : "%s %s (%d reviews, sort %s)".formatted(targetId, status, reviewCount,
                        sortApplied ? "applied" : "unavailable");
    }
}
