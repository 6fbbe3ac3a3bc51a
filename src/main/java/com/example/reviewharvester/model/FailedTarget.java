package com.example.reviewharvester.model;

/** Entry in the run log for a target that ended Failed. */
public final class FailedTarget {
    private final String targetId;
    private final FailureKind kind;
    private final String detail;

    public FailedTarget(String targetId, FailureKind kind, String detail) {
        this.targetId = targetId;
        this.kind = kind;
        this.detail = detail;
    }

    public String getTargetId() { return targetId; }
    public FailureKind getKind() { return kind; }
    public String getDetail() { return detail; }

    @Override
    public String toString() {
        return targetId + " [" + kind + "] " + detail;
    }
}
