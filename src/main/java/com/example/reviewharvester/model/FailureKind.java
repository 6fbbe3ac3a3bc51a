package com.example.reviewharvester.model;

/**
 * Why a target ended up {@link TargetStatus#FAILED}.
 */
public enum FailureKind {
    NAVIGATION,
    ELEMENT_NOT_FOUND,
    EXECUTION,
    SESSION_CRASH,
    BLOCKED,
    UNEXPECTED
}
