package com.example.reviewharvester.model;

/**
 * Reason the scroll loop stopped loading more reviews.
 */
public enum ScrollTermination {
    /** enough reviews loaded for the requested cap */
    TARGET_REACHED,
    /** loaded count did not grow for K consecutive attempts */
    STAGNATION,
    /** safety valve on total scroll attempts */
    ATTEMPT_CAP
}
