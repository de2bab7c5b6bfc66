package com.fragment.router.coordinator;

/**
 * What a scatter-gather does when one site fails and the other succeeds.
 */
public enum FailurePolicy {
    /** Fail the whole request with the failing site's error. */
    FAIL_REQUEST,
    /** Return the surviving site's records, explicitly marked as partial. */
    PARTIAL_RESULT
}
