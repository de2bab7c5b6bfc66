package com.fragment.router.routing;

/**
 * Why the classifier refused a query before any site was contacted.
 */
public enum RejectionReason {
    UNSUPPORTED_DEPARTMENT(RoutingError.UNSUPPORTED_DEPARTMENT),
    INVALID_QUERY_TYPE(RoutingError.INVALID_QUERY_TYPE),
    MISSING_PARAMETER(RoutingError.MISSING_PARAMETER);

    private final RoutingError error;

    RejectionReason(RoutingError error) {
        this.error = error;
    }

    public RoutingError getError() {
        return error;
    }
}
