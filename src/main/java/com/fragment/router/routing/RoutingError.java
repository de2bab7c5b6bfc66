package com.fragment.router.routing;

/**
 * Client-visible failure kinds. Each maps to a fixed HTTP status.
 */
public enum RoutingError {
    UNSUPPORTED_DEPARTMENT(400),
    INVALID_QUERY_TYPE(400),
    MISSING_PARAMETER(400),
    SITE_UNREACHABLE(500),
    SITE_ERROR(500),
    AGGREGATION_FAILURE(500),
    INTERNAL_ERROR(500);

    private final int httpStatus;

    RoutingError(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isClientError() {
        return httpStatus >= 400 && httpStatus < 500;
    }
}
