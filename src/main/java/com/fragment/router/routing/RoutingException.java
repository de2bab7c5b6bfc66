package com.fragment.router.routing;

/**
 * Base class for every failure the coordinator reports to its caller.
 */
public class RoutingException extends RuntimeException {

    private final RoutingError error;

    public RoutingException(RoutingError error, String message) {
        super(message);
        this.error = error;
    }

    public RoutingException(RoutingError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public RoutingError getError() {
        return error;
    }
}
