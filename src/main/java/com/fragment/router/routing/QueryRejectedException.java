package com.fragment.router.routing;

/**
 * Raised when a {@link RoutingPlan.Reject} plan is executed. No site was contacted.
 */
public class QueryRejectedException extends RoutingException {

    private final RejectionReason reason;

    public QueryRejectedException(RejectionReason reason, String message) {
        super(reason.getError(), message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
