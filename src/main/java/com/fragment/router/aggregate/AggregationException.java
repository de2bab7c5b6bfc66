package com.fragment.router.aggregate;

import com.fragment.router.core.model.Site;
import com.fragment.router.routing.RoutingError;
import com.fragment.router.routing.RoutingException;

/**
 * Scatter-gather partial results could not be combined, typically because one
 * side's payload is not a JSON array.
 */
public class AggregationException extends RoutingException {

    private final Site site;

    public AggregationException(Site site, String message) {
        super(RoutingError.AGGREGATION_FAILURE, message);
        this.site = site;
    }

    public AggregationException(Site site, String message, Throwable cause) {
        super(RoutingError.AGGREGATION_FAILURE, message, cause);
        this.site = site;
    }

    /**
     * The site whose contribution could not be merged.
     */
    public Site getSite() {
        return site;
    }
}
