package com.fragment.router.metrics;

import com.fragment.router.core.model.QueryType;
import com.fragment.router.core.model.Site;
import com.fragment.router.core.model.SiteQuery;
import com.fragment.router.routing.RejectionReason;

import java.time.Duration;

/**
 * Interface for recording routing metrics.
 * The default {@link NoOpMetricsService} does nothing, so the router works
 * without a meter registry.
 */
public interface MetricsService {

    /**
     * @param queryType parsed query type, or {@code null} when the request named none or an unknown one
     */
    void recordPlan(QueryType queryType, String planKind);

    void incrementRejected(RejectionReason reason);

    /**
     * @param outcome {@code success} or the lower-case routing error name
     */
    void recordSiteCall(Site site, SiteQuery query, String outcome, Duration duration);

    void recordMergeSize(int size);

    void incrementPartialResult();
}
