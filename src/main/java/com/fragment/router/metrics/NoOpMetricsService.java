package com.fragment.router.metrics;

import com.fragment.router.core.model.QueryType;
import com.fragment.router.core.model.Site;
import com.fragment.router.core.model.SiteQuery;
import com.fragment.router.routing.RejectionReason;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordPlan(QueryType queryType, String planKind) {}

    @Override
    public void incrementRejected(RejectionReason reason) {}

    @Override
    public void recordSiteCall(Site site, SiteQuery query, String outcome, Duration duration) {}

    @Override
    public void recordMergeSize(int size) {}

    @Override
    public void incrementPartialResult() {}
}
