package com.fragment.router.metrics;

import com.fragment.router.core.model.QueryType;
import com.fragment.router.core.model.Site;
import com.fragment.router.core.model.SiteQuery;
import com.fragment.router.routing.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code router.plan} - Counter (tags: queryType, plan); unknown types share the {@code invalid} tag</li>
 *   <li>{@code router.rejected} - Counter (tag: reason)</li>
 *   <li>{@code router.site.call} - Timer (tags: site, query, outcome)</li>
 *   <li>{@code router.merge.size} - DistributionSummary</li>
 *   <li>{@code router.partial} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    static final String INVALID_QUERY_TYPE = "invalid";

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary mergeSizeSummary;
    private final Counter partialCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.mergeSizeSummary = DistributionSummary.builder("router.merge.size")
                .description("Number of records in merged scatter-gather results")
                .register(registry);
        this.partialCounter = Counter.builder("router.partial")
                .description("Scatter-gather responses returned as partial results")
                .register(registry);
    }

    @Override
    public void recordPlan(QueryType queryType, String planKind) {
        String typeTag = queryType != null ? queryType.getWireName() : INVALID_QUERY_TYPE;
        String key = "plan:" + typeTag + ":" + planKind;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("router.plan")
                        .description("Routing plans produced by the classifier")
                        .tag("queryType", typeTag)
                        .tag("plan", planKind)
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementRejected(RejectionReason reason) {
        String key = "rejected:" + reason.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("router.rejected")
                        .description("Queries rejected before any site call")
                        .tag("reason", reason.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void recordSiteCall(Site site, SiteQuery query, String outcome, Duration duration) {
        String key = site.getId() + ":" + query.name() + ":" + outcome;
        timerCache.computeIfAbsent(key, k ->
                Timer.builder("router.site.call")
                        .description("Latency of outbound fragment site calls")
                        .tag("site", site.getId())
                        .tag("query", query.getPath())
                        .tag("outcome", outcome)
                        .register(registry))
                .record(duration);
    }

    @Override
    public void recordMergeSize(int size) {
        mergeSizeSummary.record(size);
    }

    @Override
    public void incrementPartialResult() {
        partialCounter.increment();
    }
}
