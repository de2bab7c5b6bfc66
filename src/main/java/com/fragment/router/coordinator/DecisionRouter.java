package com.fragment.router.coordinator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fragment.router.aggregate.AggregationException;
import com.fragment.router.aggregate.MergedResult;
import com.fragment.router.aggregate.ResponseAggregator;
import com.fragment.router.config.RouterConfig;
import com.fragment.router.core.model.QueryRequest;
import com.fragment.router.core.model.QueryType;
import com.fragment.router.core.model.Site;
import com.fragment.router.metrics.MetricsService;
import com.fragment.router.metrics.NoOpMetricsService;
import com.fragment.router.routing.QueryClassifier;
import com.fragment.router.routing.QueryRejectedException;
import com.fragment.router.routing.RoutingError;
import com.fragment.router.routing.RoutingException;
import com.fragment.router.routing.RoutingPlan;
import com.fragment.router.site.FragmentSiteClient;
import com.fragment.router.site.HttpFragmentSiteClient;
import com.fragment.router.site.SiteErrorException;
import com.fragment.router.site.SiteException;
import com.fragment.router.site.SiteRequest;
import com.fragment.router.site.SiteResponse;
import com.fragment.router.site.SiteTimeoutException;
import com.fragment.router.site.SiteUnreachableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The coordinator. Classifies each inbound query and executes the resulting plan
 * against the fragment sites.
 *
 * <ul>
 *   <li>{@code Reject}: fails with {@link QueryRejectedException}; no site is contacted.</li>
 *   <li>{@code Single}: exactly one call; the site's JSON body is returned verbatim.</li>
 *   <li>{@code ScatterGather}: all calls are issued before any is awaited, then the
 *       {@link ResponseAggregator} concatenates them in plan order.</li>
 * </ul>
 *
 * <p>Every site call is bounded by the configured timeout. Holds no per-request state,
 * so one instance serves concurrent queries without locking.</p>
 */
public class DecisionRouter {
    private static final Logger log = LoggerFactory.getLogger(DecisionRouter.class);

    private final QueryClassifier classifier;
    private final Map<Site, FragmentSiteClient> clients;
    private final ResponseAggregator aggregator;
    private final Duration siteTimeout;
    private final FailurePolicy failurePolicy;
    private final MetricsService metrics;
    private final ObjectMapper objectMapper;

    private DecisionRouter(Builder builder) {
        this.classifier = builder.classifier;
        this.clients = new EnumMap<>(builder.clients);
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.aggregator = builder.aggregator != null ? builder.aggregator : new ResponseAggregator(objectMapper);
        this.siteTimeout = builder.siteTimeout;
        this.failurePolicy = builder.failurePolicy;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
    }

    /**
     * Routes a query and waits for the answer.
     *
     * @throws RoutingException describing the rejection or the site/aggregation failure
     */
    public QueryResponse route(QueryRequest request) {
        try {
            return routeAsync(request).join();
        } catch (CompletionException | CancellationException e) {
            throw unwrap(e);
        }
    }

    /**
     * Routes a query without blocking. The future fails with a {@link RoutingException}.
     */
    public CompletableFuture<QueryResponse> routeAsync(QueryRequest request) {
        RoutingPlan plan = classifier.classify(request);
        metrics.recordPlan(QueryType.fromWireName(request.queryType()).orElse(null), plan.kind());
        if (request.year() != null) {
            log.debug("route.yearIgnored year={}", request.year());
        }
        return execute(plan);
    }

    /**
     * Executes an already computed plan.
     */
    public CompletableFuture<QueryResponse> execute(RoutingPlan plan) {
        if (plan instanceof RoutingPlan.Reject reject) {
            metrics.incrementRejected(reject.reason());
            log.info("route.rejected reason={} message='{}'", reject.reason(), reject.message());
            return CompletableFuture.failedFuture(new QueryRejectedException(reject.reason(), reject.message()));
        }
        if (plan instanceof RoutingPlan.Single single) {
            return executeSingle(single);
        }
        return executeScatterGather((RoutingPlan.ScatterGather) plan);
    }

    public QueryClassifier getClassifier() {
        return classifier;
    }

    public Map<Site, FragmentSiteClient> getClients() {
        return Map.copyOf(clients);
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    private CompletableFuture<QueryResponse> executeSingle(RoutingPlan.Single plan) {
        log.debug("route.single site={} path={}", plan.site().getId(), plan.request().pathAndQuery());
        return call(plan.site(), plan.request())
                .thenApply(response -> {
                    requireJson(response);
                    log.info("route.completed plan=single site={}", plan.site().getId());
                    return QueryResponse.complete(response.body(), List.of(plan.site()));
                });
    }

    private CompletableFuture<QueryResponse> executeScatterGather(RoutingPlan.ScatterGather plan) {
        log.debug("route.scatter sites={} path={}", plan.sites(), plan.request().pathAndQuery());

        // Issue every call before waiting on any of them.
        List<CompletableFuture<SiteResponse>> calls = new ArrayList<>(plan.sites().size());
        for (Site site : plan.sites()) {
            calls.add(call(site, plan.request()));
        }

        return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> gather(plan.sites(), calls));
    }

    private QueryResponse gather(List<Site> sites, List<CompletableFuture<SiteResponse>> calls) {
        List<Site> contributing = new ArrayList<>();
        List<ArrayNode> parts = new ArrayList<>();
        List<RoutingException> failures = new ArrayList<>();
        List<Site> failedSites = new ArrayList<>();
        for (int i = 0; i < calls.size(); i++) {
            Site site = sites.get(i);
            try {
                parts.add(aggregator.decode(calls.get(i).join()));
                contributing.add(site);
            } catch (AggregationException e) {
                log.warn("site.payload.rejected site={} message='{}'", site.getId(), e.getMessage());
                failures.add(e);
                failedSites.add(site);
            } catch (CompletionException | CancellationException e) {
                RoutingException cause = unwrap(e);
                if (!(cause instanceof SiteException)) {
                    throw cause;
                }
                failures.add(cause);
                failedSites.add(site);
            }
        }

        if (!failures.isEmpty()
                && (failurePolicy == FailurePolicy.FAIL_REQUEST || parts.isEmpty())) {
            RoutingException first = failures.get(0);
            log.warn("route.failed plan=scatter-gather site={} error={}",
                    failedSites.get(0).getId(), first.getError());
            throw first;
        }

        MergedResult merged = aggregator.merge(contributing, parts, failedSites);
        metrics.recordMergeSize(merged.size());

        JsonNode body = merged.records();
        if (merged.isPartial()) {
            metrics.incrementPartialResult();
            log.warn("route.partial contributing={} failed={}", merged.contributingSites(), failedSites);
            ObjectNode wrapper = objectMapper.createObjectNode();
            wrapper.set("results", merged.records());
            wrapper.put("partial", true);
            wrapper.set("failedSites", objectMapper.valueToTree(
                    failedSites.stream().map(Site::getId).toList()));
            body = wrapper;
        }
        log.info("route.completed plan=scatter-gather sites={} size={}", merged.contributingSites(), merged.size());
        return new QueryResponse(serialize(body), merged.contributingSites(), failedSites);
    }

    private CompletableFuture<SiteResponse> call(Site site, SiteRequest request) {
        FragmentSiteClient client = clients.get(site);
        if (client == null) {
            return CompletableFuture.failedFuture(
                    new SiteUnreachableException(site, "No client configured for site " + site.getId()));
        }

        long start = System.nanoTime();
        CompletableFuture<SiteResponse> pending;
        try {
            pending = client.fetch(request);
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }

        return pending
                .orTimeout(siteTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                    if (error == null) {
                        metrics.recordSiteCall(site, request.query(), "success", elapsed);
                        return response;
                    }
                    SiteException failure = toSiteException(site, error);
                    metrics.recordSiteCall(site, request.query(), failure.getError().name().toLowerCase(), elapsed);
                    log.warn("site.call.failed site={} path={} error={} message='{}'",
                            site.getId(), request.pathAndQuery(), failure.getError(), failure.getMessage());
                    throw failure;
                });
    }

    private void requireJson(SiteResponse response) {
        JsonNode node;
        try {
            node = objectMapper.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException e) {
            throw SiteErrorException.malformed(response.site(), e);
        }
        if (node == null || node.isMissingNode()) {
            throw SiteErrorException.malformed(response.site(), null);
        }
    }

    private String serialize(JsonNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new AggregationException(null, "Merged result could not be serialized", e);
        }
    }

    private SiteException toSiteException(Site site, Throwable error) {
        Throwable cause = rootOf(error);
        if (cause instanceof SiteException siteException) {
            return siteException;
        }
        if (cause instanceof TimeoutException) {
            return new SiteTimeoutException(site, siteTimeout, cause);
        }
        return new SiteErrorException(site, 0,
                "Site " + site.getId() + " call failed: " + cause.getClass().getSimpleName()
                        + (cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
    }

    private static RoutingException unwrap(Throwable error) {
        Throwable cause = rootOf(error);
        if (cause instanceof RoutingException routingException) {
            return routingException;
        }
        return new RoutingException(RoutingError.INTERNAL_ERROR,
                "Query execution failed: " + cause.getClass().getSimpleName(), cause);
    }

    private static Throwable rootOf(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Builds a router with one {@link HttpFragmentSiteClient} per configured site,
     * sharing a single {@link HttpClient}.
     */
    public static DecisionRouter fromConfig(RouterConfig config, MetricsService metrics) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(config.getSiteTimeout())
                .build();
        Builder builder = builder()
                .classifier(new QueryClassifier(config.getDepartment()))
                .siteTimeout(config.getSiteTimeout())
                .failurePolicy(config.getFailurePolicy())
                .metrics(metrics);
        for (Map.Entry<Site, String> entry : config.getSiteUrls().entrySet()) {
            builder.client(HttpFragmentSiteClient.builder()
                    .site(entry.getKey())
                    .baseUrl(entry.getValue())
                    .timeout(config.getSiteTimeout())
                    .httpClient(httpClient)
                    .build());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private QueryClassifier classifier;
        private final Map<Site, FragmentSiteClient> clients = new EnumMap<>(Site.class);
        private ResponseAggregator aggregator;
        private Duration siteTimeout = Duration.ofSeconds(5);
        private FailurePolicy failurePolicy = FailurePolicy.FAIL_REQUEST;
        private MetricsService metrics;
        private ObjectMapper objectMapper;

        public Builder classifier(QueryClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        /**
         * Registers the client for its own site, replacing any previous one.
         */
        public Builder client(FragmentSiteClient client) {
            this.clients.put(client.getSite(), client);
            return this;
        }

        public Builder aggregator(ResponseAggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder siteTimeout(Duration siteTimeout) {
            if (siteTimeout == null || siteTimeout.isZero() || siteTimeout.isNegative()) {
                throw new IllegalArgumentException("siteTimeout must be > 0");
            }
            this.siteTimeout = siteTimeout;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public DecisionRouter build() {
            if (classifier == null) {
                throw new IllegalStateException("classifier is required");
            }
            if (failurePolicy == null) {
                throw new IllegalStateException("failurePolicy is required");
            }
            return new DecisionRouter(this);
        }
    }
}
