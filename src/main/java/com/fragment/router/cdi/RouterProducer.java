package com.fragment.router.cdi;

import com.fragment.router.config.RouterConfig;
import com.fragment.router.coordinator.DecisionRouter;
import com.fragment.router.health.FragmentSiteHealthCheck;
import com.fragment.router.health.HealthCheckRegistry;
import com.fragment.router.metrics.MetricsService;
import com.fragment.router.metrics.MicrometerMetricsService;
import com.fragment.router.metrics.NoOpMetricsService;
import com.fragment.router.site.FragmentSiteClient;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer wiring the coordinator from MicroProfile Config.
 *
 * <h2>Configuration</h2>
 * <pre>
 * fragment-router.department=CS
 * fragment-router.site-a.url=http://localhost:3001
 * fragment-router.site-b.url=http://localhost:3002
 * fragment-router.site-timeout-millis=5000
 * fragment-router.failure-policy=FAIL_REQUEST
 * </pre>
 *
 * <p>A {@link MeterRegistry} bean, when present, switches metrics to Micrometer.
 * The standalone server uses this class directly, without a container.</p>
 */
@ApplicationScoped
public class RouterProducer {

    private static final Logger log = LoggerFactory.getLogger(RouterProducer.class);

    Config config;
    Instance<MeterRegistry> meterRegistry;

    protected RouterProducer() {
    }

    @Inject
    public RouterProducer(Config config, Instance<MeterRegistry> meterRegistry) {
        this.config = config;
        this.meterRegistry = meterRegistry;
    }

    @Produces
    @ApplicationScoped
    public RouterConfig routerConfig() {
        RouterConfig routerConfig = RouterConfig.fromConfig(config);
        log.info("Producing RouterConfig: {}", routerConfig);
        return routerConfig;
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Routing metrics enabled: Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        log.info("Routing metrics disabled");
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public DecisionRouter decisionRouter(RouterConfig routerConfig, MetricsService metrics) {
        log.info("Producing DecisionRouter: department={} sites={} failurePolicy={}",
                routerConfig.getDepartment(), routerConfig.getSiteUrls(), routerConfig.getFailurePolicy());
        return DecisionRouter.fromConfig(routerConfig, metrics);
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(DecisionRouter router, RouterConfig routerConfig) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        for (FragmentSiteClient client : router.getClients().values()) {
            registry.register(new FragmentSiteHealthCheck(client, routerConfig.getSiteTimeout()));
        }
        return registry;
    }
}
