package com.fragment.router.server;

import com.fragment.router.cdi.RouterProducer;
import com.fragment.router.config.RouterConfig;
import com.fragment.router.coordinator.DecisionRouter;
import com.fragment.router.health.HealthCheckRegistry;
import com.fragment.router.rest.CoordinatorApplication;
import com.sun.net.httpserver.HttpServer;
import org.eclipse.microprofile.config.ConfigProvider;
import org.glassfish.jersey.jackson.JacksonFeature;
import org.glassfish.jersey.jdkhttp.JdkHttpServerFactory;
import org.glassfish.jersey.server.ResourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * Runs the coordinator on the JDK HTTP server. Configuration comes from
 * MicroProfile Config ({@code META-INF/microprofile-config.properties}, system
 * properties, environment).
 */
public final class CoordinatorServer {
    private static final Logger log = LoggerFactory.getLogger(CoordinatorServer.class);

    private CoordinatorServer() {
    }

    /**
     * Starts the coordinator. Port 0 binds an ephemeral port.
     */
    public static HttpServer start(DecisionRouter router, HealthCheckRegistry healthChecks, int port) {
        ResourceConfig resourceConfig = ResourceConfig.forApplication(new CoordinatorApplication(router, healthChecks))
                .register(JacksonFeature.class);
        HttpServer server = JdkHttpServerFactory.createHttpServer(
                URI.create("http://localhost:" + port + "/"), resourceConfig);
        log.info("Coordinator running on port {}", server.getAddress().getPort());
        return server;
    }

    public static void main(String[] args) {
        RouterProducer producer = new RouterProducer(ConfigProvider.getConfig(), null);
        RouterConfig config = producer.routerConfig();
        DecisionRouter router = producer.decisionRouter(config, producer.metricsService());
        HealthCheckRegistry healthChecks = producer.healthCheckRegistry(router, config);

        HttpServer server = start(router, healthChecks, config.getPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Stopping coordinator");
            server.stop(0);
        }, "coordinator-shutdown"));
    }
}
