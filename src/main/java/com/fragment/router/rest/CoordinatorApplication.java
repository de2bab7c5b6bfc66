package com.fragment.router.rest;

import com.fragment.router.coordinator.DecisionRouter;
import com.fragment.router.health.HealthCheckRegistry;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;

import java.util.Set;

/**
 * Jakarta RS application exposing the coordinator.
 */
@OpenAPIDefinition(
        info = @Info(
                title = "Fragment Router API",
                version = "1.0.0",
                description = "Routes academic-records queries across two horizontally fragmented sites " +
                        "and merges scatter-gather results."
        )
)
public class CoordinatorApplication extends Application {

    private final CoordinatorResource resource;

    public CoordinatorApplication(DecisionRouter router, HealthCheckRegistry healthChecks) {
        this.resource = new CoordinatorResource(router, healthChecks);
    }

    @Override
    public Set<Object> getSingletons() {
        return Set.of(resource);
    }
}
