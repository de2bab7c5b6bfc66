package com.fragment.router.health;

/**
 * A probe for one dependency of the coordinator.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
