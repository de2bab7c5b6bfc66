package com.fragment.router.health;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the registered checks in registration order and combines them with
 * {@link HealthStatus#combine(Map)}. With one fragment site lost, queries answered
 * by the other site still succeed while scatter-gather queries fail, hence DEGRADED.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new ArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        Map<String, HealthStatus> results = new LinkedHashMap<>();
        for (HealthCheck check : checks) {
            results.put(check.getName(), check.check());
        }
        return HealthStatus.combine(results);
    }

    public int size() {
        return checks.size();
    }
}
