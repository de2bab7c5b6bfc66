package com.fragment.router.health;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health of one fragment site or of the coordinator as a whole.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    /**
     * Coordinator health from per-site results, keyed by site name in probe order.
     * Every site UP is UP, every site DOWN is DOWN, any mix is DEGRADED. Each site's
     * result is kept under its name in {@code details}.
     */
    public static HealthStatus combine(Map<String, HealthStatus> bySite) {
        if (bySite.isEmpty()) {
            return new HealthStatus(Status.UP, "No fragment sites registered", Map.of());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        List<String> failing = new ArrayList<>();
        int down = 0;
        for (Map.Entry<String, HealthStatus> site : bySite.entrySet()) {
            HealthStatus result = site.getValue();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", result.status().name());
            entry.put("message", result.message());
            entry.put("details", result.details());
            details.put(site.getKey(), entry);
            if (!result.isUp()) {
                failing.add(site.getKey() + ": " + result.message());
            }
            if (result.isDown()) {
                down++;
            }
        }

        if (failing.isEmpty()) {
            return new HealthStatus(Status.UP, "OK", details);
        }
        Status status = down == bySite.size() ? Status.DOWN : Status.DEGRADED;
        return new HealthStatus(status, String.join("; ", failing), details);
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> newDetails = new LinkedHashMap<>(this.details);
        newDetails.put(key, value);
        return new HealthStatus(this.status, this.message, newDetails);
    }

    /**
     * HTTP status for the health endpoint: 503 only when DOWN.
     */
    public int httpStatus() {
        return status == Status.DOWN ? 503 : 200;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}
