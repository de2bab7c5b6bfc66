package com.fragment.router.config;

import com.fragment.router.coordinator.FailurePolicy;
import com.fragment.router.core.model.Site;
import com.fragment.router.partition.PartitionThresholds;
import org.eclipse.microprofile.config.Config;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable configuration for the decision router: site identity to base address,
 * the per-call timeout, the supported department and the scatter-gather failure policy.
 */
public class RouterConfig {

    public static final String PREFIX = "fragment-router.";
    public static final String DEPARTMENT = PREFIX + "department";
    public static final String SITE_TIMEOUT_MILLIS = PREFIX + "site-timeout-millis";
    public static final String FAILURE_POLICY = PREFIX + "failure-policy";
    public static final String PORT = PREFIX + "port";

    private static final Map<Site, String> DEFAULT_URLS = Map.of(
            Site.SITE_A, "http://localhost:3001",
            Site.SITE_B, "http://localhost:3002");

    private final String department;
    private final Map<Site, String> siteUrls;
    private final Duration siteTimeout;
    private final FailurePolicy failurePolicy;
    private final int port;

    private RouterConfig(Builder builder) {
        this.department = builder.department;
        this.siteUrls = Collections.unmodifiableMap(new EnumMap<>(builder.siteUrls));
        this.siteTimeout = builder.siteTimeout;
        this.failurePolicy = builder.failurePolicy;
        this.port = builder.port;
    }

    public String getDepartment() { return department; }
    public Map<Site, String> getSiteUrls() { return siteUrls; }
    public String getSiteUrl(Site site) { return siteUrls.get(site); }
    public Duration getSiteTimeout() { return siteTimeout; }
    public FailurePolicy getFailurePolicy() { return failurePolicy; }
    public int getPort() { return port; }

    /**
     * Property key holding a site's base URL, e.g. {@code fragment-router.site-a.url}.
     */
    public static String urlKey(Site site) {
        return PREFIX + site.getId() + ".url";
    }

    /**
     * Reads the configuration from MicroProfile Config, falling back to defaults for absent keys.
     */
    public static RouterConfig fromConfig(Config config) {
        Builder builder = builder();
        config.getOptionalValue(DEPARTMENT, String.class).ifPresent(builder::department);
        for (Site site : Site.values()) {
            config.getOptionalValue(urlKey(site), String.class).ifPresent(url -> builder.siteUrl(site, url));
        }
        config.getOptionalValue(SITE_TIMEOUT_MILLIS, Long.class)
                .ifPresent(ms -> builder.siteTimeout(Duration.ofMillis(ms)));
        config.getOptionalValue(FAILURE_POLICY, String.class)
                .ifPresent(p -> builder.failurePolicy(FailurePolicy.valueOf(p.trim().toUpperCase())));
        config.getOptionalValue(PORT, Integer.class).ifPresent(builder::port);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String department = PartitionThresholds.DEFAULT_DEPARTMENT;
        private final Map<Site, String> siteUrls = new EnumMap<>(DEFAULT_URLS);
        private Duration siteTimeout = Duration.ofSeconds(5);
        private FailurePolicy failurePolicy = FailurePolicy.FAIL_REQUEST;
        private int port = 3000;

        public Builder department(String department) {
            if (department == null || department.isBlank()) {
                throw new IllegalArgumentException("department cannot be blank");
            }
            this.department = department;
            return this;
        }

        public Builder siteUrl(Site site, String url) {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("url for " + site.getId() + " cannot be blank");
            }
            this.siteUrls.put(site, url);
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
            if (failurePolicy == null) {
                throw new IllegalArgumentException("failurePolicy cannot be null");
            }
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder port(int port) {
            if (port < 0 || port > 65535) throw new IllegalArgumentException("port must be 0-65535");
            this.port = port;
            return this;
        }

        public RouterConfig build() {
            return new RouterConfig(this);
        }
    }

    @Override
    public String toString() {
        return "RouterConfig{" +
                "department='" + department + '\'' +
                ", siteUrls=" + siteUrls +
                ", siteTimeout=" + siteTimeout +
                ", failurePolicy=" + failurePolicy +
                ", port=" + port +
                '}';
    }
}
