package com.fragment.router.health;

import com.fragment.router.core.model.SiteQuery;
import com.fragment.router.site.FragmentSiteClient;
import com.fragment.router.site.SiteException;
import com.fragment.router.site.SiteRequest;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Probes a fragment site with its replicated faculty query and measures latency.
 */
public class FragmentSiteHealthCheck implements HealthCheck {

    private final FragmentSiteClient client;
    private final Duration timeout;

    public FragmentSiteHealthCheck(FragmentSiteClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    @Override
    public String getName() {
        return client.getSite().getId();
    }

    @Override
    public HealthStatus check() {
        long startMs = System.currentTimeMillis();
        try {
            client.fetch(SiteRequest.of(SiteQuery.CS_FACULTY))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            long latencyMs = System.currentTimeMillis() - startMs;
            return HealthStatus.up().withDetail("latencyMs", latencyMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthStatus.down("Health probe interrupted");
        } catch (TimeoutException e) {
            return HealthStatus.down("No response within " + timeout.toMillis() + "ms")
                    .withDetail("error", "TIMEOUT");
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String error = cause instanceof SiteException siteException
                    ? siteException.getError().name()
                    : cause.getClass().getSimpleName();
            return HealthStatus.down("Site probe failed: " + cause.getMessage())
                    .withDetail("error", error);
        } catch (RuntimeException e) {
            return HealthStatus.down("Site probe failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
