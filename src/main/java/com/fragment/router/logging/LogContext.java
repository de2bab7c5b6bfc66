package com.fragment.router.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Entries are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forQuery(LogContext.generateCorrelationId(), "faculty_students")) {
 *     log.info("route.completed plan={}", plan.kind());
 * }
 * </pre>
 *
 * <p>MDC is thread-bound: entries set here are visible to logging on the request
 * thread, not inside site-call callbacks running on other threads.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one inbound coordinator query.
     */
    public static LogContext forQuery(String correlationId, String queryType) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("queryType", queryType != null ? queryType : "none");
        ctx.put("operation", "route");
        return ctx;
    }

    /**
     * Context for one request served by a fragment site.
     */
    public static LogContext forSiteRequest(String siteId, String path) {
        LogContext ctx = new LogContext();
        ctx.put("site", siteId);
        ctx.put("path", path);
        ctx.put("operation", "site-query");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
