package com.fragment.router.rest.dto;

import com.fragment.router.aggregate.AggregationException;
import com.fragment.router.routing.RoutingException;
import com.fragment.router.site.SiteErrorException;
import com.fragment.router.site.SiteException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured error body returned for every failed query.
 *
 * @param error   routing error kind, e.g. {@code SITE_UNREACHABLE}
 * @param details extra keys such as {@code site} and {@code siteStatus}; may be empty
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        String timestamp,
        Map<String, String> details
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now().toString(), Map.of());
    }

    public static ErrorResponse from(RoutingException e, String path) {
        Map<String, String> details = new LinkedHashMap<>();
        if (e instanceof SiteException siteException) {
            details.put("site", siteException.getSite().getId());
        }
        if (e instanceof SiteErrorException siteError && !siteError.isMalformedPayload()) {
            details.put("siteStatus", String.valueOf(siteError.getStatusCode()));
        }
        if (e instanceof AggregationException aggregation && aggregation.getSite() != null) {
            details.put("site", aggregation.getSite().getId());
        }
        return new ErrorResponse(e.getError().getHttpStatus(), e.getError().name(), e.getMessage(), path,
                Instant.now().toString(), details);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "INTERNAL_ERROR", message, path);
    }
}
