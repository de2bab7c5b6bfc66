package com.fragment.router.site;

import com.fragment.router.core.model.SiteQuery;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One outbound request against a fragment site's fixed query surface.
 */
public record SiteRequest(SiteQuery query, String parameterValue) {

    public SiteRequest {
        Objects.requireNonNull(query, "query");
        if (query.hasParameter() && (parameterValue == null || parameterValue.isBlank())) {
            throw new IllegalArgumentException(query.getPath() + " requires parameter " + query.getParameterName());
        }
        if (!query.hasParameter()) {
            parameterValue = null;
        }
    }

    public static SiteRequest of(SiteQuery query) {
        return new SiteRequest(query, null);
    }

    public static SiteRequest of(SiteQuery query, String parameterValue) {
        return new SiteRequest(query, parameterValue);
    }

    /**
     * Path plus query string, e.g. {@code /course_enrollments?courseId=10}.
     */
    public String pathAndQuery() {
        if (!query.hasParameter()) {
            return query.getPath();
        }
        return query.getPath() + "?" + query.getParameterName() + "="
                + URLEncoder.encode(parameterValue, StandardCharsets.UTF_8);
    }
}
