package com.fragment.router.site;

import com.fragment.router.core.model.Site;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * {@link FragmentSiteClient} speaking plain HTTP GET to a fragment site.
 *
 * <p>Usage:</p>
 * <pre>
 * HttpFragmentSiteClient client = HttpFragmentSiteClient.builder()
 *     .site(Site.SITE_A)
 *     .baseUrl("http://localhost:3001")
 *     .timeout(Duration.ofSeconds(5))
 *     .build();
 * </pre>
 *
 * <p>Non-2xx answers fail with {@link SiteErrorException}; connection failures and
 * request timeouts fail with {@link SiteUnreachableException} / {@link SiteTimeoutException}.
 * No connection state is kept between requests beyond what {@link HttpClient} pools.</p>
 */
public class HttpFragmentSiteClient implements FragmentSiteClient {
    private static final Logger log = LoggerFactory.getLogger(HttpFragmentSiteClient.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    private static final int MAX_ERROR_BODY_CHARS = 200;

    private final Site site;
    private final URI baseUri;
    private final Duration timeout;
    private final HttpClient httpClient;

    private HttpFragmentSiteClient(Builder builder) {
        this.site = Objects.requireNonNull(builder.site, "site");
        this.baseUri = URI.create(stripTrailingSlash(Objects.requireNonNull(builder.baseUrl, "baseUrl")));
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public Site getSite() {
        return site;
    }

    public URI getBaseUri() {
        return baseUri;
    }

    @Override
    public CompletableFuture<SiteResponse> fetch(SiteRequest request) {
        URI uri = URI.create(baseUri + request.pathAndQuery());
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        log.debug("site.call site={} uri={}", site.getId(), uri);

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw translate(error);
                    }
                    int status = response.statusCode();
                    if (status < 200 || status >= 300) {
                        throw new SiteErrorException(site, status,
                                "Site " + site.getId() + " returned status " + status + ": " + abbreviate(response.body()));
                    }
                    return new SiteResponse(site, status, response.body());
                });
    }

    private SiteException translate(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof SiteException siteException) {
            return siteException;
        }
        if (cause instanceof HttpTimeoutException) {
            return new SiteTimeoutException(site, timeout, cause);
        }
        if (cause instanceof IOException) {
            return new SiteUnreachableException(site,
                    "Site " + site.getId() + " is unreachable at " + baseUri + ": " + describe(cause), cause);
        }
        return new SiteErrorException(site, 0,
                "Site " + site.getId() + " call failed: " + describe(cause), cause);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_ERROR_BODY_CHARS ? body.substring(0, MAX_ERROR_BODY_CHARS) + "..." : body;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Site site;
        private String baseUrl;
        private Duration timeout;
        private HttpClient httpClient;

        public Builder site(Site site) {
            this.site = site;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Shares one {@link HttpClient} across site clients. Optional.
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public HttpFragmentSiteClient build() {
            return new HttpFragmentSiteClient(this);
        }
    }
}
