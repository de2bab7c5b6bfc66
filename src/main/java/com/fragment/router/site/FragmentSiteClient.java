package com.fragment.router.site;

import com.fragment.router.core.model.Site;

import java.util.concurrent.CompletableFuture;

/**
 * Client for one fragment site.
 *
 * <p>This is the seam where a resilience layer (retry, circuit breaking) can be
 * added by decoration without touching classification or aggregation.</p>
 *
 * <p>Implementations must not block the calling thread. The returned future completes
 * with a 2xx {@link SiteResponse}, or exceptionally with a {@link SiteException}
 * naming this client's site.</p>
 */
public interface FragmentSiteClient {

    /**
     * The site this client talks to.
     */
    Site getSite();

    /**
     * Issues the request asynchronously.
     *
     * @param request the site query and its parameter
     * @return future holding the raw response, or failing with a {@link SiteException}
     */
    CompletableFuture<SiteResponse> fetch(SiteRequest request);
}
