package com.fragment.router.site;

import com.fragment.router.core.model.Site;

/**
 * A successful answer from a fragment site: the raw JSON body exactly as received.
 */
public record SiteResponse(Site site, int statusCode, String body) {
}
