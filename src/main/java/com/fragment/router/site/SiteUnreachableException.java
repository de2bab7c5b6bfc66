package com.fragment.router.site;

import com.fragment.router.core.model.Site;
import com.fragment.router.routing.RoutingError;

/**
 * The site could not be reached: connection refused, reset, DNS failure or timeout.
 */
public class SiteUnreachableException extends SiteException {

    public SiteUnreachableException(Site site, String message) {
        super(RoutingError.SITE_UNREACHABLE, site, message);
    }

    public SiteUnreachableException(Site site, String message, Throwable cause) {
        super(RoutingError.SITE_UNREACHABLE, site, message, cause);
    }
}
