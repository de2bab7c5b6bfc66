package com.fragment.router.site;

import com.fragment.router.core.model.Site;
import com.fragment.router.routing.RoutingError;
import com.fragment.router.routing.RoutingException;

/**
 * A failure attributable to one fragment site.
 */
public abstract class SiteException extends RoutingException {

    private final Site site;

    protected SiteException(RoutingError error, Site site, String message) {
        super(error, message);
        this.site = site;
    }

    protected SiteException(RoutingError error, Site site, String message, Throwable cause) {
        super(error, message, cause);
        this.site = site;
    }

    public Site getSite() {
        return site;
    }
}
