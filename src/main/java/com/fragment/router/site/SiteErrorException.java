package com.fragment.router.site;

import com.fragment.router.core.model.Site;
import com.fragment.router.routing.RoutingError;

/**
 * The site answered, but with a non-success status or a payload that is not valid JSON.
 */
public class SiteErrorException extends SiteException {

    /** Status code reported when the status was fine but the body was malformed. */
    public static final int MALFORMED_PAYLOAD = -1;

    private final int statusCode;

    public SiteErrorException(Site site, int statusCode, String message) {
        super(RoutingError.SITE_ERROR, site, message);
        this.statusCode = statusCode;
    }

    public SiteErrorException(Site site, int statusCode, String message, Throwable cause) {
        super(RoutingError.SITE_ERROR, site, message, cause);
        this.statusCode = statusCode;
    }

    public static SiteErrorException malformed(Site site, Throwable cause) {
        return new SiteErrorException(site, MALFORMED_PAYLOAD,
                "Site " + site.getId() + " returned a malformed payload", cause);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isMalformedPayload() {
        return statusCode == MALFORMED_PAYLOAD;
    }
}
