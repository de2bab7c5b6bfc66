package com.fragment.router.site;

import com.fragment.router.core.model.Site;

import java.time.Duration;

/**
 * The site did not answer within the configured bound.
 */
public class SiteTimeoutException extends SiteUnreachableException {

    private final Duration timeout;

    public SiteTimeoutException(Site site, Duration timeout) {
        super(site, "Site " + site.getId() + " did not respond within " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public SiteTimeoutException(Site site, Duration timeout, Throwable cause) {
        super(site, "Site " + site.getId() + " did not respond within " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
