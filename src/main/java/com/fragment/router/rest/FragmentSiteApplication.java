package com.fragment.router.rest;

import com.fragment.router.fragment.FragmentSite;
import jakarta.ws.rs.core.Application;

import java.util.Set;

/**
 * Jakarta RS application exposing one fragment site.
 */
public class FragmentSiteApplication extends Application {

    private final FragmentSiteResource resource;

    public FragmentSiteApplication(FragmentSite site) {
        this.resource = new FragmentSiteResource(site);
    }

    @Override
    public Set<Object> getSingletons() {
        return Set.of(resource);
    }
}
