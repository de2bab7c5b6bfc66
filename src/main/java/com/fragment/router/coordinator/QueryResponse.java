package com.fragment.router.coordinator;

import com.fragment.router.core.model.Site;

import java.util.List;

/**
 * The coordinator's answer to one inbound query.
 *
 * @param body        JSON body to return to the client; verbatim site body for single-site plans
 * @param sites       sites whose data is in the body, in merge order
 * @param failedSites sites left out of a partial result; empty for complete results
 */
public record QueryResponse(String body, List<Site> sites, List<Site> failedSites) {

    public QueryResponse {
        sites = List.copyOf(sites);
        failedSites = failedSites != null ? List.copyOf(failedSites) : List.of();
    }

    public static QueryResponse complete(String body, List<Site> sites) {
        return new QueryResponse(body, sites, List.of());
    }

    public boolean isPartial() {
        return !failedSites.isEmpty();
    }
}
