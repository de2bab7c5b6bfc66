package com.fragment.router.routing;

import com.fragment.router.core.model.QueryType;
import com.fragment.router.core.model.Site;
import com.fragment.router.site.SiteRequest;

import java.util.List;
import java.util.Objects;

/**
 * The classifier's decision of which site(s) to contact, computed without network access.
 */
public sealed interface RoutingPlan permits RoutingPlan.Reject, RoutingPlan.Single, RoutingPlan.ScatterGather {

    /**
     * Short plan name used in logs and metric tags.
     */
    String kind();

    /**
     * Refuse the query locally.
     */
    record Reject(RejectionReason reason, String message) implements RoutingPlan {
        public Reject {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String kind() {
            return "reject";
        }
    }

    /**
     * Forward to exactly one site and pass its answer through unchanged.
     */
    record Single(QueryType queryType, Site site, SiteRequest request) implements RoutingPlan {
        public Single {
            Objects.requireNonNull(site, "site");
            Objects.requireNonNull(request, "request");
        }

        @Override
        public String kind() {
            return "single";
        }
    }

    /**
     * Send the same request to every listed site concurrently and concatenate
     * the answers in list order.
     */
    record ScatterGather(QueryType queryType, List<Site> sites, SiteRequest request) implements RoutingPlan {
        public ScatterGather {
            Objects.requireNonNull(request, "request");
            sites = List.copyOf(sites);
            if (sites.isEmpty()) {
                throw new IllegalArgumentException("ScatterGather needs at least one site");
            }
        }

        @Override
        public String kind() {
            return "scatter-gather";
        }
    }
}
