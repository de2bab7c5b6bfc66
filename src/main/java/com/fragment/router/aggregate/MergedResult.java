package com.fragment.router.aggregate;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fragment.router.core.model.Site;

import java.util.List;

/**
 * Output of a scatter-gather merge.
 *
 * @param records           concatenated records, contributing sites in plan order
 * @param contributingSites sites whose records are included, in merge order
 * @param failedSites       sites that failed and were left out; empty unless partial
 */
public record MergedResult(ArrayNode records, List<Site> contributingSites, List<Site> failedSites) {

    public MergedResult {
        contributingSites = List.copyOf(contributingSites);
        failedSites = failedSites != null ? List.copyOf(failedSites) : List.of();
    }

    public boolean isPartial() {
        return !failedSites.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
