package com.fragment.router.aggregate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fragment.router.core.model.Site;
import com.fragment.router.site.SiteResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines scatter-gather partial results into one sequence.
 *
 * <p>Merge policy is plain concatenation: no deduplication and no re-sorting. The sites'
 * partitions are disjoint, so the union needs no duplicate check; a site that returns
 * records it does not own produces visible duplicates. Contributions are concatenated in
 * the order given (the plan's site order, Site-A first), never in arrival order, and each
 * site's internal order is preserved.</p>
 */
public class ResponseAggregator {
    private static final Logger log = LoggerFactory.getLogger(ResponseAggregator.class);

    private final ObjectMapper objectMapper;

    public ResponseAggregator() {
        this(new ObjectMapper());
    }

    public ResponseAggregator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Merges complete contributions.
     *
     * @param contributions site responses in plan order
     */
    public MergedResult merge(List<SiteResponse> contributions) {
        return merge(contributions, List.of());
    }

    /**
     * Merges contributions, recording the sites that failed and were skipped.
     *
     * @param contributions site responses in plan order
     * @param failedSites   sites left out of the result
     */
    public MergedResult merge(List<SiteResponse> contributions, List<Site> failedSites) {
        List<ArrayNode> decoded = new ArrayList<>(contributions.size());
        List<Site> sites = new ArrayList<>(contributions.size());
        for (SiteResponse contribution : contributions) {
            decoded.add(decode(contribution));
            sites.add(contribution.site());
        }
        return merge(sites, decoded, failedSites);
    }

    /**
     * Merges contributions that were already decoded, one array per contributing site.
     *
     * @param sites       contributing sites in plan order
     * @param parts       decoded arrays, aligned with {@code sites}
     * @param failedSites sites left out of the result
     */
    public MergedResult merge(List<Site> sites, List<ArrayNode> parts, List<Site> failedSites) {
        if (sites.size() != parts.size()) {
            throw new IllegalArgumentException("Expected one part per site, got "
                    + parts.size() + " parts for " + sites.size() + " sites");
        }
        ArrayNode merged = concat(parts);
        log.debug("aggregate.merged sites={} failed={} size={}", sites, failedSites, merged.size());
        return new MergedResult(merged, sites, failedSites);
    }

    /**
     * Concatenates arrays in the given order. Empty inputs are valid.
     */
    public ArrayNode concat(List<ArrayNode> parts) {
        ArrayNode merged = objectMapper.createArrayNode();
        for (ArrayNode part : parts) {
            merged.addAll(part);
        }
        return merged;
    }

    /**
     * Decodes one site's body as a JSON array.
     *
     * @throws AggregationException if the body is not valid JSON or not an array
     */
    public ArrayNode decode(SiteResponse response) {
        Site site = response.site();
        JsonNode node;
        try {
            node = objectMapper.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException e) {
            throw new AggregationException(site,
                    "Payload from " + site.getId() + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isArray()) {
            throw new AggregationException(site,
                    "Payload from " + site.getId() + " is not a JSON array");
        }
        return (ArrayNode) node;
    }
}
