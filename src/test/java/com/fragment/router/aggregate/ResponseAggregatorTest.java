package com.fragment.router.aggregate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fragment.router.core.model.Site;
import com.fragment.router.routing.RoutingError;
import com.fragment.router.site.SiteResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResponseAggregator")
class ResponseAggregatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ResponseAggregator aggregator = new ResponseAggregator(mapper);

    private static SiteResponse a(String body) {
        return new SiteResponse(Site.SITE_A, 200, body);
    }

    private static SiteResponse b(String body) {
        return new SiteResponse(Site.SITE_B, 200, body);
    }

    @Nested
    @DisplayName("merge")
    class Merge {

        @Test
        @DisplayName("keeps each site's internal order, Site-A before Site-B")
        void concatenation() throws Exception {
            MergedResult result = aggregator.merge(List.of(a("[1,2]"), b("[3]")));

            assertEquals("[1,2,3]", mapper.writeValueAsString(result.records()));
            assertEquals(List.of(Site.SITE_A, Site.SITE_B), result.contributingSites());
            assertEquals(3, result.size());
            assertFalse(result.isPartial());
        }

        @Test
        @DisplayName("follows the given order, not site identity")
        void givenOrderWins() throws Exception {
            MergedResult result = aggregator.merge(List.of(b("[3]"), a("[1,2]")));

            assertEquals("[3,1,2]", mapper.writeValueAsString(result.records()));
        }

        @Test
        @DisplayName("does not deduplicate")
        void noDeduplication() {
            MergedResult result = aggregator.merge(List.of(
                    a("[{\"s_id\":1,\"name\":\"X\"}]"), b("[{\"s_id\":1,\"name\":\"X\"}]")));

            assertEquals(2, result.size());
            assertEquals(result.records().get(0), result.records().get(1));
        }

        @Test
        @DisplayName("empty inputs give an empty array")
        void emptyInputs() {
            assertEquals(0, aggregator.merge(List.of(a("[]"), b("[]"))).size());
            assertEquals(0, aggregator.merge(List.of()).size());
            assertEquals(1, aggregator.merge(List.of(a("[]"), b("[9]"))).size());
        }

        @Test
        @DisplayName("records failed sites as partial")
        void partial() {
            MergedResult result = aggregator.merge(List.of(b("[3]")), List.of(Site.SITE_A));

            assertTrue(result.isPartial());
            assertEquals(List.of(Site.SITE_A), result.failedSites());
            assertEquals(List.of(Site.SITE_B), result.contributingSites());
        }
    }

    @Nested
    @DisplayName("decode")
    class Decode {

        @Test
        @DisplayName("rejects an object body")
        void rejectsObject() {
            AggregationException e = assertThrows(AggregationException.class,
                    () -> aggregator.decode(b("{\"enrollment_count\":1}")));

            assertEquals(Site.SITE_B, e.getSite());
            assertEquals(RoutingError.AGGREGATION_FAILURE, e.getError());
        }

        @Test
        @DisplayName("rejects invalid JSON")
        void rejectsInvalidJson() {
            assertThrows(AggregationException.class, () -> aggregator.decode(a("[1,")));
        }

        @Test
        @DisplayName("rejects an empty body")
        void rejectsEmptyBody() {
            assertThrows(AggregationException.class, () -> aggregator.decode(a("")));
            assertThrows(AggregationException.class, () -> aggregator.decode(a(null)));
        }

        @Test
        @DisplayName("returns the array as-is")
        void returnsArray() {
            ArrayNode node = aggregator.decode(a("[{\"f_id\":1}]"));

            assertEquals(1, node.get(0).get("f_id").asInt());
        }
    }
}
