package com.fragment.router.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fragment.router.coordinator.DecisionRouter;
import com.fragment.router.coordinator.FailurePolicy;
import com.fragment.router.core.model.Site;
import com.fragment.router.fragment.Dataset;
import com.fragment.router.fragment.DatasetLoader;
import com.fragment.router.fragment.FragmentSite;
import com.fragment.router.health.FragmentSiteHealthCheck;
import com.fragment.router.health.HealthCheckRegistry;
import com.fragment.router.partition.PartitionPolicy;
import com.fragment.router.routing.QueryClassifier;
import com.fragment.router.site.FragmentSiteClient;
import com.fragment.router.site.HttpFragmentSiteClient;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two fragment sites and a coordinator over real HTTP on ephemeral ports.
 */
@DisplayName("Coordinator and fragment sites over HTTP")
class EndToEndTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final HttpClient HTTP = HttpClient.newHttpClient();

    private static HttpServer siteAServer;
    private static HttpServer siteBServer;
    private static final List<HttpServer> coordinators = new ArrayList<>();

    @BeforeAll
    static void startSites() {
        Dataset dataset = new DatasetLoader().load("dataset");
        siteAServer = FragmentSiteServer.start(
                FragmentSite.seeded(PartitionPolicy.SENIOR_ADVANCED, "CS", dataset), 0);
        siteBServer = FragmentSiteServer.start(
                FragmentSite.seeded(PartitionPolicy.JUNIOR_BASIC, "CS", dataset), 0);
    }

    @AfterAll
    static void stopAll() {
        coordinators.forEach(server -> server.stop(0));
        siteAServer.stop(0);
        siteBServer.stop(0);
    }

    private static String url(HttpServer server) {
        return "http://localhost:" + server.getAddress().getPort();
    }

    private static HttpServer coordinator(String siteAUrl, String siteBUrl, FailurePolicy policy) {
        FragmentSiteClient a = HttpFragmentSiteClient.builder().site(Site.SITE_A).baseUrl(siteAUrl)
                .timeout(Duration.ofSeconds(2)).build();
        FragmentSiteClient b = HttpFragmentSiteClient.builder().site(Site.SITE_B).baseUrl(siteBUrl)
                .timeout(Duration.ofSeconds(2)).build();
        DecisionRouter router = DecisionRouter.builder()
                .classifier(new QueryClassifier("CS"))
                .client(a)
                .client(b)
                .siteTimeout(Duration.ofSeconds(2))
                .failurePolicy(policy)
                .build();
        HealthCheckRegistry health = new HealthCheckRegistry();
        health.register(new FragmentSiteHealthCheck(a, Duration.ofSeconds(2)));
        health.register(new FragmentSiteHealthCheck(b, Duration.ofSeconds(2)));
        HttpServer server = CoordinatorServer.start(router, health, 0);
        coordinators.add(server);
        return server;
    }

    private static HttpResponse<String> get(HttpServer server, String pathAndQuery) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url(server) + pathAndQuery)).GET().build();
        return HTTP.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static int closedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    @Nested
    @DisplayName("Both sites up")
    class BothSitesUp {

        private final HttpServer coordinator = coordinator(url(siteAServer), url(siteBServer), FailurePolicy.FAIL_REQUEST);

        @Test
        @DisplayName("faculty_students merges Site-A then Site-B")
        void facultyStudents() throws Exception {
            HttpResponse<String> response = get(coordinator, "/?department=CS&queryType=faculty_students&facultyId=1");

            assertEquals(200, response.statusCode());
            JsonNode body = MAPPER.readTree(response.body());
            List<String> names = new ArrayList<>();
            body.forEach(student -> names.add(student.get("name").asText()));
            assertEquals(List.of("Dana Whitfield", "Eli Navarro", "Fay Okafor", "Gus Lindqvist"), names);
        }

        @Test
        @DisplayName("course_enrollments is answered by the credit-selected site")
        void courseEnrollments() throws Exception {
            HttpResponse<String> advanced = get(coordinator,
                    "/?department=CS&queryType=course_enrollments&courseId=101&credits=4");
            HttpResponse<String> basic = get(coordinator,
                    "/?department=CS&queryType=course_enrollments&courseId=102&credits=2");

            assertEquals(2, MAPPER.readTree(advanced.body()).get("enrollment_count").asInt());
            assertEquals(2, MAPPER.readTree(basic.body()).get("enrollment_count").asInt());
        }

        @Test
        @DisplayName("course_enrollment_details merges both sites")
        void enrollmentDetails() throws Exception {
            HttpResponse<String> response = get(coordinator,
                    "/?department=CS&queryType=course_enrollment_details&courseId=101");

            JsonNode body = MAPPER.readTree(response.body());
            assertEquals(2, body.size());
            assertEquals("Distributed Databases", body.get(0).get("course_name").asText());
        }

        @Test
        @DisplayName("faculty_members returns the replicated faculty")
        void facultyMembers() throws Exception {
            HttpResponse<String> response = get(coordinator, "/?department=CS&queryType=faculty_members");

            JsonNode body = MAPPER.readTree(response.body());
            assertEquals(2, body.size());
            assertEquals(1, body.get(0).get("f_id").asInt());
        }

        @Test
        @DisplayName("other departments are rejected with 400")
        void unsupportedDepartment() throws Exception {
            HttpResponse<String> response = get(coordinator, "/?department=MATH&queryType=faculty_members");

            assertEquals(400, response.statusCode());
            assertEquals("UNSUPPORTED_DEPARTMENT", MAPPER.readTree(response.body()).get("error").asText());
        }

        @Test
        @DisplayName("health is UP")
        void health() throws Exception {
            HttpResponse<String> response = get(coordinator, "/health");

            assertEquals(200, response.statusCode());
            assertEquals("UP", MAPPER.readTree(response.body()).get("status").asText());
        }
    }

    @Nested
    @DisplayName("Site-B down")
    class SiteBDown {

        @Test
        @DisplayName("scatter-gather fails with SITE_UNREACHABLE")
        void failRequest() throws Exception {
            HttpServer coordinator = coordinator(url(siteAServer), "http://localhost:" + closedPort(),
                    FailurePolicy.FAIL_REQUEST);

            HttpResponse<String> response = get(coordinator, "/?department=CS&queryType=faculty_students&facultyId=1");

            assertEquals(500, response.statusCode());
            JsonNode body = MAPPER.readTree(response.body());
            assertEquals("SITE_UNREACHABLE", body.get("error").asText());
            assertEquals("site-b", body.get("details").get("site").asText());
        }

        @Test
        @DisplayName("Site-A-only queries still succeed and health is DEGRADED")
        void degraded() throws Exception {
            HttpServer coordinator = coordinator(url(siteAServer), "http://localhost:" + closedPort(),
                    FailurePolicy.FAIL_REQUEST);

            assertEquals(200, get(coordinator, "/?department=CS&queryType=faculty_members").statusCode());
            HttpResponse<String> health = get(coordinator, "/health");
            assertEquals(200, health.statusCode());
            assertEquals("DEGRADED", MAPPER.readTree(health.body()).get("status").asText());
        }

        @Test
        @DisplayName("partial-result policy returns Site-A's records with a header")
        void partialResult() throws Exception {
            HttpServer coordinator = coordinator(url(siteAServer), "http://localhost:" + closedPort(),
                    FailurePolicy.PARTIAL_RESULT);

            HttpResponse<String> response = get(coordinator, "/?department=CS&queryType=faculty_students&facultyId=1");

            assertEquals(200, response.statusCode());
            assertEquals("true", response.headers().firstValue("X-Partial-Result").orElse(null));
            JsonNode body = MAPPER.readTree(response.body());
            assertTrue(body.get("partial").asBoolean());
            assertEquals(2, body.get("results").size());
        }
    }
}
