package com.fragment.router.rest;

import com.fragment.router.coordinator.DecisionRouter;
import com.fragment.router.coordinator.QueryResponse;
import com.fragment.router.core.model.QueryRequest;
import com.fragment.router.health.HealthCheckRegistry;
import com.fragment.router.health.HealthStatus;
import com.fragment.router.logging.LogContext;
import com.fragment.router.rest.dto.ErrorResponse;
import com.fragment.router.routing.RoutingException;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inbound surface of the coordinator.
 *
 * <p>{@code GET /?department=&queryType=&courseId=&facultyId=&credits=&year=}</p>
 *
 * <p>Single-site answers are passed through verbatim. Scatter-gather answers are the
 * merged JSON array, or, under the partial-result policy, an object
 * {@code {results, partial, failedSites}} with header {@value #PARTIAL_HEADER}.</p>
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Query Routing", description = "Route academic-records queries to fragment sites")
public class CoordinatorResource {
    private static final Logger log = LoggerFactory.getLogger(CoordinatorResource.class);

    public static final String PARTIAL_HEADER = "X-Partial-Result";
    private static final String PATH = "/";

    private final DecisionRouter router;
    private final HealthCheckRegistry healthChecks;

    @Inject
    public CoordinatorResource(DecisionRouter router, HealthCheckRegistry healthChecks) {
        this.router = router;
        this.healthChecks = healthChecks;
    }

    @GET
    @Operation(summary = "Run a routed query",
            description = "Classifies the query, contacts one or both fragment sites and returns the answer.")
    @APIResponse(responseCode = "200", description = "Query answered")
    @APIResponse(responseCode = "400", description = "Unsupported department, invalid query type or missing parameter")
    @APIResponse(responseCode = "500", description = "A fragment site failed or results could not be merged")
    public Response query(
            @Parameter(description = "Department, only the supported one is routed") @QueryParam("department") String department,
            @Parameter(description = "course_enrollments | course_enrollment_details | faculty_members | faculty_students")
            @QueryParam("queryType") String queryType,
            @QueryParam("courseId") String courseId,
            @QueryParam("facultyId") String facultyId,
            @Parameter(description = "Course credits, selects the site for course_enrollments") @QueryParam("credits") String credits,
            @Parameter(description = "Reserved, not used for routing") @QueryParam("year") String year) {

        QueryRequest request = QueryRequest.builder()
                .department(department)
                .queryType(queryType)
                .courseId(courseId)
                .facultyId(facultyId)
                .credits(QueryRequest.parseCredits(credits))
                .year(QueryRequest.parseYear(year))
                .build();

        try (LogContext ignored = LogContext.forQuery(LogContext.generateCorrelationId(), queryType)) {
            try {
                QueryResponse response = router.route(request);
                Response.ResponseBuilder builder = Response.ok(response.body(), MediaType.APPLICATION_JSON);
                if (response.isPartial()) {
                    builder.header(PARTIAL_HEADER, "true");
                }
                return builder.build();
            } catch (RoutingException e) {
                if (e.getError().isClientError()) {
                    log.info("query.rejected error={} message='{}'", e.getError(), e.getMessage());
                } else {
                    log.error("query.failed error={} message='{}'", e.getError(), e.getMessage(), e);
                }
                return error(ErrorResponse.from(e, PATH));
            } catch (Exception e) {
                log.error("query.failed error={}", e.getMessage(), e);
                return error(ErrorResponse.internalError(
                        "An internal error occurred. Check server logs for details.", PATH));
            }
        }
    }

    @GET
    @Path("health")
    @Operation(summary = "Fragment site health", description = "Probes every fragment site.")
    @APIResponse(responseCode = "200", description = "All sites UP, or DEGRADED")
    @APIResponse(responseCode = "503", description = "No fragment site reachable")
    public Response health() {
        HealthStatus status = healthChecks.checkAll();
        return Response.status(status.httpStatus()).entity(status).build();
    }

    private static Response error(ErrorResponse body) {
        return Response.status(body.status()).entity(body).type(MediaType.APPLICATION_JSON).build();
    }
}
