package com.fragment.router.rest;

import com.fragment.router.core.model.SiteQuery;
import com.fragment.router.fragment.FragmentSite;
import com.fragment.router.logging.LogContext;
import com.fragment.router.rest.dto.ErrorResponse;
import com.fragment.router.site.SiteRequest;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The fixed query surface of one fragment site.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Fragment Site", description = "Partition-local academic-records queries")
public class FragmentSiteResource {
    private static final Logger log = LoggerFactory.getLogger(FragmentSiteResource.class);

    private final FragmentSite site;

    public FragmentSiteResource(FragmentSite site) {
        this.site = site;
    }

    @GET
    @Path("course_enrollments")
    public Response courseEnrollments(@QueryParam("courseId") String courseId) {
        return answer(SiteQuery.COURSE_ENROLLMENTS, courseId);
    }

    @GET
    @Path("course_enrollment_details")
    public Response courseEnrollmentDetails(@QueryParam("courseId") String courseId) {
        return answer(SiteQuery.COURSE_ENROLLMENT_DETAILS, courseId);
    }

    @GET
    @Path("cs_faculty")
    public Response departmentFaculty() {
        return answer(SiteQuery.CS_FACULTY, null);
    }

    @GET
    @Path("faculty_students")
    public Response facultyStudents(@QueryParam("facultyId") String facultyId) {
        return answer(SiteQuery.FACULTY_STUDENTS, facultyId);
    }

    private Response answer(SiteQuery query, String parameter) {
        try (LogContext ignored = LogContext.forSiteRequest(site.getSite().getId(), query.getPath())) {
            if (query.hasParameter() && (parameter == null || parameter.isBlank())) {
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(new ErrorResponse(400, "MISSING_PARAMETER",
                                "Parameter '" + query.getParameterName() + "' is required", query.getPath()))
                        .build();
            }
            try {
                Object result = site.answer(SiteRequest.of(query, parameter));
                log.debug("site.answered path={} parameter={}", query.getPath(), parameter);
                return Response.ok(result).build();
            } catch (Exception e) {
                log.error("site.failed path={} error={}", query.getPath(), e.getMessage(), e);
                return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                        .entity(ErrorResponse.internalError("Internal Server Error", query.getPath()))
                        .build();
            }
        }
    }
}
