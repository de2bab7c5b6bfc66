package com.fragment.router.routing;

import com.fragment.router.core.model.QueryRequest;
import com.fragment.router.core.model.QueryType;
import com.fragment.router.core.model.Site;
import com.fragment.router.core.model.SiteQuery;
import com.fragment.router.partition.PartitionThresholds;
import com.fragment.router.site.SiteRequest;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps an inbound query to a {@link RoutingPlan}. Pure and deterministic: never contacts a site.
 *
 * <p>Rule table:</p>
 * <ul>
 *   <li>unknown query type: {@code Reject(INVALID_QUERY_TYPE)}, regardless of department</li>
 *   <li>department other than the supported one: {@code Reject(UNSUPPORTED_DEPARTMENT)}</li>
 *   <li>{@code course_enrollments}: {@code Single}, Site-A when credits are advanced, else Site-B
 *       (absent credits count as 0)</li>
 *   <li>{@code course_enrollment_details}: {@code ScatterGather} over both sites</li>
 *   <li>{@code faculty_members}: {@code Single} on the replica site (faculty is replicated)</li>
 *   <li>{@code faculty_students}: {@code ScatterGather} over both sites</li>
 * </ul>
 */
public class QueryClassifier {

    private final String supportedDepartment;
    private final Site replicaSite;
    private final List<Site> scatterSites;

    public QueryClassifier(String supportedDepartment) {
        this(supportedDepartment, Site.SITE_A);
    }

    public QueryClassifier(String supportedDepartment, Site replicaSite) {
        this.supportedDepartment = Objects.requireNonNull(supportedDepartment, "supportedDepartment");
        this.replicaSite = Objects.requireNonNull(replicaSite, "replicaSite");
        this.scatterSites = Arrays.asList(Site.values());
    }

    public RoutingPlan classify(QueryRequest request) {
        Optional<QueryType> parsed = QueryType.fromWireName(request.queryType());
        if (parsed.isEmpty()) {
            return new RoutingPlan.Reject(RejectionReason.INVALID_QUERY_TYPE, "Invalid query type");
        }
        QueryType queryType = parsed.get();

        if (!supportedDepartment.equals(request.department())) {
            return new RoutingPlan.Reject(RejectionReason.UNSUPPORTED_DEPARTMENT,
                    "Only " + supportedDepartment + " department queries are supported");
        }

        switch (queryType) {
            case COURSE_ENROLLMENTS:
                if (isBlank(request.courseId())) {
                    return missing("courseId", queryType);
                }
                return new RoutingPlan.Single(queryType, siteForCredits(request.credits()),
                        SiteRequest.of(SiteQuery.COURSE_ENROLLMENTS, request.courseId()));
            case COURSE_ENROLLMENT_DETAILS:
                if (isBlank(request.courseId())) {
                    return missing("courseId", queryType);
                }
                return new RoutingPlan.ScatterGather(queryType, scatterSites,
                        SiteRequest.of(SiteQuery.COURSE_ENROLLMENT_DETAILS, request.courseId()));
            case FACULTY_MEMBERS:
                return new RoutingPlan.Single(queryType, replicaSite, SiteRequest.of(SiteQuery.CS_FACULTY));
            case FACULTY_STUDENTS:
                if (isBlank(request.facultyId())) {
                    return missing("facultyId", queryType);
                }
                return new RoutingPlan.ScatterGather(queryType, scatterSites,
                        SiteRequest.of(SiteQuery.FACULTY_STUDENTS, request.facultyId()));
            default:
                return new RoutingPlan.Reject(RejectionReason.INVALID_QUERY_TYPE, "Invalid query type");
        }
    }

    /**
     * Site holding courses with the given credit count. Mirrors the seeding predicate.
     */
    public static Site siteForCredits(int credits) {
        return PartitionThresholds.isAdvancedCourse(credits) ? Site.SITE_A : Site.SITE_B;
    }

    public String getSupportedDepartment() {
        return supportedDepartment;
    }

    private static RoutingPlan missing(String parameter, QueryType queryType) {
        return new RoutingPlan.Reject(RejectionReason.MISSING_PARAMETER,
                "Parameter '" + parameter + "' is required for " + queryType.getWireName());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
