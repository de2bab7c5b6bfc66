package com.fragment.router.core.model;

/**
 * The fixed query surface every fragment site exposes.
 * Paths and parameter names are owned by the fragment sites and must not change.
 */
public enum SiteQuery {
    COURSE_ENROLLMENTS("/course_enrollments", "courseId"),
    COURSE_ENROLLMENT_DETAILS("/course_enrollment_details", "courseId"),
    CS_FACULTY("/cs_faculty", null),
    FACULTY_STUDENTS("/faculty_students", "facultyId");

    private final String path;
    private final String parameterName;

    SiteQuery(String path, String parameterName) {
        this.path = path;
        this.parameterName = parameterName;
    }

    public String getPath() {
        return path;
    }

    /**
     * Returns the single query-string parameter this endpoint takes, or {@code null} if none.
     */
    public String getParameterName() {
        return parameterName;
    }

    public boolean hasParameter() {
        return parameterName != null;
    }
}
