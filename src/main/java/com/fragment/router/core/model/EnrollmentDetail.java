package com.fragment.router.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of a site's {@code /course_enrollment_details} answer.
 */
public record EnrollmentDetail(
        @JsonProperty("student_id") long studentId,
        @JsonProperty("student_name") String studentName,
        @JsonProperty("date") String date,
        @JsonProperty("course_name") String courseName
) {
}
