package com.fragment.router.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A site's {@code /course_enrollments} answer: distinct students enrolled in a course
 * within that site's partition.
 */
public record EnrollmentCount(@JsonProperty("enrollment_count") long enrollmentCount) {
}
