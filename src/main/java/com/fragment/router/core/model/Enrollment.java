package com.fragment.router.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An enrollment of a student in a course. Partitioned by {@code status}.
 * The id may be absent in source datasets; sites assign one when seeding.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Enrollment(
        @JsonProperty("e_id") Long id,
        @JsonProperty("s_id") long studentId,
        @JsonProperty("c_id") long courseId,
        @JsonProperty("date") String date,
        @JsonProperty("status") EnrollmentStatus status
) {

    public Enrollment withId(long newId) {
        return new Enrollment(newId, studentId, courseId, date, status);
    }
}
