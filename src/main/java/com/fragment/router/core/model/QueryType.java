package com.fragment.router.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Query kinds accepted on the coordinator's inbound surface.
 */
public enum QueryType {
    COURSE_ENROLLMENTS("course_enrollments"),
    COURSE_ENROLLMENT_DETAILS("course_enrollment_details"),
    FACULTY_MEMBERS("faculty_members"),
    FACULTY_STUDENTS("faculty_students");

    private final String wireName;

    QueryType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Looks up a query type by its exact wire name. Matching is case-sensitive.
     */
    public static Optional<QueryType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value))
                .findFirst();
    }
}
