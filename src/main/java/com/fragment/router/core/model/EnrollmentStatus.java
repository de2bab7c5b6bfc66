package com.fragment.router.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enrollment completion status, serialized as {@code "DONE"} / {@code "NOT DONE"}.
 * A missing status is {@code null} and is owned by no site.
 */
public enum EnrollmentStatus {
    DONE("DONE"),
    NOT_DONE("NOT DONE");

    private final String value;

    EnrollmentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EnrollmentStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (EnrollmentStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown enrollment status: " + value);
    }
}
