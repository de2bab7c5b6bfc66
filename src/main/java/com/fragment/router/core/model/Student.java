package com.fragment.router.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A student record. Horizontally partitioned by {@code year}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Student(
        @JsonProperty("s_id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("department") String department,
        @JsonProperty("year") int year
) {
}
