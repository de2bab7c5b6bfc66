package com.fragment.router.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A course record. Horizontally partitioned by {@code credits}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Course(
        @JsonProperty("c_id") long id,
        @JsonProperty("f_id") long facultyId,
        @JsonProperty("name") String name,
        @JsonProperty("credits") int credits
) {
}
