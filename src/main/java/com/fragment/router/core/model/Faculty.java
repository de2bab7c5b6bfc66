package com.fragment.router.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A faculty record. Replicated identically on every fragment site.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Faculty(
        @JsonProperty("f_id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("department") String department
) {
}
