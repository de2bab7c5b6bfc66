package com.fragment.router.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The two autonomous fragment sites.
 *
 * <p>Declaration order is the merge order for scatter-gather results:
 * Site-A contributions always precede Site-B contributions.</p>
 */
public enum Site {
    /** Senior students, advanced courses, completed enrollments. */
    SITE_A("site-a"),
    /** Junior students, basic courses, incomplete enrollments. */
    SITE_B("site-b");

    private final String id;

    Site(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Parses a site by its external id ({@code site-a}) or enum name ({@code SITE_A}).
     */
    public static Optional<Site> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.id.equalsIgnoreCase(normalized) || s.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
