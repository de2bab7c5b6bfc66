package com.fragment.router.core.model;

/**
 * An inbound coordinator query, exactly as received.
 *
 * <p>{@code queryType} stays a raw string so that unknown kinds can be rejected by the
 * classifier instead of failing at the transport layer. {@code credits} defaults to 0
 * when absent or unparseable. {@code year} is accepted but reserved: no routing
 * decision reads it.</p>
 */
public record QueryRequest(
        String department,
        String queryType,
        String courseId,
        String facultyId,
        int credits,
        Integer year
) {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses a credits value leniently: blank or non-numeric input yields 0.
     */
    public static int parseCredits(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Parses the reserved year parameter; returns {@code null} when absent or unparseable.
     */
    public static Integer parseYear(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static class Builder {
        private String department;
        private String queryType;
        private String courseId;
        private String facultyId;
        private int credits;
        private Integer year;

        public Builder department(String department) {
            this.department = department;
            return this;
        }

        public Builder queryType(String queryType) {
            this.queryType = queryType;
            return this;
        }

        public Builder queryType(QueryType queryType) {
            this.queryType = queryType.getWireName();
            return this;
        }

        public Builder courseId(String courseId) {
            this.courseId = courseId;
            return this;
        }

        public Builder facultyId(String facultyId) {
            this.facultyId = facultyId;
            return this;
        }

        public Builder credits(int credits) {
            this.credits = credits;
            return this;
        }

        public Builder year(Integer year) {
            this.year = year;
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(department, queryType, courseId, facultyId, credits, year);
        }
    }
}
