package com.fragment.router.fragment;

import com.fragment.router.core.model.Site;

/**
 * Counts of records a fragment site kept while seeding.
 */
public record LoadResult(
        Site site,
        int students,
        int faculty,
        int courses,
        int enrollments
) {
    public int total() {
        return students + faculty + courses + enrollments;
    }

    @Override
    public String toString() {
        return String.format("LoadResult{site=%s, students=%d, faculty=%d, courses=%d, enrollments=%d}",
                site.getId(), students, faculty, courses, enrollments);
    }
}
