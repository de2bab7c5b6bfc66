package com.fragment.router.partition;

/**
 * Partition boundaries shared by the query classifier and the fragment seeding policy.
 *
 * <p>Routing must mirror fragment membership exactly: a course with
 * {@code credits > ADVANCED_CREDITS_THRESHOLD} lives on Site-A and nowhere else.
 * Changing a value here changes both sides at once.</p>
 */
public final class PartitionThresholds {

    /** Courses with more credits than this are advanced (Site-A). */
    public static final int ADVANCED_CREDITS_THRESHOLD = 2;

    /** Students with a year above this are seniors (Site-A). */
    public static final int SENIOR_YEAR_THRESHOLD = 2;

    /** The only department whose records are fragmented across the sites. */
    public static final String DEFAULT_DEPARTMENT = "CS";

    private PartitionThresholds() {
    }

    public static boolean isAdvancedCourse(int credits) {
        return credits > ADVANCED_CREDITS_THRESHOLD;
    }

    public static boolean isSeniorYear(int year) {
        return year > SENIOR_YEAR_THRESHOLD;
    }
}
