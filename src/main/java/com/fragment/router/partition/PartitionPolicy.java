package com.fragment.router.partition;

import com.fragment.router.core.model.Course;
import com.fragment.router.core.model.Enrollment;
import com.fragment.router.core.model.EnrollmentStatus;
import com.fragment.router.core.model.Site;
import com.fragment.router.core.model.Student;

/**
 * Horizontal fragmentation predicates owned by one site.
 *
 * <p>The two policies are exact complements over year, credits and enrollment status,
 * so every fragmented record satisfies exactly one of them. Faculty is not
 * partitioned.</p>
 */
public enum PartitionPolicy {

    SENIOR_ADVANCED(Site.SITE_A, EnrollmentStatus.DONE) {
        @Override
        public boolean ownsYear(int year) {
            return PartitionThresholds.isSeniorYear(year);
        }

        @Override
        public boolean ownsCredits(int credits) {
            return PartitionThresholds.isAdvancedCourse(credits);
        }
    },

    JUNIOR_BASIC(Site.SITE_B, EnrollmentStatus.NOT_DONE) {
        @Override
        public boolean ownsYear(int year) {
            return !PartitionThresholds.isSeniorYear(year);
        }

        @Override
        public boolean ownsCredits(int credits) {
            return !PartitionThresholds.isAdvancedCourse(credits);
        }
    };

    private final Site site;
    private final EnrollmentStatus enrollmentStatus;

    PartitionPolicy(Site site, EnrollmentStatus enrollmentStatus) {
        this.site = site;
        this.enrollmentStatus = enrollmentStatus;
    }

    public abstract boolean ownsYear(int year);

    public abstract boolean ownsCredits(int credits);

    public Site getSite() {
        return site;
    }

    public EnrollmentStatus getEnrollmentStatus() {
        return enrollmentStatus;
    }

    public boolean owns(Student student) {
        return ownsYear(student.year());
    }

    public boolean owns(Course course) {
        return ownsCredits(course.credits());
    }

    public boolean owns(Enrollment enrollment) {
        return enrollment.status() == enrollmentStatus;
    }

    public static PartitionPolicy forSite(Site site) {
        for (PartitionPolicy policy : values()) {
            if (policy.site == site) {
                return policy;
            }
        }
        throw new IllegalArgumentException("No partition policy for site " + site);
    }
}
