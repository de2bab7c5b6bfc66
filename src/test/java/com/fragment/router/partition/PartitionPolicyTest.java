package com.fragment.router.partition;

import com.fragment.router.core.model.Course;
import com.fragment.router.core.model.Enrollment;
import com.fragment.router.core.model.EnrollmentStatus;
import com.fragment.router.core.model.Site;
import com.fragment.router.core.model.Student;
import com.fragment.router.routing.QueryClassifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PartitionPolicy")
class PartitionPolicyTest {

    @ParameterizedTest
    @ValueSource(ints = {-1, 0, 1, 2, 3, 4, 10})
    @DisplayName("every year belongs to exactly one site")
    void yearsComplementary(int year) {
        Student student = new Student(1, "S", "CS", year);

        assertNotEquals(PartitionPolicy.SENIOR_ADVANCED.owns(student), PartitionPolicy.JUNIOR_BASIC.owns(student));
        assertEquals(year > 2, PartitionPolicy.SENIOR_ADVANCED.owns(student));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4})
    @DisplayName("every credit count belongs to exactly one site")
    void creditsComplementary(int credits) {
        Course course = new Course(1, 1, "C", credits);

        assertNotEquals(PartitionPolicy.SENIOR_ADVANCED.owns(course), PartitionPolicy.JUNIOR_BASIC.owns(course));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4})
    @DisplayName("course routing agrees with course placement")
    void routingMatchesPlacement(int credits) {
        Course course = new Course(1, 1, "C", credits);
        Site routed = QueryClassifier.siteForCredits(credits);

        assertTrue(PartitionPolicy.forSite(routed).owns(course));
    }

    @Test
    @DisplayName("enrollments split by status")
    void enrollmentStatus() {
        Enrollment done = new Enrollment(1L, 1, 1, "2024-01-01", EnrollmentStatus.DONE);
        Enrollment notDone = new Enrollment(2L, 1, 1, "2024-01-01", EnrollmentStatus.NOT_DONE);

        assertTrue(PartitionPolicy.SENIOR_ADVANCED.owns(done));
        assertFalse(PartitionPolicy.SENIOR_ADVANCED.owns(notDone));
        assertTrue(PartitionPolicy.JUNIOR_BASIC.owns(notDone));
    }

    @Test
    @DisplayName("each site has its own policy")
    void forSite() {
        assertEquals(PartitionPolicy.SENIOR_ADVANCED, PartitionPolicy.forSite(Site.SITE_A));
        assertEquals(PartitionPolicy.JUNIOR_BASIC, PartitionPolicy.forSite(Site.SITE_B));
    }
}
