package com.fragment.router.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Domain model")
class ModelTest {

    @Nested
    @DisplayName("QueryType")
    class QueryTypeTest {

        @Test
        @DisplayName("parses wire names exactly")
        void wireNames() {
            assertEquals(Optional.of(QueryType.FACULTY_STUDENTS), QueryType.fromWireName("faculty_students"));
            assertEquals(Optional.of(QueryType.COURSE_ENROLLMENT_DETAILS),
                    QueryType.fromWireName("course_enrollment_details"));
            assertTrue(QueryType.fromWireName("FACULTY_STUDENTS").isEmpty());
            assertTrue(QueryType.fromWireName(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("Site")
    class SiteTest {

        @Test
        @DisplayName("resolves by id or enum name")
        void fromId() {
            assertEquals(Optional.of(Site.SITE_B), Site.fromId("site-b"));
            assertEquals(Optional.of(Site.SITE_A), Site.fromId("SITE_A"));
            assertTrue(Site.fromId("site-c").isEmpty());
        }
    }

    @Nested
    @DisplayName("QueryRequest")
    class QueryRequestTest {

        @Test
        @DisplayName("credits parse leniently to 0")
        void credits() {
            assertEquals(4, QueryRequest.parseCredits(" 4 "));
            assertEquals(0, QueryRequest.parseCredits(null));
            assertEquals(0, QueryRequest.parseCredits("x"));
        }

        @Test
        @DisplayName("year parses to null when absent or invalid")
        void year() {
            assertEquals(Integer.valueOf(3), QueryRequest.parseYear("3"));
            assertNull(QueryRequest.parseYear(""));
            assertNull(QueryRequest.parseYear("third"));
        }
    }

    @Nested
    @DisplayName("JSON mapping")
    class JsonMapping {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        @DisplayName("enrollment status uses its wire value")
        void enrollmentStatus() throws Exception {
            Enrollment enrollment = mapper.readValue(
                    "{\"e_id\":1,\"s_id\":2,\"c_id\":3,\"date\":\"2024-01-01\",\"status\":\"not done\"}",
                    Enrollment.class);

            assertEquals(EnrollmentStatus.NOT_DONE, enrollment.status());
            assertTrue(mapper.writeValueAsString(enrollment).contains("\"status\":\"NOT DONE\""));
        }

        @Test
        @DisplayName("blank or missing status reads as no status")
        void enrollmentStatusAbsent() {
            assertNull(EnrollmentStatus.fromValue(null));
            assertNull(EnrollmentStatus.fromValue(" "));
            assertEquals(EnrollmentStatus.DONE, EnrollmentStatus.fromValue(" done "));
            assertThrows(IllegalArgumentException.class, () -> EnrollmentStatus.fromValue("PENDING"));
        }

        @Test
        @DisplayName("enrollment id may be absent")
        void enrollmentWithoutId() throws Exception {
            Enrollment enrollment = mapper.readValue(
                    "{\"s_id\":2,\"c_id\":3,\"date\":\"2024-01-01\",\"status\":\"DONE\"}", Enrollment.class);

            assertNull(enrollment.id());
            assertEquals(Long.valueOf(7), enrollment.withId(7).id());
        }

        @Test
        @DisplayName("student uses s_id and ignores unknown fields")
        void student() throws Exception {
            Student student = mapper.readValue(
                    "{\"s_id\":5,\"name\":\"N\",\"department\":\"CS\",\"year\":2,\"gpa\":3.1}", Student.class);

            assertEquals(5L, student.id());
            assertTrue(mapper.writeValueAsString(student).contains("\"s_id\":5"));
        }

        @Test
        @DisplayName("enrollment count serializes as enrollment_count")
        void enrollmentCount() throws Exception {
            assertEquals("{\"enrollment_count\":3}", mapper.writeValueAsString(new EnrollmentCount(3)));
        }
    }
}
