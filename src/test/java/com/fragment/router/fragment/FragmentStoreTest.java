package com.fragment.router.fragment;

import com.fragment.router.core.model.Enrollment;
import com.fragment.router.core.model.EnrollmentStatus;
import com.fragment.router.core.model.Student;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FragmentStore")
class FragmentStoreTest {

    private final FragmentStore store = new FragmentStore();

    @Test
    @DisplayName("keeps the first record for a duplicate id")
    void firstWins() {
        assertTrue(store.insert(new Student(1, "A", "CS", 3)));
        assertFalse(store.insert(new Student(1, "B", "CS", 3)));

        assertEquals("A", store.findStudent(1).orElseThrow().name());
    }

    @Test
    @DisplayName("rejects a second enrollment of the same student in the same course")
    void uniqueEnrollmentPair() {
        assertTrue(store.insert(new Enrollment(1L, 1, 10, "2024-01-01", EnrollmentStatus.DONE)));
        assertFalse(store.insert(new Enrollment(2L, 1, 10, "2024-02-01", EnrollmentStatus.DONE)));
        assertTrue(store.insert(new Enrollment(3L, 1, 11, "2024-02-01", EnrollmentStatus.DONE)));

        assertEquals(2, store.enrollments().size());
    }

    @Test
    @DisplayName("enrollment needs an id")
    void enrollmentNeedsId() {
        assertThrows(IllegalArgumentException.class,
                () -> store.insert(new Enrollment(null, 1, 10, "2024-01-01", EnrollmentStatus.DONE)));
    }

    @Test
    @DisplayName("returned lists are copies")
    void copies() {
        store.insert(new Student(1, "A", "CS", 3));

        store.students().clear();

        assertEquals(1, store.students().size());
    }
}
