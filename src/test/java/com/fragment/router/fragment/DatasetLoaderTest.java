package com.fragment.router.fragment;

import com.fragment.router.core.model.EnrollmentStatus;
import com.fragment.router.partition.PartitionPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DatasetLoader")
class DatasetLoaderTest {

    private final DatasetLoader loader = new DatasetLoader();

    @Test
    @DisplayName("loads the bundled dataset from the classpath")
    void loadsClasspathDataset() {
        Dataset dataset = loader.load("dataset");

        assertEquals(5, dataset.students().size());
        assertEquals(3, dataset.faculty().size());
        assertEquals(5, dataset.courses().size());
        assertEquals(9, dataset.enrollments().size());
        assertEquals(EnrollmentStatus.NOT_DONE, dataset.enrollments().get(2).status());
        assertEquals("Dana Whitfield", dataset.students().get(0).name());
    }

    @Test
    @DisplayName("prefers files on disk and tolerates missing relations")
    void loadsFromDirectory(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve(DatasetLoader.STUDENTS_FILE),
                "[{\"s_id\": 9, \"name\": \"Ivo\", \"department\": \"CS\", \"year\": 1, \"email\": \"x\"}]");

        Dataset dataset = loader.load(dir.toString());

        assertEquals(1, dataset.students().size());
        assertEquals(9L, dataset.students().get(0).id());
        assertTrue(dataset.faculty().isEmpty());
        assertTrue(dataset.enrollments().isEmpty());
    }

    @Test
    @DisplayName("enrollment without a status loads and is seeded on neither site")
    void enrollmentWithoutStatus(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve(DatasetLoader.STUDENTS_FILE),
                "[{\"s_id\": 1, \"name\": \"Ana\", \"department\": \"CS\", \"year\": 4}]");
        Files.writeString(dir.resolve(DatasetLoader.ENROLLMENTS_FILE),
                "[{\"e_id\": 1, \"s_id\": 1, \"c_id\": 10, \"date\": \"2024-01-01\", \"status\": null},"
                        + " {\"e_id\": 2, \"s_id\": 1, \"c_id\": 11, \"date\": \"2024-01-02\"},"
                        + " {\"e_id\": 3, \"s_id\": 1, \"c_id\": 12, \"date\": \"2024-01-03\", \"status\": \"DONE\"}]");

        Dataset dataset = loader.load(dir.toString());

        assertEquals(3, dataset.enrollments().size());
        assertNull(dataset.enrollments().get(0).status());
        assertNull(dataset.enrollments().get(1).status());
        for (PartitionPolicy policy : PartitionPolicy.values()) {
            FragmentStore store = new FragmentStore();
            new FragmentSeeder(policy, "CS").seed(dataset, store);
            assertTrue(store.enrollments().stream().allMatch(e -> e.id() == 3L));
        }
    }

    @Test
    @DisplayName("unknown location yields an empty dataset")
    void unknownLocation() {
        Dataset dataset = loader.load("no-such-dataset");

        assertTrue(dataset.students().isEmpty());
        assertTrue(dataset.courses().isEmpty());
    }

    @Test
    @DisplayName("malformed file fails the load")
    void malformedFile(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve(DatasetLoader.COURSES_FILE), "{not json");

        assertThrows(UncheckedIOException.class, () -> loader.load(dir.toString()));
    }
}
