package com.fragment.router.fragment;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fragment.router.core.model.Course;
import com.fragment.router.core.model.Enrollment;
import com.fragment.router.core.model.Faculty;
import com.fragment.router.core.model.Student;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the source dataset from four JSON array files:
 * {@code students.json}, {@code faculty.json}, {@code courses.json}, {@code enrollments.json}.
 *
 * <p>Files are looked up on the filesystem first, then on the classpath. A missing file
 * yields an empty relation; a malformed one fails the load.</p>
 */
public class DatasetLoader {
    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

    public static final String STUDENTS_FILE = "students.json";
    public static final String FACULTY_FILE = "faculty.json";
    public static final String COURSES_FILE = "courses.json";
    public static final String ENROLLMENTS_FILE = "enrollments.json";

    private final ObjectMapper objectMapper;

    public DatasetLoader() {
        this(new ObjectMapper());
    }

    public DatasetLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the dataset from a directory path or classpath location.
     *
     * @throws UncheckedIOException if a present file cannot be read or parsed
     */
    public Dataset load(String location) {
        List<Student> students = read(location, STUDENTS_FILE, new TypeReference<List<Student>>() {});
        List<Faculty> faculty = read(location, FACULTY_FILE, new TypeReference<List<Faculty>>() {});
        List<Course> courses = read(location, COURSES_FILE, new TypeReference<List<Course>>() {});
        List<Enrollment> enrollments = read(location, ENROLLMENTS_FILE, new TypeReference<List<Enrollment>>() {});
        log.info("dataset.loaded location={} students={} faculty={} courses={} enrollments={}",
                location, students.size(), faculty.size(), courses.size(), enrollments.size());
        return new Dataset(students, faculty, courses, enrollments);
    }

    private <T> List<T> read(String location, String fileName, TypeReference<List<T>> type) {
        Path path = Path.of(location, fileName);
        try {
            if (Files.isRegularFile(path)) {
                try (InputStream in = Files.newInputStream(path)) {
                    return objectMapper.readValue(in, type);
                }
            }
            String resource = location.endsWith("/") ? location + fileName : location + "/" + fileName;
            try (InputStream in = DatasetLoader.class.getClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    log.warn("dataset.missing file={} location={}", fileName, location);
                    return List.of();
                }
                return objectMapper.readValue(in, type);
            }
        } catch (IOException e) {
            log.error("dataset.failed file={} location={} error={}", fileName, location, e.getMessage());
            throw new UncheckedIOException("Cannot read " + fileName + " from " + location, e);
        }
    }
}
