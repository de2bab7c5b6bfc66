package com.fragment.router.fragment;

import com.fragment.router.core.model.Course;
import com.fragment.router.core.model.Enrollment;
import com.fragment.router.core.model.Faculty;
import com.fragment.router.core.model.Student;

import java.util.List;

/**
 * The shared, unpartitioned source dataset every fragment site is seeded from.
 */
public record Dataset(
        List<Student> students,
        List<Faculty> faculty,
        List<Course> courses,
        List<Enrollment> enrollments
) {
    public Dataset {
        students = students != null ? List.copyOf(students) : List.of();
        faculty = faculty != null ? List.copyOf(faculty) : List.of();
        courses = courses != null ? List.copyOf(courses) : List.of();
        enrollments = enrollments != null ? List.copyOf(enrollments) : List.of();
    }

    public static Dataset empty() {
        return new Dataset(List.of(), List.of(), List.of(), List.of());
    }
}
