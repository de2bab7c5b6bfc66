package com.fragment.router.fragment;

import com.fragment.router.core.model.Course;
import com.fragment.router.core.model.Enrollment;
import com.fragment.router.core.model.Faculty;
import com.fragment.router.core.model.Student;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory relational slice held by one fragment site.
 *
 * <p>Inserts ignore records whose key is already present (first wins); enrollments are
 * also unique per (student, course). Reads return records in insertion order.</p>
 */
public class FragmentStore {

    private final Map<Long, Student> students = new LinkedHashMap<>();
    private final Map<Long, Faculty> faculty = new LinkedHashMap<>();
    private final Map<Long, Course> courses = new LinkedHashMap<>();
    private final Map<Long, Enrollment> enrollments = new LinkedHashMap<>();
    private final Map<String, Long> enrollmentKeys = new LinkedHashMap<>();

    public synchronized boolean insert(Student student) {
        return students.putIfAbsent(student.id(), student) == null;
    }

    public synchronized boolean insert(Faculty member) {
        return faculty.putIfAbsent(member.id(), member) == null;
    }

    public synchronized boolean insert(Course course) {
        return courses.putIfAbsent(course.id(), course) == null;
    }

    /**
     * Inserts an enrollment. Its id must already be assigned.
     */
    public synchronized boolean insert(Enrollment enrollment) {
        if (enrollment.id() == null) {
            throw new IllegalArgumentException("Enrollment id must be assigned before insert");
        }
        String key = enrollment.studentId() + ":" + enrollment.courseId();
        if (enrollments.containsKey(enrollment.id()) || enrollmentKeys.containsKey(key)) {
            return false;
        }
        enrollments.put(enrollment.id(), enrollment);
        enrollmentKeys.put(key, enrollment.id());
        return true;
    }

    public synchronized Optional<Student> findStudent(long id) {
        return Optional.ofNullable(students.get(id));
    }

    public synchronized Optional<Faculty> findFaculty(long id) {
        return Optional.ofNullable(faculty.get(id));
    }

    public synchronized Optional<Course> findCourse(long id) {
        return Optional.ofNullable(courses.get(id));
    }

    public synchronized List<Student> students() {
        return new ArrayList<>(students.values());
    }

    public synchronized List<Faculty> faculty() {
        return new ArrayList<>(faculty.values());
    }

    public synchronized List<Course> courses() {
        return new ArrayList<>(courses.values());
    }

    public synchronized List<Enrollment> enrollments() {
        return new ArrayList<>(enrollments.values());
    }
}
