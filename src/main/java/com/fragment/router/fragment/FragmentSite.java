package com.fragment.router.fragment;

import com.fragment.router.core.model.Course;
import com.fragment.router.core.model.Enrollment;
import com.fragment.router.core.model.EnrollmentCount;
import com.fragment.router.core.model.EnrollmentDetail;
import com.fragment.router.core.model.Faculty;
import com.fragment.router.core.model.Site;
import com.fragment.router.core.model.Student;
import com.fragment.router.partition.PartitionPolicy;
import com.fragment.router.site.SiteRequest;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * One fragment site: a {@link FragmentStore} answering the fixed query surface,
 * restricted by its {@link PartitionPolicy}.
 *
 * <p>Both sites run this same class; they differ only in policy. Lookups join only
 * records present in the local store. An identifier that is not a number matches nothing.</p>
 */
public class FragmentSite {

    private final PartitionPolicy policy;
    private final String department;
    private final FragmentStore store;

    public FragmentSite(PartitionPolicy policy, String department, FragmentStore store) {
        this.policy = policy;
        this.department = department;
        this.store = store;
    }

    /**
     * Seeds a new site from the shared dataset.
     */
    public static FragmentSite seeded(PartitionPolicy policy, String department, Dataset dataset) {
        FragmentStore store = new FragmentStore();
        new FragmentSeeder(policy, department).seed(dataset, store);
        return new FragmentSite(policy, department, store);
    }

    public Site getSite() {
        return policy.getSite();
    }

    public FragmentStore getStore() {
        return store;
    }

    /**
     * Dispatches a request to the matching query and returns its JSON-serializable answer.
     */
    public Object answer(SiteRequest request) {
        switch (request.query()) {
            case COURSE_ENROLLMENTS:
                return courseEnrollmentCount(request.parameterValue());
            case COURSE_ENROLLMENT_DETAILS:
                return courseEnrollmentDetails(request.parameterValue());
            case CS_FACULTY:
                return departmentFaculty();
            case FACULTY_STUDENTS:
                return facultyStudents(request.parameterValue());
            default:
                throw new IllegalArgumentException("Unsupported site query: " + request.query());
        }
    }

    /**
     * Distinct students enrolled in the course, if the course is local, owned by this
     * site's credit predicate and taught by a faculty member of the department.
     */
    public EnrollmentCount courseEnrollmentCount(String courseId) {
        OptionalLong id = parseId(courseId);
        if (id.isEmpty()) {
            return new EnrollmentCount(0);
        }
        Optional<Course> course = store.findCourse(id.getAsLong());
        if (course.isEmpty() || !policy.owns(course.get())) {
            return new EnrollmentCount(0);
        }
        Optional<Faculty> instructor = store.findFaculty(course.get().facultyId());
        if (instructor.isEmpty() || !department.equals(instructor.get().department())) {
            return new EnrollmentCount(0);
        }
        long count = store.enrollments().stream()
                .filter(e -> e.courseId() == id.getAsLong())
                .mapToLong(Enrollment::studentId)
                .distinct()
                .count();
        return new EnrollmentCount(count);
    }

    /**
     * Local enrollments in the course with this site's status, joined with local student
     * and course records.
     */
    public List<EnrollmentDetail> courseEnrollmentDetails(String courseId) {
        OptionalLong id = parseId(courseId);
        List<EnrollmentDetail> rows = new ArrayList<>();
        if (id.isEmpty()) {
            return rows;
        }
        Optional<Course> course = store.findCourse(id.getAsLong());
        if (course.isEmpty()) {
            return rows;
        }
        for (Enrollment enrollment : store.enrollments()) {
            if (enrollment.courseId() != id.getAsLong() || !policy.owns(enrollment)) {
                continue;
            }
            store.findStudent(enrollment.studentId()).ifPresent(student -> rows.add(
                    new EnrollmentDetail(student.id(), student.name(), enrollment.date(), course.get().name())));
        }
        return rows;
    }

    /**
     * Faculty of the department. Identical on every site.
     */
    public List<Faculty> departmentFaculty() {
        return store.faculty().stream()
                .filter(f -> department.equals(f.department()))
                .toList();
    }

    /**
     * Distinct local students of the department, owned by this site's year predicate,
     * enrolled in a local course taught by the given faculty member.
     */
    public List<Student> facultyStudents(String facultyId) {
        OptionalLong id = parseId(facultyId);
        if (id.isEmpty() || store.findFaculty(id.getAsLong()).isEmpty()) {
            return List.of();
        }
        Set<Student> students = new LinkedHashSet<>();
        for (Enrollment enrollment : store.enrollments()) {
            Optional<Course> course = store.findCourse(enrollment.courseId());
            if (course.isEmpty() || course.get().facultyId() != id.getAsLong()) {
                continue;
            }
            store.findStudent(enrollment.studentId())
                    .filter(s -> department.equals(s.department()) && policy.owns(s))
                    .ifPresent(students::add);
        }
        return new ArrayList<>(students);
    }

    private static OptionalLong parseId(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
