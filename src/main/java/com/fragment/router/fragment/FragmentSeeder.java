package com.fragment.router.fragment;

import com.fragment.router.core.model.Course;
import com.fragment.router.core.model.Enrollment;
import com.fragment.router.core.model.Faculty;
import com.fragment.router.core.model.Student;
import com.fragment.router.partition.PartitionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Seeds a {@link FragmentStore} from the shared dataset, keeping only the records the
 * site's {@link PartitionPolicy} owns.
 *
 * <ul>
 *   <li>students: of the department, owned year</li>
 *   <li>enrollments: student of the department, owned status; absent ids take the lowest id
 *       from 1 not used by any owned enrollment</li>
 *   <li>faculty: of the department (replicated, identical on every site)</li>
 *   <li>courses: taught by faculty of the department, owned credits</li>
 * </ul>
 */
public class FragmentSeeder {
    private static final Logger log = LoggerFactory.getLogger(FragmentSeeder.class);

    private final PartitionPolicy policy;
    private final String department;

    public FragmentSeeder(PartitionPolicy policy, String department) {
        this.policy = policy;
        this.department = department;
    }

    public LoadResult seed(Dataset dataset, FragmentStore store) {
        Map<Long, Student> allStudents = index(dataset.students(), Student::id);
        Map<Long, Faculty> allFaculty = index(dataset.faculty(), Faculty::id);

        int students = 0;
        for (Student student : dataset.students()) {
            if (department.equals(student.department()) && policy.owns(student) && store.insert(student)) {
                students++;
            }
        }

        List<Enrollment> owned = new ArrayList<>();
        Set<Long> usedIds = new HashSet<>();
        for (Enrollment enrollment : dataset.enrollments()) {
            Student student = allStudents.get(enrollment.studentId());
            if (student != null && department.equals(student.department()) && policy.owns(enrollment)) {
                owned.add(enrollment);
                if (enrollment.id() != null) {
                    usedIds.add(enrollment.id());
                }
            }
        }

        // Explicit ids are reserved up front; missing ones take the lowest free id from 1.
        int enrollments = 0;
        long nextId = 1;
        for (Enrollment enrollment : owned) {
            Enrollment withId = enrollment;
            if (enrollment.id() == null) {
                while (usedIds.contains(nextId)) {
                    nextId++;
                }
                withId = enrollment.withId(nextId);
                usedIds.add(nextId);
            }
            if (store.insert(withId)) {
                enrollments++;
            } else {
                log.warn("seed.enrollment.skipped policy={} e_id={} s_id={} c_id={} reason=duplicate",
                        policy, withId.id(), withId.studentId(), withId.courseId());
            }
        }

        int faculty = 0;
        for (Faculty member : dataset.faculty()) {
            if (department.equals(member.department()) && store.insert(member)) {
                faculty++;
            }
        }

        int courses = 0;
        for (Course course : dataset.courses()) {
            Faculty instructor = allFaculty.get(course.facultyId());
            if (instructor != null && department.equals(instructor.department()) && policy.owns(course)
                    && store.insert(course)) {
                courses++;
            }
        }

        LoadResult result = new LoadResult(policy.getSite(), students, faculty, courses, enrollments);
        log.info("seed.completed policy={} result={}", policy, result);
        return result;
    }

    private static <T> Map<Long, T> index(List<T> records, Function<T, Long> key) {
        return records.stream().collect(Collectors.toMap(key, Function.identity(), (first, second) -> first));
    }
}
