package com.schoolsched.schoolsched_api.service;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.schoolsched.schoolsched_api.dto.GenerateScheduleRequest;
import com.schoolsched.schoolsched_api.model.ScheduleConstraint;
import com.schoolsched.schoolsched_api.model.SchoolClass;
import com.schoolsched.schoolsched_api.model.SessionType;
import com.schoolsched.schoolsched_api.model.Subject;
import com.schoolsched.schoolsched_api.model.Teacher;
import com.schoolsched.schoolsched_api.model.TeacherAssignment;
import com.schoolsched.schoolsched_api.repository.ScheduleConstraintRepository;
import com.schoolsched.schoolsched_api.repository.SchoolClassRepository;
import com.schoolsched.schoolsched_api.repository.SubjectRepository;
import com.schoolsched.schoolsched_api.repository.TeacherAssignmentRepository;
import com.schoolsched.schoolsched_api.repository.TeacherRepository;
import com.schoolsched.schoolsched_api.solver.AvailabilitySnapshot;
import com.schoolsched.schoolsched_api.solver.ConstraintRules;
import com.schoolsched.schoolsched_api.solver.RequirementCalculator;
import com.schoolsched.schoolsched_api.solver.RequirementSet;
import com.schoolsched.schoolsched_api.solver.ScheduleContext;

/**
 * Reads the catalogs a validation or generation run needs.
 */
@Component
public class ScheduleContextLoader {

    private final SchoolClassRepository schoolClassRepository;
    private final SubjectRepository subjectRepository;
    private final TeacherRepository teacherRepository;
    private final TeacherAssignmentRepository assignmentRepository;
    private final ScheduleConstraintRepository constraintRepository;
    private final TeacherAvailabilityService availabilityService;
    private final RequirementCalculator requirementCalculator;

    public ScheduleContextLoader(SchoolClassRepository schoolClassRepository, SubjectRepository subjectRepository,
                                 TeacherRepository teacherRepository, TeacherAssignmentRepository assignmentRepository,
                                 ScheduleConstraintRepository constraintRepository,
                                 TeacherAvailabilityService availabilityService,
                                 RequirementCalculator requirementCalculator) {
        this.schoolClassRepository = schoolClassRepository;
        this.subjectRepository = subjectRepository;
        this.teacherRepository = teacherRepository;
        this.assignmentRepository = assignmentRepository;
        this.constraintRepository = constraintRepository;
        this.availabilityService = availabilityService;
        this.requirementCalculator = requirementCalculator;
    }

    public ScheduleContext load(GenerateScheduleRequest request) {
        request.validate();
        SchoolClass schoolClass = requireClass(request.getClassId(), request.getAcademicYearId(), request.getSessionType());

        RequirementSet requirements = loadRequirements(schoolClass, request.getSection());
        AvailabilitySnapshot availability = AvailabilitySnapshot.of(
                availabilityService.loadAll(requirements.assignedTeacherIds()));
        ConstraintRules rules = loadRules(request.getAcademicYearId(), request.getSessionType());

        return new ScheduleContext(request.getAcademicYearId(), request.getSessionType(), schoolClass,
                requirements, availability, rules);
    }

    /**
     * The class must belong to the academic year and session the caller names.
     */
    public SchoolClass requireClass(String classId, String academicYearId, SessionType sessionType) {
        SchoolClass schoolClass = requireClass(classId);
        if (!Objects.equals(schoolClass.getAcademicYearId(), academicYearId)) {
            throw new IllegalArgumentException("Class " + classId + " belongs to academic year "
                    + schoolClass.getAcademicYearId() + ", not " + academicYearId);
        }
        if (schoolClass.getSessionType() != null && schoolClass.getSessionType() != sessionType) {
            throw new IllegalArgumentException("Class " + classId + " is in the "
                    + schoolClass.getSessionType().getValue() + " session, not " + sessionType.getValue());
        }
        return schoolClass;
    }

    public SchoolClass requireClass(String classId) {
        return schoolClassRepository.findById(classId)
                .orElseThrow(() -> new NoSuchElementException("Class with ID " + classId + " not found."));
    }

    /**
     * @param section one section, or null for every section
     */
    public RequirementSet loadRequirements(SchoolClass schoolClass, String section) {
        List<Subject> subjects = subjectRepository.findAllByClassId(schoolClass.getId());
        List<TeacherAssignment> assignments = assignmentRepository.findAllByClassId(schoolClass.getId());
        Set<String> teacherIds = assignments.stream()
                .map(TeacherAssignment::getTeacherId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<String, Teacher> teachers = teacherRepository.findAllById(teacherIds).stream()
                .collect(Collectors.toMap(Teacher::getId, Function.identity(), (t1, t2) -> t1));
        return requirementCalculator.calculate(schoolClass, subjects, assignments, teachers, section);
    }

    public ConstraintRules loadRules(String academicYearId, SessionType sessionType) {
        List<ScheduleConstraint> constraints = constraintRepository.findAllByAcademicYearIdAndActiveTrue(academicYearId);
        return new ConstraintRules(sessionType, constraints);
    }
}
