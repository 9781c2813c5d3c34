package com.schoolsched.schoolsched_api.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.schoolsched.schoolsched_api.dto.ClassAvailabilitySummary;
import com.schoolsched.schoolsched_api.dto.ClassAvailabilitySummary.TeacherSufficiency;
import com.schoolsched.schoolsched_api.model.SchoolClass;
import com.schoolsched.schoolsched_api.solver.AvailabilitySnapshot;
import com.schoolsched.schoolsched_api.solver.RequirementSet;
import com.schoolsched.schoolsched_api.solver.SubjectRequirement;

/**
 * Pre-generation view: does each teacher assigned to a class have enough free periods for it?
 * Only counts; a sufficient teacher can still be blocked by constraints or by how free cells line up.
 */
@Service
public class ClassAvailabilityService {

    private static final Logger logger = LoggerFactory.getLogger(ClassAvailabilityService.class);

    private final ScheduleContextLoader contextLoader;
    private final TeacherAvailabilityService availabilityService;

    public ClassAvailabilityService(ScheduleContextLoader contextLoader,
                                    TeacherAvailabilityService availabilityService) {
        this.contextLoader = contextLoader;
        this.availabilityService = availabilityService;
    }

    /**
     * @param section one section, or null for the whole class
     */
    public ClassAvailabilitySummary summarize(String classId, String section) {
        SchoolClass schoolClass = contextLoader.requireClass(classId);
        String target = section != null && !section.isBlank() ? section : null;
        RequirementSet requirements = contextLoader.loadRequirements(schoolClass, target);
        AvailabilitySnapshot availability = AvailabilitySnapshot.of(
                availabilityService.loadAll(requirements.assignedTeacherIds()));

        Map<String, List<SubjectRequirement>> byTeacher = new LinkedHashMap<>();
        List<String> unassigned = new ArrayList<>();
        for (SubjectRequirement requirement : requirements.distinctRequirements()) {
            if (!requirement.isAssigned()) {
                unassigned.add(requirement.subjectName());
                continue;
            }
            byTeacher.computeIfAbsent(requirement.teacherId(), k -> new ArrayList<>()).add(requirement);
        }

        List<TeacherSufficiency> teachers = new ArrayList<>();
        boolean allSufficient = unassigned.isEmpty();
        for (Map.Entry<String, List<SubjectRequirement>> entry : byTeacher.entrySet()) {
            String teacherId = entry.getKey();
            int required = 0;
            List<String> subjects = new ArrayList<>();
            for (SubjectRequirement requirement : entry.getValue()) {
                required += requirements.demandFor(requirement);
                if (!subjects.contains(requirement.subjectName())) subjects.add(requirement.subjectName());
            }
            int free = availability.freeCount(teacherId);
            boolean sufficient = requirements.isKnownTeacher(teacherId) && free >= required;
            allSufficient &= sufficient;
            String message;
            if (!requirements.isKnownTeacher(teacherId)) {
                message = "Teacher " + teacherId + " does not exist";
            } else if (sufficient) {
                message = "Sufficient: " + free + " free period(s) for " + required + " required";
            } else {
                message = "Insufficient: needs " + required + " period(s) but has only " + free + " free";
            }
            teachers.add(new TeacherSufficiency(teacherId, entry.getValue().get(0).teacherName(), subjects,
                    required, free, sufficient, message));
        }

        logger.info("Availability summary for class {}{}: {} teacher(s), all sufficient={}", classId,
                target != null ? " section " + target : "", teachers.size(), allSufficient);
        return new ClassAvailabilitySummary(classId, schoolClass.getDisplayName(), target, allSufficient, teachers,
                unassigned);
    }
}
