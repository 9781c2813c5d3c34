package com.schoolsched.schoolsched_api.solver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.schoolsched.schoolsched_api.model.SchoolClass;
import com.schoolsched.schoolsched_api.model.Subject;
import com.schoolsched.schoolsched_api.model.Teacher;
import com.schoolsched.schoolsched_api.model.TeacherAssignment;

/**
 * Resolves every active subject of a class to the teacher who owes it, per section.
 * A section-specific assignment wins over the class-wide one.
 */
@Component
public class RequirementCalculator {

    private static final Logger logger = LoggerFactory.getLogger(RequirementCalculator.class);

    /**
     * @param targetSection one section to generate, or null for every section of the class
     */
    public RequirementSet calculate(SchoolClass schoolClass, List<Subject> subjects,
                                    List<TeacherAssignment> assignments, Map<String, Teacher> teachers,
                                    String targetSection) {
        List<String> classSections = schoolClass.getSectionNames();
        List<String> targets;
        if (targetSection == null || targetSection.isBlank()) {
            targets = classSections;
        } else if (classSections.contains(targetSection.trim())) {
            targets = List.of(targetSection.trim());
        } else {
            throw new IllegalArgumentException("Class " + schoolClass.getId() + " has no section " + targetSection
                    + " (sections: " + classSections + ")");
        }
        int sectionCount = classSections.size();

        Map<String, List<SubjectRequirement>> bySection = new LinkedHashMap<>();
        targets.forEach(section -> bySection.put(section, new ArrayList<>()));
        Set<String> unknownTeachers = new HashSet<>();

        List<Subject> activeSubjects = subjects.stream()
                .filter(Subject::isActive)
                .sorted(Comparator.comparing(Subject::getId))
                .collect(Collectors.toList());

        for (Subject subject : activeSubjects) {
            TeacherAssignment general = null;
            Map<String, TeacherAssignment> specific = new LinkedHashMap<>();
            for (TeacherAssignment assignment : assignments) {
                if (!subject.getId().equals(assignment.getSubjectId())) continue;
                if (assignment.appliesToAllSections()) {
                    if (general == null) {
                        general = assignment;
                    } else {
                        logger.warn("Subject {} of class {} has more than one class-wide teacher; keeping {}",
                                subject.getSubjectName(), schoolClass.getId(), general.getTeacherId());
                    }
                } else if (specific.putIfAbsent(assignment.getSection().trim(), assignment) != null) {
                    logger.warn("Subject {} of class {} has more than one teacher for section {}",
                            subject.getSubjectName(), schoolClass.getId(), assignment.getSection());
                }
            }

            SubjectRequirement generalRequirement = general != null
                    ? toRequirement(schoolClass, subject, general.getTeacherId(), null, sectionCount, teachers, unknownTeachers)
                    : null;
            SubjectRequirement unassignedRequirement = general == null && specific.isEmpty()
                    ? toRequirement(schoolClass, subject, null, null, sectionCount, teachers, unknownTeachers)
                    : null;

            for (String section : targets) {
                SubjectRequirement effective;
                TeacherAssignment sectionAssignment = specific.get(section);
                if (sectionAssignment != null) {
                    effective = toRequirement(schoolClass, subject, sectionAssignment.getTeacherId(), section,
                            sectionCount, teachers, unknownTeachers);
                } else if (generalRequirement != null) {
                    effective = generalRequirement;
                } else if (unassignedRequirement != null) {
                    effective = unassignedRequirement;
                } else {
                    effective = toRequirement(schoolClass, subject, null, section, sectionCount, teachers, unknownTeachers);
                }
                bySection.get(section).add(effective);
            }
        }

        logger.info("Calculated requirements for class {}: {} subject(s), sections {}",
                schoolClass.getId(), activeSubjects.size(), targets);
        return new RequirementSet(schoolClass.getId(), sectionCount, bySection, unknownTeachers);
    }

    private SubjectRequirement toRequirement(SchoolClass schoolClass, Subject subject, String teacherId, String section,
                                             int sectionCount, Map<String, Teacher> teachers, Set<String> unknownTeachers) {
        String teacherName = null;
        if (teacherId != null) {
            Teacher teacher = teachers.get(teacherId);
            if (teacher == null || !teacher.isActive()) {
                unknownTeachers.add(teacherId);
            } else {
                teacherName = teacher.getFullName();
            }
        }
        int hours = subject.getWeeklyHours();
        int owed = section == null ? hours * sectionCount : hours;
        return new SubjectRequirement(schoolClass.getId(), subject.getId(), subject.getSubjectName(),
                teacherId, teacherName, section, hours, owed);
    }
}
