package com.schoolsched.schoolsched_api.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Requirements of one generation run: every subject of the class resolved to its teacher
 * for each target section.
 */
public class RequirementSet {

    private final String classId;
    private final int sectionCount;
    private final List<String> targetSections;
    private final Map<String, List<SubjectRequirement>> bySection;
    private final Set<String> unknownTeacherIds;

    public RequirementSet(String classId, int sectionCount, Map<String, List<SubjectRequirement>> bySection,
                          Set<String> unknownTeacherIds) {
        this.classId = classId;
        this.sectionCount = sectionCount;
        this.bySection = new LinkedHashMap<>();
        bySection.forEach((section, requirements) -> this.bySection.put(section, List.copyOf(requirements)));
        this.targetSections = List.copyOf(bySection.keySet());
        this.unknownTeacherIds = Set.copyOf(unknownTeacherIds);
    }

    public String getClassId() { return classId; }
    public int getSectionCount() { return sectionCount; }
    public List<String> getTargetSections() { return targetSections; }

    /** Effective requirement of every subject for one section. */
    public List<SubjectRequirement> forSection(String section) {
        return bySection.getOrDefault(section, List.of());
    }

    public int weeklyHoursFor(String section) {
        int total = 0;
        for (SubjectRequirement requirement : forSection(section)) {
            total += requirement.weeklyHours();
        }
        return total;
    }

    /** Each requirement once, in first-seen order. */
    public List<SubjectRequirement> distinctRequirements() {
        Set<SubjectRequirement> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<SubjectRequirement> distinct = new ArrayList<>();
        for (List<SubjectRequirement> requirements : bySection.values()) {
            for (SubjectRequirement requirement : requirements) {
                if (seen.add(requirement)) distinct.add(requirement);
            }
        }
        return distinct;
    }

    /**
     * Periods this run will actually place for the requirement: its weekly hours times the
     * number of target sections it is effective for. Equals weeklyHoursOwed when every
     * section is generated.
     */
    public int demandFor(SubjectRequirement requirement) {
        int sections = 0;
        for (List<SubjectRequirement> requirements : bySection.values()) {
            for (SubjectRequirement candidate : requirements) {
                if (candidate == requirement) {
                    sections++;
                    break;
                }
            }
        }
        return requirement.weeklyHours() * sections;
    }

    public Set<String> assignedTeacherIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (SubjectRequirement requirement : distinctRequirements()) {
            if (requirement.isAssigned()) ids.add(requirement.teacherId());
        }
        return ids;
    }

    public boolean isKnownTeacher(String teacherId) {
        return teacherId != null && !unknownTeacherIds.contains(teacherId);
    }

    /** Requirement matching a cell's subject and teacher in the given section, if any. */
    public SubjectRequirement find(String section, String subjectId, String teacherId) {
        for (SubjectRequirement requirement : forSection(section)) {
            if (requirement.subjectId().equals(subjectId)
                    && requirement.teacherId() != null && requirement.teacherId().equals(teacherId)) {
                return requirement;
            }
        }
        return null;
    }
}
