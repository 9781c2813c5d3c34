package com.schoolsched.schoolsched_api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObstructionDetail(
        ObstructionType type,
        String section,
        String subjectId,
        String subjectName,
        String teacherId,
        String teacherName,
        Integer requiredHours,
        Integer availableHours,
        Integer shortfall,
        Integer day,
        Integer period,
        String constraintId,
        String message) {

    public static ObstructionDetail hoursMismatch(String section, int required, int actual) {
        return new ObstructionDetail(ObstructionType.HOURS_MISMATCH, section, null, null, null, null,
                required, actual, required - actual, null, null, null,
                "Section " + section + " has " + actual + " weekly hours but the week has exactly " + required + " periods");
    }

    public static ObstructionDetail subjectShortfall(String section, String subjectId, String subjectName,
                                                     String teacherId, String teacherName, int required, int available) {
        return new ObstructionDetail(ObstructionType.INSUFFICIENT_SUBJECT_AVAILABILITY, section, subjectId, subjectName,
                teacherId, teacherName, required, available, required - available, null, null, null,
                "Guaranteed empty slot: " + teacherName + " has " + available + " eligible free periods for "
                        + subjectName + " but " + required + " are needed (short by " + (required - available) + ")");
    }

    public static ObstructionDetail teacherShortfall(String teacherId, String teacherName, int required, int available) {
        return new ObstructionDetail(ObstructionType.INSUFFICIENT_TEACHER_AVAILABILITY, null, null, null,
                teacherId, teacherName, required, available, required - available, null, null, null,
                teacherName + " owes " + required + " periods but has only " + available
                        + " free periods (short by " + (required - available) + ")");
    }

    public static ObstructionDetail forbiddenBlocks(String section, String subjectId, String subjectName,
                                                    String teacherId, String teacherName, String constraintId,
                                                    String constraintDescription, int removed) {
        return new ObstructionDetail(ObstructionType.FORBIDDEN_CONSTRAINT_BLOCKS, section, subjectId, subjectName,
                teacherId, teacherName, null, null, null, null, null, constraintId,
                "Forbidden rule '" + constraintDescription + "' removes " + removed + " of the last free periods "
                        + teacherName + " has for " + subjectName);
    }

    public static ObstructionDetail unassignedSubject(String section, String subjectId, String subjectName) {
        return new ObstructionDetail(ObstructionType.UNASSIGNED_SUBJECT, section, subjectId, subjectName,
                null, null, null, null, null, null, null, null,
                "Subject " + subjectName + " has no teacher assigned"
                        + (section != null ? " for section " + section : ""));
    }

    public static ObstructionDetail unknownTeacher(String section, String subjectId, String subjectName, String teacherId) {
        return new ObstructionDetail(ObstructionType.UNKNOWN_TEACHER, section, subjectId, subjectName,
                teacherId, null, null, null, null, null, null, null,
                "Subject " + subjectName + " is assigned to teacher " + teacherId + " who is not in the catalog or inactive");
    }

    public static ObstructionDetail uncoveredPeriod(String section, int day, int period, String label) {
        return new ObstructionDetail(ObstructionType.UNCOVERED_PERIOD, section, null, null, null, null,
                null, null, null, day, period, null,
                "No assigned teacher of section " + section + " is free on " + label);
    }
}
