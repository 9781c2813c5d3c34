package com.schoolsched.schoolsched_api.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The distribution loop found no cell for an occurrence that passed feasibility.
 */
public class GenerationException extends SchedulingException {

    private final String section;
    private final String subjectId;
    private final String subjectName;
    private final String teacherId;
    private final String teacherName;
    private final int occurrence;
    private final int missingHours;

    public GenerationException(String section, String subjectId, String subjectName,
                               String teacherId, String teacherName, int occurrence, int missingHours) {
        super("GENERATION_FAILED", "Could not place " + subjectName + " (" + teacherName + ") in section " + section
                + ": occurrence " + occurrence + " has no free cell, " + missingHours + " hour(s) missing");
        this.section = section;
        this.subjectId = subjectId;
        this.subjectName = subjectName;
        this.teacherId = teacherId;
        this.teacherName = teacherName;
        this.occurrence = occurrence;
        this.missingHours = missingHours;
    }

    public String getSection() { return section; }
    public String getSubjectId() { return subjectId; }
    public String getSubjectName() { return subjectName; }
    public String getTeacherId() { return teacherId; }
    public String getTeacherName() { return teacherName; }
    public int getOccurrence() { return occurrence; }
    public int getMissingHours() { return missingHours; }

    @Override
    public Object getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("section", section);
        details.put("subjectId", subjectId);
        details.put("subjectName", subjectName);
        details.put("teacherId", teacherId);
        details.put("teacherName", teacherName);
        details.put("occurrence", occurrence);
        details.put("missingHours", missingHours);
        return details;
    }
}
