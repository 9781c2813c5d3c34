package com.schoolsched.schoolsched_api.model;

import java.util.Objects;

/**
 * Records which published grid consumed an availability slot, so that deleting
 * that grid frees exactly its own cells.
 */
public class SlotAssignment {
    private String academicYearId;
    private SessionType sessionType;
    private String classId;
    private String section;
    private String subjectId;
    private String subjectName;

    public SlotAssignment() {}

    public SlotAssignment(ScheduleKey key, String subjectId, String subjectName) {
        this.academicYearId = key.academicYearId();
        this.sessionType = key.sessionType();
        this.classId = key.classId();
        this.section = key.section();
        this.subjectId = subjectId;
        this.subjectName = subjectName;
    }

    public String getAcademicYearId() { return academicYearId; }
    public SessionType getSessionType() { return sessionType; }
    public String getClassId() { return classId; }
    public String getSection() { return section; }
    public String getSubjectId() { return subjectId; }
    public String getSubjectName() { return subjectName; }

    public void setAcademicYearId(String academicYearId) { this.academicYearId = academicYearId; }
    public void setSessionType(SessionType sessionType) { this.sessionType = sessionType; }
    public void setClassId(String classId) { this.classId = classId; }
    public void setSection(String section) { this.section = section; }
    public void setSubjectId(String subjectId) { this.subjectId = subjectId; }
    public void setSubjectName(String subjectName) { this.subjectName = subjectName; }

    public boolean belongsTo(ScheduleKey key) {
        return Objects.equals(academicYearId, key.academicYearId())
                && sessionType == key.sessionType()
                && Objects.equals(classId, key.classId())
                && Objects.equals(section, key.section());
    }

    public SlotAssignment copy() {
        SlotAssignment copy = new SlotAssignment();
        copy.academicYearId = academicYearId;
        copy.sessionType = sessionType;
        copy.classId = classId;
        copy.section = section;
        copy.subjectId = subjectId;
        copy.subjectName = subjectName;
        return copy;
    }
}
