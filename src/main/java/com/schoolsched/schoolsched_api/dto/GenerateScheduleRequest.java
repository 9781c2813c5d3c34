package com.schoolsched.schoolsched_api.dto;

import com.schoolsched.schoolsched_api.model.SessionType;

/**
 * Identifies the class (and optionally one section) a validation, preview or publish works on.
 * The academic year and session are always passed explicitly.
 */
public class GenerateScheduleRequest {

    private String academicYearId;
    private SessionType sessionType;
    private String classId;
    private String section; // null = every section of the class

    public GenerateScheduleRequest() {
    }

    public GenerateScheduleRequest(String academicYearId, SessionType sessionType, String classId, String section) {
        this.academicYearId = academicYearId;
        this.sessionType = sessionType;
        this.classId = classId;
        this.section = section;
    }

    public String getAcademicYearId() { return academicYearId; }
    public SessionType getSessionType() { return sessionType; }
    public String getClassId() { return classId; }
    public String getSection() { return section; }

    public void setAcademicYearId(String academicYearId) { this.academicYearId = academicYearId; }
    public void setSessionType(SessionType sessionType) { this.sessionType = sessionType; }
    public void setClassId(String classId) { this.classId = classId; }
    public void setSection(String section) { this.section = section; }

    public void validate() {
        if (academicYearId == null || academicYearId.isBlank()) {
            throw new IllegalArgumentException("academicYearId is required.");
        }
        if (sessionType == null) {
            throw new IllegalArgumentException("sessionType is required.");
        }
        sessionType.requireConcrete();
        if (classId == null || classId.isBlank()) {
            throw new IllegalArgumentException("classId is required.");
        }
    }

    @Override
    public String toString() {
        return "GenerateScheduleRequest{" +
               "academicYearId='" + academicYearId + '\'' +
               ", sessionType=" + sessionType +
               ", classId='" + classId + '\'' +
               ", section='" + section + '\'' +
               '}';
    }
}
