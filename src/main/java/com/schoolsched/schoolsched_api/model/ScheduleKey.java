package com.schoolsched.schoolsched_api.model;

import java.util.Objects;

/**
 * Identity of one published grid: (academic year, session, class, section).
 */
public record ScheduleKey(String academicYearId, SessionType sessionType, String classId, String section) {

    public ScheduleKey {
        Objects.requireNonNull(academicYearId, "academicYearId");
        Objects.requireNonNull(sessionType, "sessionType");
        Objects.requireNonNull(classId, "classId");
        Objects.requireNonNull(section, "section");
    }

    /** Lock key shared by every section of the class. */
    public String classLockKey() {
        return classLockKey(academicYearId, sessionType, classId);
    }

    public static String classLockKey(String academicYearId, SessionType sessionType, String classId) {
        return academicYearId + "|" + sessionType.name() + "|" + classId;
    }

    @Override
    public String toString() {
        return "year=" + academicYearId + ", session=" + sessionType.getValue()
                + ", class=" + classId + ", section=" + section;
    }
}
