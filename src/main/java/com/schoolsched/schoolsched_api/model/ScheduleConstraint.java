package com.schoolsched.schoolsched_api.model;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A structural rule shared by every generation run of an academic year.
 * Unset scope fields match anything.
 */
@Document("schedule_constraints")
public class ScheduleConstraint {
    @Id
    private String id;
    private String academicYearId;
    private ConstraintType constraintType;
    private String classId;
    private String subjectId;
    private String teacherId;
    private Integer dayOfWeek;
    private Integer periodNumber;
    private Integer timeRangeStart;
    private Integer timeRangeEnd;
    private Integer maxConsecutivePeriods;
    private Integer minBreakPeriods;
    private SessionType sessionType = SessionType.BOTH;
    private int priorityLevel = 2;
    private String description;
    private boolean active = true;
    private Instant createdAt;

    public ScheduleConstraint() {}

    public ScheduleConstraint(String academicYearId, ConstraintType constraintType) {
        this.academicYearId = academicYearId;
        this.constraintType = constraintType;
    }

    public String getId() { return id; }
    public String getAcademicYearId() { return academicYearId; }
    public ConstraintType getConstraintType() { return constraintType; }
    public String getClassId() { return classId; }
    public String getSubjectId() { return subjectId; }
    public String getTeacherId() { return teacherId; }
    public Integer getDayOfWeek() { return dayOfWeek; }
    public Integer getPeriodNumber() { return periodNumber; }
    public Integer getTimeRangeStart() { return timeRangeStart; }
    public Integer getTimeRangeEnd() { return timeRangeEnd; }
    public Integer getMaxConsecutivePeriods() { return maxConsecutivePeriods; }
    public Integer getMinBreakPeriods() { return minBreakPeriods; }
    public SessionType getSessionType() { return sessionType; }
    public int getPriorityLevel() { return priorityLevel; }
    public String getDescription() { return description; }
    public boolean isActive() { return active; }
    public Instant getCreatedAt() { return createdAt; }

    public void setId(String id) { this.id = id; }
    public void setAcademicYearId(String academicYearId) { this.academicYearId = academicYearId; }
    public void setConstraintType(ConstraintType constraintType) { this.constraintType = constraintType; }
    public void setClassId(String classId) { this.classId = classId; }
    public void setSubjectId(String subjectId) { this.subjectId = subjectId; }
    public void setTeacherId(String teacherId) { this.teacherId = teacherId; }
    public void setDayOfWeek(Integer dayOfWeek) { this.dayOfWeek = dayOfWeek; }
    public void setPeriodNumber(Integer periodNumber) { this.periodNumber = periodNumber; }
    public void setTimeRangeStart(Integer timeRangeStart) { this.timeRangeStart = timeRangeStart; }
    public void setTimeRangeEnd(Integer timeRangeEnd) { this.timeRangeEnd = timeRangeEnd; }
    public void setMaxConsecutivePeriods(Integer maxConsecutivePeriods) { this.maxConsecutivePeriods = maxConsecutivePeriods; }
    public void setMinBreakPeriods(Integer minBreakPeriods) { this.minBreakPeriods = minBreakPeriods; }
    public void setSessionType(SessionType sessionType) { this.sessionType = sessionType; }
    public void setPriorityLevel(int priorityLevel) { this.priorityLevel = priorityLevel; }
    public void setDescription(String description) { this.description = description; }
    public void setActive(boolean active) { this.active = active; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public boolean appliesTo(String classId, String subjectId, String teacherId, SessionType session) {
        return active
                && (this.classId == null || this.classId.equals(classId))
                && (this.subjectId == null || this.subjectId.equals(subjectId))
                && (this.teacherId == null || this.teacherId.equals(teacherId))
                && (this.sessionType == null || this.sessionType.covers(session));
    }

    public boolean coversSlot(int day, int period) {
        if (dayOfWeek != null && dayOfWeek != day) {
            return false;
        }
        if (periodNumber != null) {
            return periodNumber == period;
        }
        if (timeRangeStart != null || timeRangeEnd != null) {
            int start = timeRangeStart != null ? timeRangeStart : 0;
            int end = timeRangeEnd != null ? timeRangeEnd : WeekGrid.PERIODS_PER_DAY - 1;
            return period >= start && period <= end;
        }
        return true;
    }

    public String describe() {
        if (description != null && !description.isBlank()) {
            return description;
        }
        return constraintType + " constraint " + (id != null ? id : "");
    }
}
