package com.schoolsched.schoolsched_api.model;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One published cell of a class/section timetable.
 */
@Document("schedule_entries")
@CompoundIndexes({
        @CompoundIndex(name = "uniq_cell",
                def = "{'academicYearId': 1, 'sessionType': 1, 'classId': 1, 'section': 1, 'dayOfWeek': 1, 'periodNumber': 1}",
                unique = true),
        @CompoundIndex(name = "teacher_slot",
                def = "{'academicYearId': 1, 'sessionType': 1, 'teacherId': 1, 'dayOfWeek': 1, 'periodNumber': 1}")
})
public class ScheduleEntry {
    @Id
    private String id;
    private String academicYearId;
    private SessionType sessionType;
    private String classId;
    private String section;
    private int dayOfWeek;
    private int periodNumber;
    private String subjectId;
    private String subjectName;
    private String teacherId;
    private String teacherName;
    private String publicationId;
    private Instant createdAt;

    public ScheduleEntry() {}

    public ScheduleEntry(ScheduleKey key, int dayOfWeek, int periodNumber,
                         String subjectId, String subjectName, String teacherId, String teacherName) {
        this.academicYearId = key.academicYearId();
        this.sessionType = key.sessionType();
        this.classId = key.classId();
        this.section = key.section();
        this.dayOfWeek = dayOfWeek;
        this.periodNumber = periodNumber;
        this.subjectId = subjectId;
        this.subjectName = subjectName;
        this.teacherId = teacherId;
        this.teacherName = teacherName;
    }

    // Getters
    public String getId() { return id; }
    public String getAcademicYearId() { return academicYearId; }
    public SessionType getSessionType() { return sessionType; }
    public String getClassId() { return classId; }
    public String getSection() { return section; }
    public int getDayOfWeek() { return dayOfWeek; }
    public int getPeriodNumber() { return periodNumber; }
    public String getSubjectId() { return subjectId; }
    public String getSubjectName() { return subjectName; }
    public String getTeacherId() { return teacherId; }
    public String getTeacherName() { return teacherName; }
    public String getPublicationId() { return publicationId; }
    public Instant getCreatedAt() { return createdAt; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setAcademicYearId(String academicYearId) { this.academicYearId = academicYearId; }
    public void setSessionType(SessionType sessionType) { this.sessionType = sessionType; }
    public void setClassId(String classId) { this.classId = classId; }
    public void setSection(String section) { this.section = section; }
    public void setDayOfWeek(int dayOfWeek) { this.dayOfWeek = dayOfWeek; }
    public void setPeriodNumber(int periodNumber) { this.periodNumber = periodNumber; }
    public void setSubjectId(String subjectId) { this.subjectId = subjectId; }
    public void setSubjectName(String subjectName) { this.subjectName = subjectName; }
    public void setTeacherId(String teacherId) { this.teacherId = teacherId; }
    public void setTeacherName(String teacherName) { this.teacherName = teacherName; }
    public void setPublicationId(String publicationId) { this.publicationId = publicationId; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public ScheduleKey getKey() {
        return new ScheduleKey(academicYearId, sessionType, classId, section);
    }

    public int getSlotIndex() {
        return WeekGrid.index(dayOfWeek, periodNumber);
    }
}
