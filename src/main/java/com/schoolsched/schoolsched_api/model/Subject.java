package com.schoolsched.schoolsched_api.model;

import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document("subjects")
public class Subject {
    @Id
    private String id;
    private String classId;
    private String subjectName;
    private int weeklyHours;
    private boolean active = true;

    public Subject() {}

    public Subject(String classId, String subjectName, int weeklyHours) {
        this.classId = classId;
        this.subjectName = subjectName;
        this.weeklyHours = weeklyHours;
    }

    public String getId() { return id; }
    public String getClassId() { return classId; }
    public String getSubjectName() { return subjectName; }
    public int getWeeklyHours() { return weeklyHours; }
    public boolean isActive() { return active; }

    public void setId(String id) { this.id = id; }
    public void setClassId(String classId) { this.classId = classId; }
    public void setSubjectName(String subjectName) { this.subjectName = subjectName; }
    public void setWeeklyHours(int weeklyHours) { this.weeklyHours = weeklyHours; }
    public void setActive(boolean active) { this.active = active; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Subject subject = (Subject) o;
        if (id == null || subject.id == null) {
            return false;
        }
        return Objects.equals(id, subject.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
