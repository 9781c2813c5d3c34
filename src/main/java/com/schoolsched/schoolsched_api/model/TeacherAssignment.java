package com.schoolsched.schoolsched_api.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Teacher to subject to class link. A null section means the teacher takes the subject in every section.
 */
@Document("teacher_assignments")
public class TeacherAssignment {
    @Id
    private String id;
    private String teacherId;
    private String classId;
    private String subjectId;
    private String section;

    public TeacherAssignment() {}

    public TeacherAssignment(String teacherId, String classId, String subjectId, String section) {
        this.teacherId = teacherId;
        this.classId = classId;
        this.subjectId = subjectId;
        this.section = section;
    }

    public String getId() { return id; }
    public String getTeacherId() { return teacherId; }
    public String getClassId() { return classId; }
    public String getSubjectId() { return subjectId; }
    public String getSection() { return section; }

    public void setId(String id) { this.id = id; }
    public void setTeacherId(String teacherId) { this.teacherId = teacherId; }
    public void setClassId(String classId) { this.classId = classId; }
    public void setSubjectId(String subjectId) { this.subjectId = subjectId; }
    public void setSection(String section) { this.section = section; }

    public boolean appliesToAllSections() {
        return section == null || section.isBlank();
    }

    @Override
    public String toString() {
        return "TeacherAssignment{" +
                "teacherId='" + teacherId + '\'' +
                ", classId='" + classId + '\'' +
                ", subjectId='" + subjectId + '\'' +
                ", section='" + section + '\'' +
                '}';
    }
}
