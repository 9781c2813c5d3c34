package com.schoolsched.schoolsched_api.model;

import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document("teachers")
public class Teacher {
    @Id
    private String id;
    private String academicYearId;
    private String fullName;
    private boolean active = true;

    // Constructors
    public Teacher() {}

    public Teacher(String academicYearId, String fullName) {
        this.academicYearId = academicYearId;
        this.fullName = fullName;
    }

    // Getters
    public String getId() { return id; }
    public String getAcademicYearId() { return academicYearId; }
    public String getFullName() { return fullName; }
    public boolean isActive() { return active; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setAcademicYearId(String academicYearId) { this.academicYearId = academicYearId; }
    public void setFullName(String fullName) { this.fullName = fullName; }
    public void setActive(boolean active) { this.active = active; }

    // --- STABLE hashCode and equals (id only) ---
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Teacher teacher = (Teacher) o;
        // If id is null for either, they can't be equal unless both are the same instance (checked above)
        if (id == null || teacher.id == null) {
             return false;
        }
        return Objects.equals(id, teacher.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
