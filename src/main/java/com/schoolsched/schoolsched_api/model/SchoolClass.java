package com.schoolsched.schoolsched_api.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document("classes")
public class SchoolClass {

    /** Numeric section names in numeric order ("2" before "10"), anything else after them by text. */
    public static final Comparator<String> SECTION_ORDER = Comparator
            .comparing((String section) -> !isNumeric(section))
            .thenComparingInt(section -> isNumeric(section) ? Integer.parseInt(section) : 0)
            .thenComparing(Comparator.naturalOrder());

    @Id
    private String id;
    private String academicYearId;
    private SessionType sessionType;
    private String gradeLevel;
    private int gradeNumber;
    private int sectionCount;

    // Constructors
    public SchoolClass() {}

    public SchoolClass(String academicYearId, SessionType sessionType, String gradeLevel, int gradeNumber, int sectionCount) {
        this.academicYearId = academicYearId;
        this.sessionType = sessionType;
        this.gradeLevel = gradeLevel;
        this.gradeNumber = gradeNumber;
        this.sectionCount = sectionCount;
    }

    // Getters
    public String getId() { return id; }
    public String getAcademicYearId() { return academicYearId; }
    public SessionType getSessionType() { return sessionType; }
    public String getGradeLevel() { return gradeLevel; }
    public int getGradeNumber() { return gradeNumber; }
    public int getSectionCount() { return sectionCount; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setAcademicYearId(String academicYearId) { this.academicYearId = academicYearId; }
    public void setSessionType(SessionType sessionType) { this.sessionType = sessionType; }
    public void setGradeLevel(String gradeLevel) { this.gradeLevel = gradeLevel; }
    public void setGradeNumber(int gradeNumber) { this.gradeNumber = gradeNumber; }
    public void setSectionCount(int sectionCount) { this.sectionCount = sectionCount; }

    /**
     * Sections are numbered "1".."sectionCount". A class always has at least one.
     */
    private static boolean isNumeric(String section) {
        return section.length() > 0 && section.length() < 10 && section.chars().allMatch(Character::isDigit);
    }

    public List<String> getSectionNames() {
        int count = Math.max(1, sectionCount);
        List<String> names = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            names.add(String.valueOf(i));
        }
        return names;
    }

    public String getDisplayName() {
        return gradeLevel + " " + gradeNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SchoolClass that = (SchoolClass) o;
        if (id == null || that.id == null) {
            return false;
        }
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
