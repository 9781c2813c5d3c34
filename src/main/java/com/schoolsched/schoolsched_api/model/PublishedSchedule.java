package com.schoolsched.schoolsched_api.model;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Header of a published grid. Carries the user-facing name that must stay unique.
 */
@Document("published_schedules")
@CompoundIndexes({
        @CompoundIndex(name = "uniq_grid",
                def = "{'academicYearId': 1, 'sessionType': 1, 'classId': 1, 'section': 1}", unique = true),
        @CompoundIndex(name = "uniq_name", def = "{'academicYearId': 1, 'name': 1}", unique = true)
})
public class PublishedSchedule {
    @Id
    private String id;
    private String name;
    private String academicYearId;
    private SessionType sessionType;
    private String classId;
    private String section;
    private int cellCount;
    private String publishedBy;
    private Instant publishedAt;

    public PublishedSchedule() {}

    public PublishedSchedule(String name, ScheduleKey key, int cellCount, String publishedBy, Instant publishedAt) {
        this.name = name;
        this.academicYearId = key.academicYearId();
        this.sessionType = key.sessionType();
        this.classId = key.classId();
        this.section = key.section();
        this.cellCount = cellCount;
        this.publishedBy = publishedBy;
        this.publishedAt = publishedAt;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getAcademicYearId() { return academicYearId; }
    public SessionType getSessionType() { return sessionType; }
    public String getClassId() { return classId; }
    public String getSection() { return section; }
    public int getCellCount() { return cellCount; }
    public String getPublishedBy() { return publishedBy; }
    public Instant getPublishedAt() { return publishedAt; }

    public void setId(String id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setAcademicYearId(String academicYearId) { this.academicYearId = academicYearId; }
    public void setSessionType(SessionType sessionType) { this.sessionType = sessionType; }
    public void setClassId(String classId) { this.classId = classId; }
    public void setSection(String section) { this.section = section; }
    public void setCellCount(int cellCount) { this.cellCount = cellCount; }
    public void setPublishedBy(String publishedBy) { this.publishedBy = publishedBy; }
    public void setPublishedAt(Instant publishedAt) { this.publishedAt = publishedAt; }

    public ScheduleKey getKey() {
        return new ScheduleKey(academicYearId, sessionType, classId, section);
    }
}
