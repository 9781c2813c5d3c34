package com.schoolsched.schoolsched_api.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.schoolsched.schoolsched_api.model.ScheduleEntry;
import com.schoolsched.schoolsched_api.model.SessionType;

public interface ScheduleEntryRepository extends MongoRepository<ScheduleEntry, String> {

    // Cells of one published grid
    List<ScheduleEntry> findAllByAcademicYearIdAndSessionTypeAndClassIdAndSection(
            String academicYearId, SessionType sessionType, String classId, String section);

    boolean existsByAcademicYearIdAndSessionTypeAndClassIdAndSection(
            String academicYearId, SessionType sessionType, String classId, String section);

    List<ScheduleEntry> findAllByAcademicYearIdAndSessionTypeAndClassId(
            String academicYearId, SessionType sessionType, String classId);

    // Used to detect teacher double-booking across classes
    List<ScheduleEntry> findAllByAcademicYearIdAndSessionTypeAndTeacherIdIn(
            String academicYearId, SessionType sessionType, List<String> teacherIds);
}
