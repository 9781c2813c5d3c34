package com.schoolsched.schoolsched_api.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.schoolsched.schoolsched_api.model.PublishedSchedule;
import com.schoolsched.schoolsched_api.model.SessionType;

public interface PublishedScheduleRepository extends MongoRepository<PublishedSchedule, String> {

    Optional<PublishedSchedule> findByAcademicYearIdAndSessionTypeAndClassIdAndSection(
            String academicYearId, SessionType sessionType, String classId, String section);

    Optional<PublishedSchedule> findByAcademicYearIdAndName(String academicYearId, String name);
}
