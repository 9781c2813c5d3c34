package com.schoolsched.schoolsched_api.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.schoolsched.schoolsched_api.model.ScheduleConstraint;

public interface ScheduleConstraintRepository extends MongoRepository<ScheduleConstraint, String> {

    List<ScheduleConstraint> findAllByAcademicYearId(String academicYearId);

    List<ScheduleConstraint> findAllByAcademicYearIdAndActiveTrue(String academicYearId);
}
