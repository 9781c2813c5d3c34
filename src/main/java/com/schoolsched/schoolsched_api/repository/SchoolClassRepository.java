package com.schoolsched.schoolsched_api.repository;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.schoolsched.schoolsched_api.model.SchoolClass;

public interface SchoolClassRepository extends MongoRepository<SchoolClass, String> {
}
