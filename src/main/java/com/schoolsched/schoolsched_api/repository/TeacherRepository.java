package com.schoolsched.schoolsched_api.repository;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.schoolsched.schoolsched_api.model.Teacher;

public interface TeacherRepository extends MongoRepository<Teacher, String> {
}
