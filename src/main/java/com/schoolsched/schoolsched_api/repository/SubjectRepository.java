package com.schoolsched.schoolsched_api.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.schoolsched.schoolsched_api.model.Subject;

public interface SubjectRepository extends MongoRepository<Subject, String> {

    List<Subject> findAllByClassId(String classId);
}
