package com.schoolsched.schoolsched_api.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.schoolsched.schoolsched_api.model.TeacherAssignment;

public interface TeacherAssignmentRepository extends MongoRepository<TeacherAssignment, String> {

    List<TeacherAssignment> findAllByClassId(String classId);
}
