package com.schoolsched.schoolsched_api.repository;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.schoolsched.schoolsched_api.model.TeacherAvailability;

/**
 * Keyed by teacher id. Saves are version-checked, so a concurrent writer fails with
 * OptimisticLockingFailureException instead of overwriting.
 */
public interface TeacherAvailabilityRepository extends MongoRepository<TeacherAvailability, String> {
}
