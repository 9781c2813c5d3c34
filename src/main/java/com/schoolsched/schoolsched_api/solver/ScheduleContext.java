package com.schoolsched.schoolsched_api.solver;

import com.schoolsched.schoolsched_api.model.SchoolClass;
import com.schoolsched.schoolsched_api.model.SessionType;

/**
 * Everything one validation or generation run reads, loaded once per request.
 */
public record ScheduleContext(
        String academicYearId,
        SessionType sessionType,
        SchoolClass schoolClass,
        RequirementSet requirements,
        AvailabilitySnapshot availability,
        ConstraintRules rules) {

    public String classId() {
        return schoolClass.getId();
    }
}
