package com.schoolsched.schoolsched_api.dto;

public enum ObstructionType {
    /** Weekly hours of a section do not add up to the 30 periods of the week. */
    HOURS_MISMATCH,
    /** A teacher's free, eligible cells cannot cover one subject. */
    INSUFFICIENT_SUBJECT_AVAILABILITY,
    /** A teacher's free cells cannot cover everything the teacher owes in this run. */
    INSUFFICIENT_TEACHER_AVAILABILITY,
    FORBIDDEN_CONSTRAINT_BLOCKS,
    UNASSIGNED_SUBJECT,
    UNKNOWN_TEACHER,
    /** No assigned teacher is free for this (day, period) of the section. */
    UNCOVERED_PERIOD
}
