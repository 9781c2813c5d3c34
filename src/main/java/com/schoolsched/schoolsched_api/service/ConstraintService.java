package com.schoolsched.schoolsched_api.service;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.schoolsched.schoolsched_api.model.ConstraintType;
import com.schoolsched.schoolsched_api.model.ScheduleConstraint;
import com.schoolsched.schoolsched_api.model.SessionType;
import com.schoolsched.schoolsched_api.model.WeekGrid;
import com.schoolsched.schoolsched_api.repository.ScheduleConstraintRepository;

@Service
public class ConstraintService {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintService.class);

    static final int MIN_PRIORITY = 1;
    static final int MAX_PRIORITY = 4;

    private final ScheduleConstraintRepository constraintRepository;

    public ConstraintService(ScheduleConstraintRepository constraintRepository) {
        this.constraintRepository = constraintRepository;
    }

    public List<ScheduleConstraint> getConstraints(String academicYearId) {
        if (academicYearId == null || academicYearId.isBlank()) {
            throw new IllegalArgumentException("academicYearId is required.");
        }
        return constraintRepository.findAllByAcademicYearId(academicYearId);
    }

    public ScheduleConstraint getConstraint(String id) {
        return constraintRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Constraint with ID " + id + " not found."));
    }

    /**
     * Replaces every field of a stored constraint. The id and creation time are kept.
     */
    public ScheduleConstraint updateConstraint(String id, ScheduleConstraint update) {
        ScheduleConstraint existing = getConstraint(id);
        validate(update);
        update.setId(existing.getId());
        update.setCreatedAt(existing.getCreatedAt());
        if (update.getSessionType() == null) {
            update.setSessionType(SessionType.BOTH);
        }
        ScheduleConstraint saved = constraintRepository.save(update);
        logger.info("Updated {} constraint {} for year {} (priority={}, active={})", saved.getConstraintType(),
                saved.getId(), saved.getAcademicYearId(), saved.getPriorityLevel(), saved.isActive());
        return saved;
    }

    public ScheduleConstraint createConstraint(ScheduleConstraint constraint) {
        validate(constraint);
        constraint.setId(null);
        if (constraint.getSessionType() == null) {
            constraint.setSessionType(SessionType.BOTH);
        }
        constraint.setCreatedAt(Instant.now());
        ScheduleConstraint saved = constraintRepository.save(constraint);
        logger.info("Created {} constraint {} for year {} (class={}, subject={}, teacher={}, priority={})",
                saved.getConstraintType(), saved.getId(), saved.getAcademicYearId(), saved.getClassId(),
                saved.getSubjectId(), saved.getTeacherId(), saved.getPriorityLevel());
        return saved;
    }

    public void deleteConstraint(String id) {
        if (!constraintRepository.existsById(id)) {
            throw new NoSuchElementException("Constraint with ID " + id + " not found.");
        }
        constraintRepository.deleteById(id);
        logger.info("Deleted constraint {}", id);
    }

    void validate(ScheduleConstraint constraint) {
        if (constraint == null) {
            throw new IllegalArgumentException("Constraint body is required.");
        }
        if (constraint.getAcademicYearId() == null || constraint.getAcademicYearId().isBlank()) {
            throw new IllegalArgumentException("academicYearId is required.");
        }
        ConstraintType type = constraint.getConstraintType();
        if (type == null) {
            throw new IllegalArgumentException("constraintType is required.");
        }
        if (constraint.getPriorityLevel() < MIN_PRIORITY || constraint.getPriorityLevel() > MAX_PRIORITY) {
            throw new IllegalArgumentException("priorityLevel must be between " + MIN_PRIORITY + " and "
                    + MAX_PRIORITY + ", got " + constraint.getPriorityLevel());
        }
        if (constraint.getDayOfWeek() != null && !WeekGrid.isValidDay(constraint.getDayOfWeek())) {
            throw new IllegalArgumentException("dayOfWeek must be between 0 and " + (WeekGrid.DAYS - 1));
        }
        checkPeriod("periodNumber", constraint.getPeriodNumber());
        checkPeriod("timeRangeStart", constraint.getTimeRangeStart());
        checkPeriod("timeRangeEnd", constraint.getTimeRangeEnd());
        if (constraint.getTimeRangeStart() != null && constraint.getTimeRangeEnd() != null
                && constraint.getTimeRangeStart() > constraint.getTimeRangeEnd()) {
            throw new IllegalArgumentException("timeRangeStart must not be after timeRangeEnd.");
        }

        if (type.limitsCells() && constraint.getDayOfWeek() == null && constraint.getPeriodNumber() == null
                && constraint.getTimeRangeStart() == null && constraint.getTimeRangeEnd() == null) {
            throw new IllegalArgumentException(type + " constraints must name a day, a period or a period range.");
        }
        if (type == ConstraintType.MAX_CONSECUTIVE
                && (constraint.getMaxConsecutivePeriods() == null || constraint.getMaxConsecutivePeriods() < 1)) {
            throw new IllegalArgumentException("maxConsecutivePeriods must be at least 1.");
        }
        if (type == ConstraintType.MIN_BREAK
                && (constraint.getMinBreakPeriods() == null || constraint.getMinBreakPeriods() < 1)) {
            throw new IllegalArgumentException("minBreakPeriods must be at least 1.");
        }
    }

    private void checkPeriod(String field, Integer value) {
        if (value != null && !WeekGrid.isValidPeriod(value)) {
            throw new IllegalArgumentException(field + " must be between 0 and " + (WeekGrid.PERIODS_PER_DAY - 1));
        }
    }
}
