package com.schoolsched.schoolsched_api.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.schoolsched.schoolsched_api.dto.DeleteResponse;
import com.schoolsched.schoolsched_api.exception.AvailabilityConflictException;
import com.schoolsched.schoolsched_api.exception.ScheduleNotFoundException;
import com.schoolsched.schoolsched_api.model.AvailabilitySlot;
import com.schoolsched.schoolsched_api.model.PublishedSchedule;
import com.schoolsched.schoolsched_api.model.ScheduleEntry;
import com.schoolsched.schoolsched_api.model.ScheduleKey;
import com.schoolsched.schoolsched_api.model.SessionType;
import com.schoolsched.schoolsched_api.model.SlotAssignment;
import com.schoolsched.schoolsched_api.model.SlotStatus;
import com.schoolsched.schoolsched_api.model.Teacher;
import com.schoolsched.schoolsched_api.model.TeacherAvailability;
import com.schoolsched.schoolsched_api.model.WeekGrid;
import com.schoolsched.schoolsched_api.repository.PublishedScheduleRepository;
import com.schoolsched.schoolsched_api.repository.ScheduleEntryRepository;
import com.schoolsched.schoolsched_api.repository.TeacherAvailabilityRepository;
import com.schoolsched.schoolsched_api.repository.TeacherRepository;

/**
 * Removes one published class/section grid and gives its teachers back exactly the cells that grid held.
 */
@Service
public class ScheduleDeletionService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleDeletionService.class);

    private final ScheduleEntryRepository entryRepository;
    private final PublishedScheduleRepository publishedScheduleRepository;
    private final TeacherAvailabilityRepository availabilityRepository;
    private final TeacherRepository teacherRepository;
    private final TeacherAvailabilityService availabilityService;
    private final ScheduleLockRegistry lockRegistry;

    public ScheduleDeletionService(ScheduleEntryRepository entryRepository,
                                   PublishedScheduleRepository publishedScheduleRepository,
                                   TeacherAvailabilityRepository availabilityRepository,
                                   TeacherRepository teacherRepository,
                                   TeacherAvailabilityService availabilityService,
                                   ScheduleLockRegistry lockRegistry) {
        this.entryRepository = entryRepository;
        this.publishedScheduleRepository = publishedScheduleRepository;
        this.availabilityRepository = availabilityRepository;
        this.teacherRepository = teacherRepository;
        this.availabilityService = availabilityService;
        this.lockRegistry = lockRegistry;
    }

    @Transactional
    public DeleteResponse deleteClassSchedule(String academicYearId, SessionType sessionType, String classId,
                                              String section) {
        if (sessionType == null) {
            throw new IllegalArgumentException("sessionType is required.");
        }
        sessionType.requireConcrete();
        if (section == null || section.isBlank()) {
            throw new IllegalArgumentException("section is required.");
        }
        ScheduleKey key = new ScheduleKey(academicYearId, sessionType, classId, section);
        return lockRegistry.withLock(key.classLockKey(), () -> delete(key));
    }

    private DeleteResponse delete(ScheduleKey key) {
        List<ScheduleEntry> entries = entryRepository.findAllByAcademicYearIdAndSessionTypeAndClassIdAndSection(
                key.academicYearId(), key.sessionType(), key.classId(), key.section());
        Optional<PublishedSchedule> header = publishedScheduleRepository
                .findByAcademicYearIdAndSessionTypeAndClassIdAndSection(
                        key.academicYearId(), key.sessionType(), key.classId(), key.section());
        if (entries.isEmpty()) {
            logger.warn("Delete requested for {} but no published cells exist", key);
            throw new ScheduleNotFoundException(key);
        }

        Map<String, String> entryTeacherNames = new LinkedHashMap<>();
        for (ScheduleEntry entry : entries) {
            entryTeacherNames.putIfAbsent(entry.getTeacherId(), entry.getTeacherName());
        }

        Instant now = Instant.now();
        List<TeacherAvailability> restored = new ArrayList<>();
        List<String> restoredTeachers = new ArrayList<>();
        boolean entriesDeleted = false;
        try {
            for (Map.Entry<String, String> teacher : entryTeacherNames.entrySet()) {
                TeacherAvailability availability = availabilityService.load(teacher.getKey());
                int released = 0;
                for (ScheduleEntry entry : entries) {
                    if (entry.getTeacherId().equals(teacher.getKey())
                            && availability.release(entry.getDayOfWeek(), entry.getPeriodNumber(), key)) {
                        released++;
                    }
                }
                if (released == 0) {
                    logger.warn("Teacher {} held no availability cells for {}", teacher.getKey(), key);
                    continue;
                }
                availability.setUpdatedAt(now);
                restored.add(availabilityRepository.save(availability));
                restoredTeachers.add(teacherName(teacher.getKey(), teacher.getValue()));
                logger.info("Restored {} cell(s) of teacher {}", released, teacher.getKey());
            }

            entryRepository.deleteAll(entries);
            entriesDeleted = true;
            header.ifPresent(publishedScheduleRepository::delete);
        } catch (RuntimeException e) {
            logger.error("!!! Delete of {} failed after restoring {} teacher(s). Rolling back. !!!",
                    key, restored.size(), e);
            rollback(key, entries, restored, entriesDeleted, e);
            if (e instanceof OptimisticLockingFailureException) {
                throw new AvailabilityConflictException(
                        "Teacher availability changed while deleting the schedule; try again", e);
            }
            throw e;
        }

        logger.info("Deleted {} cell(s) of {}{}; restored availability of {}", entries.size(), key,
                header.map(h -> " ('" + h.getName() + "')").orElse(""), restoredTeachers);
        return new DeleteResponse(entries.size(), restoredTeachers);
    }

    private void rollback(ScheduleKey key, List<ScheduleEntry> entries, List<TeacherAvailability> restored,
                          boolean entriesDeleted, RuntimeException cause) {
        if (entriesDeleted) {
            try {
                entryRepository.saveAll(entries);
            } catch (RuntimeException e) {
                logger.error("!!! Re-inserting {} cell(s) of {} failed !!!", entries.size(), key, e);
                cause.addSuppressed(e);
            }
        }
        for (TeacherAvailability saved : restored) {
            try {
                TeacherAvailability current = availabilityService.load(saved.getTeacherId());
                boolean changed = false;
                for (ScheduleEntry entry : entries) {
                    if (!entry.getTeacherId().equals(saved.getTeacherId())) continue;
                    AvailabilitySlot slot = current.slotAt(entry.getDayOfWeek(), entry.getPeriodNumber());
                    if (slot.isFree()) {
                        current.markAssigned(entry.getDayOfWeek(), entry.getPeriodNumber(),
                                new SlotAssignment(key, entry.getSubjectId(), entry.getSubjectName()));
                        changed = true;
                    } else if (slot.getStatus() != SlotStatus.ASSIGNED) {
                        logger.warn("Cannot re-assign {} of teacher {}: now {}",
                                WeekGrid.label(entry.getDayOfWeek(), entry.getPeriodNumber()), saved.getTeacherId(),
                                slot.getStatus());
                    }
                }
                if (changed) availabilityRepository.save(current);
            } catch (RuntimeException e) {
                logger.error("!!! Re-assigning availability of teacher {} failed !!!", saved.getTeacherId(), e);
                cause.addSuppressed(e);
            }
        }
    }

    private String teacherName(String teacherId, String fallbackName) {
        return teacherRepository.findById(teacherId)
                .map(Teacher::getFullName)
                .orElse(fallbackName != null ? fallbackName : teacherId);
    }
}
