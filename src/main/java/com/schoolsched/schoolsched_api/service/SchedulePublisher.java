package com.schoolsched.schoolsched_api.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.schoolsched.schoolsched_api.dto.AvailabilityConflict;
import com.schoolsched.schoolsched_api.dto.GenerateScheduleRequest;
import com.schoolsched.schoolsched_api.dto.PublishResponse;
import com.schoolsched.schoolsched_api.exception.AvailabilityConflictException;
import com.schoolsched.schoolsched_api.exception.NameConflictException;
import com.schoolsched.schoolsched_api.model.AvailabilitySlot;
import com.schoolsched.schoolsched_api.model.PublishedSchedule;
import com.schoolsched.schoolsched_api.model.ScheduleEntry;
import com.schoolsched.schoolsched_api.model.ScheduleKey;
import com.schoolsched.schoolsched_api.model.SlotAssignment;
import com.schoolsched.schoolsched_api.model.TeacherAvailability;
import com.schoolsched.schoolsched_api.repository.PublishedScheduleRepository;
import com.schoolsched.schoolsched_api.repository.ScheduleEntryRepository;
import com.schoolsched.schoolsched_api.repository.TeacherAvailabilityRepository;
import com.schoolsched.schoolsched_api.solver.ScheduleCell;
import com.schoolsched.schoolsched_api.solver.ScheduleGrid;

/**
 * Commits a preview: schedule entries, consumed availability and the schedule headers are written
 * together or not at all. Runs in a Mongo transaction when a transaction manager is configured and
 * undoes its own writes when a step fails.
 */
@Service
public class SchedulePublisher {

    private static final Logger logger = LoggerFactory.getLogger(SchedulePublisher.class);

    private final ScheduleEntryRepository entryRepository;
    private final PublishedScheduleRepository publishedScheduleRepository;
    private final TeacherAvailabilityRepository availabilityRepository;
    private final TeacherAvailabilityService availabilityService;

    public SchedulePublisher(ScheduleEntryRepository entryRepository,
                             PublishedScheduleRepository publishedScheduleRepository,
                             TeacherAvailabilityRepository availabilityRepository,
                             TeacherAvailabilityService availabilityService) {
        this.entryRepository = entryRepository;
        this.publishedScheduleRepository = publishedScheduleRepository;
        this.availabilityRepository = availabilityRepository;
        this.availabilityService = availabilityService;
    }

    @Transactional
    public PublishResponse publish(SchedulePreview preview, String requestedName, String publishedBy) {
        GenerateScheduleRequest request = preview.getRequest();
        Map<ScheduleKey, ScheduleGrid> gridsByKey = new LinkedHashMap<>();
        Map<ScheduleKey, String> namesByKey = new LinkedHashMap<>();
        for (ScheduleGrid grid : preview.getGrids()) {
            ScheduleKey key = new ScheduleKey(request.getAcademicYearId(), request.getSessionType(),
                    request.getClassId(), grid.getSection());
            gridsByKey.put(key, grid);
            namesByKey.put(key, scheduleName(preview, requestedName, grid.getSection()));
        }

        checkNames(namesByKey);
        Map<String, TeacherAvailability> availability = revalidateAvailability(preview, gridsByKey);

        String publicationId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        List<ScheduleEntry> writtenEntries = new ArrayList<>();
        List<TeacherAvailability> savedAvailability = new ArrayList<>();
        List<PublishedSchedule> savedHeaders = new ArrayList<>();
        List<PublishResponse.PublishedGrid> published = new ArrayList<>();

        try {
            for (Map.Entry<ScheduleKey, ScheduleGrid> entry : gridsByKey.entrySet()) {
                ScheduleKey key = entry.getKey();
                List<ScheduleEntry> cells = new ArrayList<>();
                for (ScheduleCell cell : entry.getValue().getCells()) {
                    ScheduleEntry scheduleEntry = new ScheduleEntry(key, cell.day(), cell.period(), cell.subjectId(),
                            cell.subjectName(), cell.teacherId(), cell.teacherName());
                    scheduleEntry.setPublicationId(publicationId);
                    scheduleEntry.setCreatedAt(now);
                    cells.add(scheduleEntry);

                    availability.get(cell.teacherId()).markAssigned(cell.day(), cell.period(),
                            new SlotAssignment(key, cell.subjectId(), cell.subjectName()));
                }
                writtenEntries.addAll(entryRepository.saveAll(cells));
            }

            for (TeacherAvailability teacherAvailability : availability.values()) {
                teacherAvailability.setUpdatedAt(now);
                savedAvailability.add(availabilityRepository.save(teacherAvailability));
            }

            for (Map.Entry<ScheduleKey, ScheduleGrid> entry : gridsByKey.entrySet()) {
                PublishedSchedule header = new PublishedSchedule(namesByKey.get(entry.getKey()), entry.getKey(),
                        entry.getValue().getFilledCount(), publishedBy, now);
                PublishedSchedule saved = publishedScheduleRepository.save(header);
                savedHeaders.add(saved);
                published.add(new PublishResponse.PublishedGrid(saved.getId(), saved.getName(),
                        saved.getSection(), saved.getCellCount()));
            }
        } catch (RuntimeException e) {
            logger.error("!!! Publish of preview {} failed after {} entries, {} availability grid(s), {} header(s). Rolling back. !!!",
                    preview.getToken(), writtenEntries.size(), savedAvailability.size(), savedHeaders.size(), e);
            rollback(gridsByKey.keySet(), writtenEntries, savedAvailability, savedHeaders, e);
            throw translate(e, gridsByKey.keySet().iterator().next(), requestedName);
        }

        logger.info("Published {} cell(s) in {} grid(s) for class {} ({}, year {}), publication {}",
                writtenEntries.size(), gridsByKey.size(), request.getClassId(),
                request.getSessionType().getValue(), request.getAcademicYearId(), publicationId);
        return new PublishResponse(writtenEntries.size(), published);
    }

    private void checkNames(Map<ScheduleKey, String> namesByKey) {
        Set<String> requested = new LinkedHashSet<>();
        for (Map.Entry<ScheduleKey, String> entry : namesByKey.entrySet()) {
            ScheduleKey key = entry.getKey();
            String name = entry.getValue();

            Optional<PublishedSchedule> existing = publishedScheduleRepository
                    .findByAcademicYearIdAndSessionTypeAndClassIdAndSection(
                            key.academicYearId(), key.sessionType(), key.classId(), key.section());
            if (existing.isPresent() || entryRepository.existsByAcademicYearIdAndSessionTypeAndClassIdAndSection(
                    key.academicYearId(), key.sessionType(), key.classId(), key.section())) {
                String existingName = existing.map(PublishedSchedule::getName).orElse(null);
                logger.warn("Publish rejected: {} is already published{}", key,
                        existingName != null ? " as '" + existingName + "'" : "");
                throw new NameConflictException(name, key, existingName,
                        "A schedule is already published for class " + key.classId() + " section " + key.section()
                                + " (" + key.sessionType().getValue() + ", year " + key.academicYearId() + ")"
                                + (existingName != null ? " under the name '" + existingName + "'" : "")
                                + ". Delete it before publishing again.");
            }

            if (!requested.add(name)) {
                throw new NameConflictException(name, key, name, "Schedule name '" + name + "' is used twice in this publish.");
            }
            Optional<PublishedSchedule> sameName = publishedScheduleRepository
                    .findByAcademicYearIdAndName(key.academicYearId(), name);
            if (sameName.isPresent()) {
                logger.warn("Publish rejected: name '{}' already used in year {}", name, key.academicYearId());
                throw new NameConflictException(name, key, sameName.get().getName(),
                        "The name '" + name + "' is already used by another schedule in academic year "
                                + key.academicYearId() + ". Choose a different name.");
            }
        }
    }

    /**
     * Reads availability now, not at preview time, and checks every consumed cell is still free.
     */
    private Map<String, TeacherAvailability> revalidateAvailability(SchedulePreview preview,
                                                                    Map<ScheduleKey, ScheduleGrid> gridsByKey) {
        Set<String> teacherIds = new LinkedHashSet<>();
        for (ScheduleGrid grid : gridsByKey.values()) {
            for (ScheduleCell cell : grid.getCells()) {
                teacherIds.add(cell.teacherId());
            }
        }
        Map<String, TeacherAvailability> availability = availabilityService.loadAll(teacherIds);
        GenerateScheduleRequest request = preview.getRequest();
        Map<String, ScheduleEntry> booked = new LinkedHashMap<>();
        for (ScheduleEntry existing : entryRepository.findAllByAcademicYearIdAndSessionTypeAndTeacherIdIn(
                request.getAcademicYearId(), request.getSessionType(), new ArrayList<>(teacherIds))) {
            booked.putIfAbsent(existing.getTeacherId() + "@" + existing.getSlotIndex(), existing);
        }

        List<AvailabilityConflict> conflicts = new ArrayList<>();
        for (ScheduleGrid grid : gridsByKey.values()) {
            for (ScheduleCell cell : grid.getCells()) {
                AvailabilitySlot slot = availability.get(cell.teacherId()).slotAt(cell.day(), cell.period());
                ScheduleEntry clash = booked.get(cell.teacherId() + "@" + cell.slotIndex());
                if (!slot.isFree() || clash != null) {
                    String heldBy = slot.getAssignment() != null
                            ? TeacherAvailabilityService.describe(slot.getAssignment())
                            : clash != null
                                    ? "class " + clash.getClassId() + " section " + clash.getSection()
                                    : "teacher declaration";
                    conflicts.add(new AvailabilityConflict(cell.teacherId(), cell.teacherName(), cell.day(),
                            cell.period(), slot.getStatus(), heldBy,
                            (cell.teacherName() != null ? cell.teacherName() : cell.teacherId()) + " is no longer free on "
                                    + cell.label() + " (held by " + heldBy + ")"));
                }
            }
        }
        if (!conflicts.isEmpty()) {
            logger.warn("Publish of preview {} rejected: {} slot(s) no longer free", preview.getToken(), conflicts.size());
            conflicts.forEach(c -> logger.warn("  - {}", c.message()));
            throw new AvailabilityConflictException(conflicts);
        }
        return availability;
    }

    private void rollback(Set<ScheduleKey> keys, List<ScheduleEntry> writtenEntries,
                          List<TeacherAvailability> savedAvailability, List<PublishedSchedule> savedHeaders,
                          RuntimeException cause) {
        try {
            if (!savedHeaders.isEmpty()) publishedScheduleRepository.deleteAll(savedHeaders);
        } catch (RuntimeException e) {
            logger.error("!!! Rollback of schedule headers failed !!!", e);
            cause.addSuppressed(e);
        }
        try {
            if (!writtenEntries.isEmpty()) entryRepository.deleteAll(writtenEntries);
        } catch (RuntimeException e) {
            logger.error("!!! Rollback of {} schedule entries failed !!!", writtenEntries.size(), e);
            cause.addSuppressed(e);
        }
        for (TeacherAvailability saved : savedAvailability) {
            try {
                TeacherAvailability current = availabilityService.load(saved.getTeacherId());
                boolean changed = false;
                for (AvailabilitySlot slot : current.getSlots()) {
                    for (ScheduleKey key : keys) {
                        changed |= current.release(slot.getDay(), slot.getPeriod(), key);
                    }
                }
                if (changed) availabilityRepository.save(current);
            } catch (RuntimeException e) {
                logger.error("!!! Rollback of availability for teacher {} failed !!!", saved.getTeacherId(), e);
                cause.addSuppressed(e);
            }
        }
    }

    private RuntimeException translate(RuntimeException e, ScheduleKey key, String requestedName) {
        if (e instanceof OptimisticLockingFailureException) {
            return new AvailabilityConflictException(
                    "Teacher availability changed while publishing; regenerate the preview and try again", e);
        }
        if (e instanceof DuplicateKeyException) {
            return new NameConflictException(requestedName, key, null,
                    "Another schedule for class " + key.classId() + " was published at the same time.");
        }
        return e;
    }

    static String scheduleName(SchedulePreview preview, String requestedName, String section) {
        if (requestedName != null && !requestedName.isBlank()) {
            String trimmed = requestedName.trim();
            return preview.getGrids().size() > 1 ? trimmed + " - section " + section : trimmed;
        }
        return preview.getClassDisplayName() + " - section " + section
                + " (" + preview.getRequest().getSessionType().getValue() + ")";
    }
}
