package com.schoolsched.schoolsched_api.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.schoolsched.schoolsched_api.dto.AvailabilityConflict;
import com.schoolsched.schoolsched_api.dto.AvailabilityDeclaration;
import com.schoolsched.schoolsched_api.dto.AvailabilityDeclaration.SlotFlag;
import com.schoolsched.schoolsched_api.dto.AvailabilityView;
import com.schoolsched.schoolsched_api.exception.AvailabilityConflictException;
import com.schoolsched.schoolsched_api.model.AvailabilitySlot;
import com.schoolsched.schoolsched_api.model.SlotAssignment;
import com.schoolsched.schoolsched_api.model.SlotStatus;
import com.schoolsched.schoolsched_api.model.Teacher;
import com.schoolsched.schoolsched_api.model.TeacherAvailability;
import com.schoolsched.schoolsched_api.model.WeekGrid;
import com.schoolsched.schoolsched_api.repository.TeacherAvailabilityRepository;
import com.schoolsched.schoolsched_api.repository.TeacherRepository;

@Service
public class TeacherAvailabilityService {

    private static final Logger logger = LoggerFactory.getLogger(TeacherAvailabilityService.class);

    private final TeacherAvailabilityRepository availabilityRepository;
    private final TeacherRepository teacherRepository;

    public TeacherAvailabilityService(TeacherAvailabilityRepository availabilityRepository,
                                      TeacherRepository teacherRepository) {
        this.availabilityRepository = availabilityRepository;
        this.teacherRepository = teacherRepository;
    }

    public AvailabilityView getAvailability(String teacherId) {
        Teacher teacher = requireTeacher(teacherId);
        return toView(teacher, load(teacherId));
    }

    /**
     * Teacher self-declaration. Cells consumed by a published schedule keep their ASSIGNED state;
     * trying to mark one of them busy is a conflict.
     */
    public AvailabilityView declare(String teacherId, AvailabilityDeclaration declaration) {
        Teacher teacher = requireTeacher(teacherId);
        boolean[] free = toFlags(declaration);

        TeacherAvailability availability = load(teacherId);
        List<AvailabilityConflict> conflicts = new ArrayList<>();
        for (int i = 0; i < WeekGrid.SLOT_COUNT; i++) {
            AvailabilitySlot slot = availability.getSlots().get(i);
            if (slot.getStatus() == SlotStatus.ASSIGNED) {
                if (!free[i]) {
                    conflicts.add(new AvailabilityConflict(teacherId, teacher.getFullName(), slot.getDay(),
                            slot.getPeriod(), slot.getStatus(), describe(slot.getAssignment()),
                            "Cannot mark " + WeekGrid.label(slot.getDay(), slot.getPeriod())
                                    + " busy: it is used by " + describe(slot.getAssignment())));
                }
                continue;
            }
            slot.setStatus(free[i] ? SlotStatus.FREE : SlotStatus.UNAVAILABLE);
            slot.setAssignment(null);
        }
        if (!conflicts.isEmpty()) {
            logger.warn("Availability declaration for teacher {} rejected: {} published slot(s) affected",
                    teacherId, conflicts.size());
            throw new AvailabilityConflictException(conflicts);
        }

        availability.setUpdatedAt(Instant.now());
        TeacherAvailability saved = availabilityRepository.save(availability);
        logger.info("Teacher {} declared {} free period(s)", teacherId, saved.freeCount());
        return toView(teacher, saved);
    }

    /**
     * Current stored grid of the teacher, shape-checked. A teacher without a stored grid gets an
     * all-unavailable one (not persisted).
     */
    public TeacherAvailability load(String teacherId) {
        return availabilityRepository.findById(teacherId)
                .map(TeacherAvailability::requireWellFormed)
                .orElseGet(() -> TeacherAvailability.empty(teacherId));
    }

    public Map<String, TeacherAvailability> loadAll(Collection<String> teacherIds) {
        Map<String, TeacherAvailability> byTeacher = new LinkedHashMap<>();
        for (TeacherAvailability availability : availabilityRepository.findAllById(teacherIds)) {
            byTeacher.put(availability.getTeacherId(), availability.requireWellFormed());
        }
        for (String teacherId : teacherIds) {
            byTeacher.computeIfAbsent(teacherId, TeacherAvailability::empty);
        }
        return byTeacher;
    }

    public static String describe(SlotAssignment assignment) {
        if (assignment == null) {
            return "unknown schedule";
        }
        return (assignment.getSubjectName() != null ? assignment.getSubjectName() + " in " : "")
                + "class " + assignment.getClassId() + " section " + assignment.getSection()
                + " (" + (assignment.getSessionType() != null ? assignment.getSessionType().getValue() : "?")
                + ", year " + assignment.getAcademicYearId() + ")";
    }

    private Teacher requireTeacher(String teacherId) {
        return teacherRepository.findById(teacherId)
                .orElseThrow(() -> new NoSuchElementException("Teacher with ID " + teacherId + " not found."));
    }

    private boolean[] toFlags(AvailabilityDeclaration declaration) {
        if (declaration == null || declaration.slots() == null) {
            throw new IllegalArgumentException("Availability declaration must contain slots.");
        }
        if (declaration.slots().size() != WeekGrid.SLOT_COUNT) {
            throw new IllegalArgumentException("Availability declaration must contain exactly " + WeekGrid.SLOT_COUNT
                    + " slots, got " + declaration.slots().size());
        }
        boolean[] free = new boolean[WeekGrid.SLOT_COUNT];
        Set<Integer> seen = new HashSet<>();
        for (SlotFlag flag : declaration.slots()) {
            int index = WeekGrid.index(flag.day(), flag.period());
            if (!seen.add(index)) {
                throw new IllegalArgumentException("Duplicate slot in declaration: " + WeekGrid.label(flag.day(), flag.period()));
            }
            free[index] = flag.free();
        }
        return free;
    }

    private AvailabilityView toView(Teacher teacher, TeacherAvailability availability) {
        int assigned = 0;
        for (AvailabilitySlot slot : availability.getSlots()) {
            if (slot.getStatus() == SlotStatus.ASSIGNED) assigned++;
        }
        return new AvailabilityView(teacher.getId(), teacher.getFullName(), availability.freeCount(), assigned,
                availability.getSlots());
    }
}
