package com.schoolsched.schoolsched_api.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import com.schoolsched.schoolsched_api.exception.MalformedAvailabilityException;

/**
 * A teacher's free-time grid: exactly 30 slots stored at index {@code day * 6 + period}.
 * The shape is checked with {@link #requireWellFormed()} every time the grid is read for scheduling.
 */
@Document("teacher_availability")
public class TeacherAvailability {
    @Id
    private String teacherId;
    private List<AvailabilitySlot> slots;
    @Version
    private Long version;
    private Instant updatedAt;

    public TeacherAvailability() {}

    public TeacherAvailability(String teacherId, List<AvailabilitySlot> slots) {
        this.teacherId = teacherId;
        this.slots = slots;
    }

    /**
     * A teacher who never declared anything has no free cells.
     */
    public static TeacherAvailability empty(String teacherId) {
        List<AvailabilitySlot> slots = new ArrayList<>(WeekGrid.SLOT_COUNT);
        for (int i = 0; i < WeekGrid.SLOT_COUNT; i++) {
            slots.add(new AvailabilitySlot(WeekGrid.dayOf(i), WeekGrid.periodOf(i), SlotStatus.UNAVAILABLE));
        }
        return new TeacherAvailability(teacherId, slots);
    }

    public String getTeacherId() { return teacherId; }
    public List<AvailabilitySlot> getSlots() { return slots; }
    public Long getVersion() { return version; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void setTeacherId(String teacherId) { this.teacherId = teacherId; }
    public void setSlots(List<AvailabilitySlot> slots) { this.slots = slots; }
    public void setVersion(Long version) { this.version = version; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    /**
     * Rejects anything that is not a flat list of 30 slots ordered by day and period.
     */
    public TeacherAvailability requireWellFormed() {
        if (slots == null) {
            throw new MalformedAvailabilityException(teacherId, "slot list is missing");
        }
        if (slots.size() != WeekGrid.SLOT_COUNT) {
            throw new MalformedAvailabilityException(teacherId,
                    "expected " + WeekGrid.SLOT_COUNT + " slots but found " + slots.size());
        }
        for (int i = 0; i < WeekGrid.SLOT_COUNT; i++) {
            AvailabilitySlot slot = slots.get(i);
            if (slot == null) {
                throw new MalformedAvailabilityException(teacherId, "slot " + i + " is null");
            }
            if (slot.getDay() != WeekGrid.dayOf(i) || slot.getPeriod() != WeekGrid.periodOf(i)) {
                throw new MalformedAvailabilityException(teacherId, "slot " + i + " holds day " + slot.getDay()
                        + " period " + slot.getPeriod() + " instead of day " + WeekGrid.dayOf(i)
                        + " period " + WeekGrid.periodOf(i));
            }
            if (slot.getStatus() == null) {
                throw new MalformedAvailabilityException(teacherId, "slot " + i + " has no status");
            }
            if (slot.getStatus() == SlotStatus.ASSIGNED && slot.getAssignment() == null) {
                throw new MalformedAvailabilityException(teacherId, "assigned slot " + i + " has no assignment");
            }
        }
        return this;
    }

    public AvailabilitySlot slotAt(int day, int period) {
        return slots.get(WeekGrid.index(day, period));
    }

    public boolean isFree(int day, int period) {
        return slotAt(day, period).isFree();
    }

    public int freeCount() {
        int count = 0;
        for (AvailabilitySlot slot : slots) {
            if (slot.isFree()) count++;
        }
        return count;
    }

    public void markAssigned(int day, int period, SlotAssignment assignment) {
        AvailabilitySlot slot = slotAt(day, period);
        if (!slot.isFree()) {
            throw new IllegalStateException("Teacher " + teacherId + " is not free on " + WeekGrid.label(day, period));
        }
        slot.setStatus(SlotStatus.ASSIGNED);
        slot.setAssignment(assignment);
    }

    /**
     * Frees the slot only when it is held by the given grid.
     *
     * @return true if the slot changed
     */
    public boolean release(int day, int period, ScheduleKey key) {
        AvailabilitySlot slot = slotAt(day, period);
        if (slot.getStatus() != SlotStatus.ASSIGNED || slot.getAssignment() == null
                || !slot.getAssignment().belongsTo(key)) {
            return false;
        }
        slot.setStatus(SlotStatus.FREE);
        slot.setAssignment(null);
        return true;
    }

    public TeacherAvailability copy() {
        List<AvailabilitySlot> copiedSlots = new ArrayList<>(slots.size());
        for (AvailabilitySlot slot : slots) {
            copiedSlots.add(slot.copy());
        }
        TeacherAvailability copy = new TeacherAvailability(teacherId, copiedSlots);
        copy.version = version;
        copy.updatedAt = updatedAt;
        return copy;
    }
}
