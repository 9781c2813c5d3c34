package com.schoolsched.schoolsched_api.solver;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import com.schoolsched.schoolsched_api.model.TeacherAvailability;
import com.schoolsched.schoolsched_api.model.WeekGrid;

/**
 * Working copy of teacher free flags. Generation consumes cells of a private copy so that
 * concurrent runs and the stored grids never see its in-flight changes.
 */
public class AvailabilitySnapshot {

    private final Map<String, boolean[]> freeSlots;

    private AvailabilitySnapshot(Map<String, boolean[]> freeSlots) {
        this.freeSlots = freeSlots;
    }

    public static AvailabilitySnapshot of(Map<String, TeacherAvailability> availabilities) {
        Map<String, boolean[]> freeSlots = new HashMap<>();
        for (Map.Entry<String, TeacherAvailability> entry : availabilities.entrySet()) {
            TeacherAvailability availability = entry.getValue().requireWellFormed();
            boolean[] flags = new boolean[WeekGrid.SLOT_COUNT];
            for (int i = 0; i < WeekGrid.SLOT_COUNT; i++) {
                flags[i] = availability.getSlots().get(i).isFree();
            }
            freeSlots.put(entry.getKey(), flags);
        }
        return new AvailabilitySnapshot(freeSlots);
    }

    public AvailabilitySnapshot copy() {
        Map<String, boolean[]> copied = new HashMap<>();
        freeSlots.forEach((teacherId, flags) -> copied.put(teacherId, flags.clone()));
        return new AvailabilitySnapshot(copied);
    }

    public boolean isFree(String teacherId, int day, int period) {
        boolean[] flags = freeSlots.get(teacherId);
        return flags != null && flags[WeekGrid.index(day, period)];
    }

    public int freeCount(String teacherId) {
        boolean[] flags = freeSlots.get(teacherId);
        if (flags == null) return 0;
        int count = 0;
        for (boolean free : flags) {
            if (free) count++;
        }
        return count;
    }

    public void consume(String teacherId, int day, int period) {
        if (!isFree(teacherId, day, period)) {
            throw new IllegalStateException("Teacher " + teacherId + " is not free on " + WeekGrid.label(day, period));
        }
        freeSlots.get(teacherId)[WeekGrid.index(day, period)] = false;
    }

    public Set<String> teacherIds() {
        return freeSlots.keySet();
    }
}
