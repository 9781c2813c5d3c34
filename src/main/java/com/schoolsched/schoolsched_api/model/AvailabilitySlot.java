package com.schoolsched.schoolsched_api.model;

public class AvailabilitySlot {
    private int day;
    private int period;
    private SlotStatus status;
    private SlotAssignment assignment;

    public AvailabilitySlot() {}

    public AvailabilitySlot(int day, int period, SlotStatus status) {
        this.day = day;
        this.period = period;
        this.status = status;
    }

    public int getDay() { return day; }
    public int getPeriod() { return period; }
    public SlotStatus getStatus() { return status; }
    public SlotAssignment getAssignment() { return assignment; }

    public void setDay(int day) { this.day = day; }
    public void setPeriod(int period) { this.period = period; }
    public void setStatus(SlotStatus status) { this.status = status; }
    public void setAssignment(SlotAssignment assignment) { this.assignment = assignment; }

    public boolean isFree() {
        return status == SlotStatus.FREE;
    }

    public AvailabilitySlot copy() {
        AvailabilitySlot copy = new AvailabilitySlot(day, period, status);
        copy.assignment = assignment != null ? assignment.copy() : null;
        return copy;
    }
}
