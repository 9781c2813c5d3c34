package com.schoolsched.schoolsched_api.model;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;

/**
 * Fixed shape of the school week: 5 days (Sunday to Thursday) of 6 periods.
 * Every 30-cell structure in the application is indexed by {@code day * 6 + period}.
 */
public final class WeekGrid {

    public static final int DAYS = 5;
    public static final int PERIODS_PER_DAY = 6;
    public static final int SLOT_COUNT = DAYS * PERIODS_PER_DAY;

    public static final List<DayOfWeek> SCHOOL_DAYS = List.of(
            DayOfWeek.SUNDAY, DayOfWeek.MONDAY, DayOfWeek.TUESDAY,
            DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY
    );

    private WeekGrid() {}

    public static int index(int day, int period) {
        checkSlot(day, period);
        return day * PERIODS_PER_DAY + period;
    }

    public static int dayOf(int index) {
        checkIndex(index);
        return index / PERIODS_PER_DAY;
    }

    public static int periodOf(int index) {
        checkIndex(index);
        return index % PERIODS_PER_DAY;
    }

    public static boolean isValidDay(int day) {
        return day >= 0 && day < DAYS;
    }

    public static boolean isValidPeriod(int period) {
        return period >= 0 && period < PERIODS_PER_DAY;
    }

    public static void checkSlot(int day, int period) {
        if (!isValidDay(day)) {
            throw new IllegalArgumentException("Day must be between 0 and " + (DAYS - 1) + ", got " + day);
        }
        if (!isValidPeriod(period)) {
            throw new IllegalArgumentException("Period must be between 0 and " + (PERIODS_PER_DAY - 1) + ", got " + period);
        }
    }

    private static void checkIndex(int index) {
        if (index < 0 || index >= SLOT_COUNT) {
            throw new IllegalArgumentException("Slot index must be between 0 and " + (SLOT_COUNT - 1) + ", got " + index);
        }
    }

    public static String dayName(int day) {
        if (!isValidDay(day)) {
            return "Day " + day;
        }
        return SCHOOL_DAYS.get(day).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    /** e.g. "Monday, period 4" (periods are shown 1-based). */
    public static String label(int day, int period) {
        return dayName(day) + ", period " + (period + 1);
    }
}
