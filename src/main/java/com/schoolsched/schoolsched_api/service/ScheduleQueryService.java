package com.schoolsched.schoolsched_api.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Service;

import com.schoolsched.schoolsched_api.model.ScheduleEntry;
import com.schoolsched.schoolsched_api.model.SchoolClass;
import com.schoolsched.schoolsched_api.model.SessionType;
import com.schoolsched.schoolsched_api.repository.ScheduleEntryRepository;

@Service
public class ScheduleQueryService {

    static final Comparator<ScheduleEntry> GRID_ORDER = Comparator
            .comparing(ScheduleEntry::getSection, SchoolClass.SECTION_ORDER)
            .thenComparingInt(ScheduleEntry::getDayOfWeek)
            .thenComparingInt(ScheduleEntry::getPeriodNumber);

    private final ScheduleEntryRepository entryRepository;

    public ScheduleQueryService(ScheduleEntryRepository entryRepository) {
        this.entryRepository = entryRepository;
    }

    /**
     * Published cells of a class, or of one section when {@code section} is given,
     * ordered by section, day and period.
     */
    public List<ScheduleEntry> getPublishedCells(String academicYearId, SessionType sessionType, String classId,
                                                 String section) {
        if (academicYearId == null || academicYearId.isBlank() || classId == null || classId.isBlank()) {
            throw new IllegalArgumentException("academicYearId and classId are required.");
        }
        if (sessionType == null) {
            throw new IllegalArgumentException("sessionType is required.");
        }
        List<ScheduleEntry> entries = section != null && !section.isBlank()
                ? entryRepository.findAllByAcademicYearIdAndSessionTypeAndClassIdAndSection(
                        academicYearId, sessionType, classId, section)
                : entryRepository.findAllByAcademicYearIdAndSessionTypeAndClassId(academicYearId, sessionType, classId);
        List<ScheduleEntry> sorted = new ArrayList<>(entries);
        sorted.sort(GRID_ORDER);
        return sorted;
    }
}
