package com.schoolsched.schoolsched_api.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.schoolsched.schoolsched_api.dto.ScheduleStatistics;
import com.schoolsched.schoolsched_api.dto.ScheduleStatistics.SubjectLoad;
import com.schoolsched.schoolsched_api.dto.ScheduleStatistics.TeacherLoad;
import com.schoolsched.schoolsched_api.model.ScheduleEntry;
import com.schoolsched.schoolsched_api.model.SessionType;
import com.schoolsched.schoolsched_api.model.WeekGrid;

/**
 * Load figures over the published cells of a class.
 */
@Service
public class ScheduleStatisticsService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleStatisticsService.class);

    private final ScheduleQueryService queryService;

    public ScheduleStatisticsService(ScheduleQueryService queryService) {
        this.queryService = queryService;
    }

    public ScheduleStatistics getStatistics(String academicYearId, SessionType sessionType, String classId,
                                            String section) {
        List<ScheduleEntry> cells = queryService.getPublishedCells(academicYearId, sessionType, classId, section);
        if (cells.isEmpty()) {
            throw new NoSuchElementException("No published schedule found for class " + classId
                    + (section != null && !section.isBlank() ? " section " + section : "") + ".");
        }

        List<String> sections = cells.stream().map(ScheduleEntry::getSection).distinct().collect(Collectors.toList());

        Map<String, TeacherLoad> teachers = new LinkedHashMap<>();
        Map<String, SubjectLoad> subjects = new LinkedHashMap<>();
        Map<String, Integer> daily = new LinkedHashMap<>();
        for (int day = 0; day < WeekGrid.DAYS; day++) {
            daily.put(WeekGrid.dayName(day), 0);
        }
        for (ScheduleEntry cell : cells) {
            teachers.merge(cell.getTeacherId(), new TeacherLoad(cell.getTeacherId(), cell.getTeacherName(), 1, 0),
                    (a, b) -> new TeacherLoad(a.teacherId(), a.teacherName(), a.periods() + 1, 0));
            subjects.merge(cell.getSubjectId(), new SubjectLoad(cell.getSubjectId(), cell.getSubjectName(), 1),
                    (a, b) -> new SubjectLoad(a.subjectId(), a.subjectName(), a.periods() + 1));
            daily.merge(WeekGrid.dayName(cell.getDayOfWeek()), 1, Integer::sum);
        }

        List<TeacherLoad> utilization = new ArrayList<>();
        for (TeacherLoad load : teachers.values()) {
            utilization.add(new TeacherLoad(load.teacherId(), load.teacherName(), load.periods(),
                    percentOfWeek(load.periods())));
        }

        logger.info("Statistics for class {}: {} cell(s) over {} section(s), {} teacher(s)", classId, cells.size(),
                sections.size(), utilization.size());
        return new ScheduleStatistics(academicYearId, sessionType, classId, sections,
                sections.size() * WeekGrid.SLOT_COUNT, cells.size(), utilization,
                new ArrayList<>(subjects.values()), daily);
    }

    static double percentOfWeek(int periods) {
        return Math.round(periods * 10000.0 / WeekGrid.SLOT_COUNT) / 100.0;
    }
}
