package com.schoolsched.schoolsched_api.service;

import static com.schoolsched.schoolsched_api.ScheduleFixtures.SESSION;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.YEAR;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.catalog;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.fullWeek;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.NoSuchElementException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.schoolsched.schoolsched_api.dto.GenerateScheduleRequest;
import com.schoolsched.schoolsched_api.dto.PublishRequest;
import com.schoolsched.schoolsched_api.dto.ScheduleStatistics;

class ScheduleStatisticsServiceTest {

    private InMemorySchoolData data;
    private ScheduleStatisticsService statistics;

    @BeforeEach
    void setUp() {
        data = new InMemorySchoolData();
        statistics = data.statistics();
    }

    @Test
    void summarizesAFullWeek() {
        data.add(fullWeek("A"));
        publish("A");

        ScheduleStatistics stats = statistics.getStatistics(YEAR, SESSION, "A", null);

        assertThat(stats.sections()).containsExactly("1");
        assertThat(stats.totalPeriods()).isEqualTo(30);
        assertThat(stats.filledPeriods()).isEqualTo(30);
        assertThat(stats.teacherUtilization()).hasSize(6).allSatisfy(load -> {
            assertThat(load.periods()).isEqualTo(5);
            assertThat(load.utilization()).isEqualTo(16.67);
        });
        assertThat(stats.subjectDistribution()).hasSize(6)
                .allSatisfy(subject -> assertThat(subject.periods()).isEqualTo(5));
        assertThat(stats.dailyDistribution()).containsOnlyKeys("Sunday", "Monday", "Tuesday", "Wednesday", "Thursday");
        assertThat(stats.dailyDistribution().values()).containsOnly(6);
    }

    @Test
    void teacherOfTwoSectionsCountsBoth() {
        data.add(catalog("A", 2, 5, 5, 5, 5, 5, 5));
        publish("A");

        ScheduleStatistics whole = statistics.getStatistics(YEAR, SESSION, "A", null);
        ScheduleStatistics sectionTwo = statistics.getStatistics(YEAR, SESSION, "A", "2");

        assertThat(whole.sections()).containsExactly("1", "2");
        assertThat(whole.totalPeriods()).isEqualTo(60);
        assertThat(whole.teacherUtilization()).allSatisfy(load -> {
            assertThat(load.periods()).isEqualTo(10);
            assertThat(load.utilization()).isEqualTo(33.33);
        });
        assertThat(sectionTwo.filledPeriods()).isEqualTo(30);
    }

    @Test
    void unpublishedClassIsNotFound() {
        data.add(fullWeek("A"));

        assertThatThrownBy(() -> statistics.getStatistics(YEAR, SESSION, "A", null))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("class A");
    }

    private void publish(String classId) {
        ScheduleWorkflowService workflow = data.workflow();
        SchedulePreview preview = workflow.generatePreview(new GenerateScheduleRequest(YEAR, SESSION, classId, null),
                "scheduler");
        workflow.publish(new PublishRequest(preview.getToken(), null, null), "admin");
    }
}
