package com.schoolsched.schoolsched_api.service;

import static com.schoolsched.schoolsched_api.ScheduleFixtures.SESSION;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.YEAR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.schoolsched.schoolsched_api.model.ScheduleEntry;
import com.schoolsched.schoolsched_api.model.ScheduleKey;
import com.schoolsched.schoolsched_api.repository.ScheduleEntryRepository;

@ExtendWith(MockitoExtension.class)
class ScheduleQueryServiceTest {

    @Mock
    private ScheduleEntryRepository entryRepository;

    @InjectMocks
    private ScheduleQueryService queryService;

    @Test
    void ordersCellsBySectionDayAndPeriod() {
        when(entryRepository.findAllByAcademicYearIdAndSessionTypeAndClassId(YEAR, SESSION, "A")).thenReturn(List.of(
                entry("2", 0, 0), entry("1", 1, 0), entry("1", 0, 3), entry("1", 0, 1)));

        List<ScheduleEntry> cells = queryService.getPublishedCells(YEAR, SESSION, "A", null);

        assertThat(cells).extracting(e -> e.getSection() + "/" + e.getDayOfWeek() + "/" + e.getPeriodNumber())
                .containsExactly("1/0/1", "1/0/3", "1/1/0", "2/0/0");
    }

    @Test
    void ordersSectionsNumerically() {
        when(entryRepository.findAllByAcademicYearIdAndSessionTypeAndClassId(YEAR, SESSION, "A")).thenReturn(List.of(
                entry("10", 0, 0), entry("2", 0, 0), entry("1", 0, 0), entry("11", 0, 0)));

        assertThat(queryService.getPublishedCells(YEAR, SESSION, "A", null)).extracting(ScheduleEntry::getSection)
                .containsExactly("1", "2", "10", "11");
    }

    @Test
    void sectionNarrowsTheQuery() {
        when(entryRepository.findAllByAcademicYearIdAndSessionTypeAndClassIdAndSection(YEAR, SESSION, "A", "2"))
                .thenReturn(List.of(entry("2", 0, 0)));

        assertThat(queryService.getPublishedCells(YEAR, SESSION, "A", "2")).hasSize(1);
        verify(entryRepository).findAllByAcademicYearIdAndSessionTypeAndClassIdAndSection(YEAR, SESSION, "A", "2");
    }

    @Test
    void requiresYearClassAndSession() {
        assertThatThrownBy(() -> queryService.getPublishedCells(" ", SESSION, "A", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queryService.getPublishedCells(YEAR, null, "A", null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(entryRepository);
    }

    private static ScheduleEntry entry(String section, int day, int period) {
        return new ScheduleEntry(new ScheduleKey(YEAR, SESSION, "A", section), day, period, "A-S1", "Subject 1",
                "T1", "Teacher 1");
    }
}
