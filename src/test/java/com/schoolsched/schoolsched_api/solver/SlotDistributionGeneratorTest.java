package com.schoolsched.schoolsched_api.solver;

import static com.schoolsched.schoolsched_api.ScheduleFixtures.catalog;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.freeFirst;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.fullWeek;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.schoolsched.schoolsched_api.ScheduleFixtures;
import com.schoolsched.schoolsched_api.ScheduleFixtures.Catalog;
import com.schoolsched.schoolsched_api.exception.GenerationException;
import com.schoolsched.schoolsched_api.model.ConstraintType;
import com.schoolsched.schoolsched_api.model.ScheduleConstraint;
import com.schoolsched.schoolsched_api.model.WeekGrid;

class SlotDistributionGeneratorTest {

    private final SlotDistributionGenerator generator = new SlotDistributionGenerator();

    @Test
    void fillsEveryCellOfTheWeek() {
        List<ScheduleGrid> grids = generator.generate(fullWeek("C7").context());

        assertThat(grids).singleElement().satisfies(grid -> {
            assertThat(grid.isComplete()).isTrue();
            assertThat(grid.getCells()).hasSize(WeekGrid.SLOT_COUNT);
            for (int s = 1; s <= 6; s++) {
                assertThat(grid.countOf("C7-S" + s)).isEqualTo(5);
            }
        });
    }

    @Test
    void spreadsEachSubjectOverTheWeek() {
        ScheduleGrid grid = generator.generate(fullWeek("C7").context()).get(0);

        for (int day = 0; day < WeekGrid.DAYS; day++) {
            for (int period = 0; period < WeekGrid.PERIODS_PER_DAY; period++) {
                assertThat(grid.cellAt(day, period).subjectId()).isEqualTo("C7-S" + (period + 1));
            }
        }
    }

    @Test
    void sameInputGivesSameGrid() {
        Catalog catalog = fullWeek("C7");

        List<ScheduleCell> first = generator.generate(catalog.context()).get(0).getCells();
        List<ScheduleCell> second = generator.generate(catalog.context()).get(0).getCells();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void leavesContextAvailabilityUntouched() {
        ScheduleContext context = fullWeek("C7").context();

        generator.generate(context);

        assertThat(context.availability().freeCount("T1")).isEqualTo(WeekGrid.SLOT_COUNT);
    }

    @Test
    void teacherOfSeveralSectionsIsNeverInTwoPlacesAtOnce() {
        List<ScheduleGrid> grids = generator.generate(catalog("C7", 2, 5, 5, 5, 5, 5, 5).context());

        assertThat(grids).extracting(ScheduleGrid::getSection).containsExactly("1", "2");
        Set<String> teacherSlots = new HashSet<>();
        for (ScheduleGrid grid : grids) {
            assertThat(grid.isComplete()).isTrue();
            for (ScheduleCell cell : grid.getCells()) {
                assertThat(teacherSlots.add(cell.teacherId() + "@" + cell.slotIndex())).isTrue();
            }
        }
    }

    @Test
    void abortsWhenAnOccurrenceHasNoCell() {
        Catalog catalog = fullWeek("C7");
        catalog.availability.put("T1", freeFirst("T1", 4));

        assertThatThrownBy(() -> generator.generate(catalog.context()))
                .isInstanceOfSatisfying(GenerationException.class, e -> {
                    assertThat(e.getSubjectId()).isEqualTo("C7-S1");
                    assertThat(e.getTeacherId()).isEqualTo("T1");
                    assertThat(e.getOccurrence()).isEqualTo(5);
                    assertThat(e.getMissingHours()).isEqualTo(1);
                });
    }

    @Test
    void keepsSubjectInsideRequiredWindow() {
        Catalog catalog = fullWeek("C7");
        ScheduleConstraint lateOnly = new ScheduleConstraint(ScheduleFixtures.YEAR, ConstraintType.REQUIRED);
        lateOnly.setSubjectId("C7-S1");
        lateOnly.setTimeRangeStart(3);
        lateOnly.setTimeRangeEnd(5);
        catalog.constraints.add(lateOnly);

        ScheduleGrid grid = generator.generate(catalog.context()).get(0);

        assertThat(grid.getCells())
                .filteredOn(cell -> cell.subjectId().equals("C7-S1"))
                .hasSize(5)
                .allSatisfy(cell -> assertThat(cell.period()).isEqualTo(3));
        assertThat(grid.isComplete()).isTrue();
    }

    @Test
    void avoidsBackToBackPeriodsWhenLimited() {
        Catalog catalog = catalog("C7", 1, 6);
        catalog.availability.put("T1", freeFirst("T1", 12));
        ScheduleConstraint noDoubles = new ScheduleConstraint(ScheduleFixtures.YEAR, ConstraintType.MAX_CONSECUTIVE);
        noDoubles.setSubjectId("C7-S1");
        noDoubles.setMaxConsecutivePeriods(1);
        catalog.constraints.add(noDoubles);

        ScheduleGrid grid = generator.generate(catalog.context()).get(0);

        assertThat(grid.getCells()).extracting(ScheduleCell::period).containsOnly(0, 2, 4);
        assertThat(grid.countOnDay("C7-S1", 0)).isEqualTo(3);
        assertThat(grid.countOnDay("C7-S1", 1)).isEqualTo(3);
    }
}
