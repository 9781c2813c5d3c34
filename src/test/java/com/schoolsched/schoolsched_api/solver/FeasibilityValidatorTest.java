package com.schoolsched.schoolsched_api.solver;

import static com.schoolsched.schoolsched_api.ScheduleFixtures.catalog;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.freeFirst;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.fullWeek;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.schoolsched.schoolsched_api.ScheduleFixtures;
import com.schoolsched.schoolsched_api.ScheduleFixtures.Catalog;
import com.schoolsched.schoolsched_api.dto.FeasibilityReport;
import com.schoolsched.schoolsched_api.dto.ObstructionDetail;
import com.schoolsched.schoolsched_api.dto.ObstructionType;
import com.schoolsched.schoolsched_api.model.ConstraintType;
import com.schoolsched.schoolsched_api.model.ScheduleConstraint;

class FeasibilityValidatorTest {

    private final FeasibilityValidator validator = new FeasibilityValidator();

    @Test
    void fullyStaffedWeekIsFeasible() {
        FeasibilityReport report = validator.validate(fullWeek("C7").context());

        assertThat(report.feasible()).isTrue();
        assertThat(report.obstructions()).isEmpty();
        assertThat(report.sections()).containsExactly("1");
    }

    @Test
    void weekOfTwentyNineHoursIsRejected() {
        FeasibilityReport report = validator.validate(catalog("C7", 1, 5, 5, 5, 5, 5, 4).context());

        assertThat(report.feasible()).isFalse();
        assertThat(report.obstructions()).singleElement().satisfies(o -> {
            assertThat(o.type()).isEqualTo(ObstructionType.HOURS_MISMATCH);
            assertThat(o.requiredHours()).isEqualTo(30);
            assertThat(o.availableHours()).isEqualTo(29);
        });
    }

    @Test
    void weekOfThirtyOneHoursIsRejected() {
        FeasibilityReport report = validator.validate(catalog("C7", 1, 5, 5, 5, 5, 5, 6).context());

        assertThat(types(report)).containsExactly(ObstructionType.HOURS_MISMATCH);
        assertThat(report.obstructions().get(0).availableHours()).isEqualTo(31);
    }

    @Test
    void teacherOwingMoreThanFreeCellsIsReportedWithShortfall() {
        Catalog catalog = fullWeek("C7");
        catalog.assignments.get(1).setTeacherId("T1");
        catalog.teachers.remove(1);
        catalog.availability.remove("T2");
        catalog.availability.put("T1", freeFirst("T1", 8));

        FeasibilityReport report = validator.validate(catalog.context());

        assertThat(report.feasible()).isFalse();
        assertThat(report.obstructions()).singleElement().satisfies(o -> {
            assertThat(o.type()).isEqualTo(ObstructionType.INSUFFICIENT_TEACHER_AVAILABILITY);
            assertThat(o.teacherId()).isEqualTo("T1");
            assertThat(o.requiredHours()).isEqualTo(10);
            assertThat(o.availableHours()).isEqualTo(8);
            assertThat(o.shortfall()).isEqualTo(2);
        });
    }

    @Test
    void subjectShortfallNamesTheForbiddenRuleThatCausedIt() {
        Catalog catalog = fullWeek("C7");
        catalog.availability.put("T1", freeFirst("T1", 6));
        ScheduleConstraint noEarlyMath = new ScheduleConstraint(ScheduleFixtures.YEAR, ConstraintType.FORBIDDEN);
        noEarlyMath.setId("F1");
        noEarlyMath.setSubjectId("C7-S1");
        noEarlyMath.setDayOfWeek(0);
        noEarlyMath.setTimeRangeStart(0);
        noEarlyMath.setTimeRangeEnd(2);
        catalog.constraints.add(noEarlyMath);

        FeasibilityReport report = validator.validate(catalog.context());

        assertThat(types(report)).containsExactlyInAnyOrder(
                ObstructionType.INSUFFICIENT_SUBJECT_AVAILABILITY, ObstructionType.FORBIDDEN_CONSTRAINT_BLOCKS);
        ObstructionDetail shortfall = find(report, ObstructionType.INSUFFICIENT_SUBJECT_AVAILABILITY);
        assertThat(shortfall.requiredHours()).isEqualTo(5);
        assertThat(shortfall.availableHours()).isEqualTo(3);
        assertThat(find(report, ObstructionType.FORBIDDEN_CONSTRAINT_BLOCKS).constraintId()).isEqualTo("F1");
    }

    @Test
    void reportsUnassignedAndUnknownTeachers() {
        Catalog catalog = fullWeek("C7");
        catalog.assignments.remove(5);
        catalog.assignments.get(4).setTeacherId("T99");

        FeasibilityReport report = validator.validate(catalog.context());

        assertThat(types(report)).contains(ObstructionType.UNASSIGNED_SUBJECT, ObstructionType.UNKNOWN_TEACHER);
        assertThat(find(report, ObstructionType.UNASSIGNED_SUBJECT).subjectId()).isEqualTo("C7-S6");
        assertThat(find(report, ObstructionType.UNKNOWN_TEACHER).teacherId()).isEqualTo("T99");
    }

    @Test
    void periodNobodyCanTeachIsUncovered() {
        Catalog catalog = fullWeek("C7");
        for (int i = 1; i <= 6; i++) {
            catalog.availability.put("T" + i, freeFirst("T" + i, 24));
        }

        FeasibilityReport report = validator.validate(catalog.context());

        List<ObstructionDetail> uncovered = report.obstructions().stream()
                .filter(o -> o.type() == ObstructionType.UNCOVERED_PERIOD)
                .collect(Collectors.toList());
        assertThat(uncovered).hasSize(6);
        assertThat(uncovered).allSatisfy(o -> assertThat(o.day()).isEqualTo(4));
        assertThat(report.obstructions()).hasSize(6);
    }

    @Test
    void runsEveryCheckInOnePass() {
        Catalog catalog = catalog("C7", 1, 5, 5, 5, 5, 5, 4);
        catalog.availability.put("T1", freeFirst("T1", 2));

        FeasibilityReport report = validator.validate(catalog.context());

        assertThat(types(report)).contains(ObstructionType.HOURS_MISMATCH,
                ObstructionType.INSUFFICIENT_SUBJECT_AVAILABILITY, ObstructionType.INSUFFICIENT_TEACHER_AVAILABILITY);
    }

    private static List<ObstructionType> types(FeasibilityReport report) {
        return report.obstructions().stream().map(ObstructionDetail::type).collect(Collectors.toList());
    }

    private static ObstructionDetail find(FeasibilityReport report, ObstructionType type) {
        return report.obstructions().stream().filter(o -> o.type() == type).findFirst().orElseThrow();
    }
}
