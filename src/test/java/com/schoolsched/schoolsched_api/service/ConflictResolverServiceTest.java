package com.schoolsched.schoolsched_api.service;

import static com.schoolsched.schoolsched_api.ScheduleFixtures.SESSION;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.YEAR;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.assignment;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.catalog;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.fullWeek;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.schoolsched.schoolsched_api.dto.ConflictDetail;
import com.schoolsched.schoolsched_api.dto.ConflictDetail.Severity;
import com.schoolsched.schoolsched_api.dto.ConflictDetail.Type;
import com.schoolsched.schoolsched_api.dto.GenerateScheduleRequest;
import com.schoolsched.schoolsched_api.dto.PublishRequest;
import com.schoolsched.schoolsched_api.model.AvailabilitySlot;
import com.schoolsched.schoolsched_api.model.ConstraintType;
import com.schoolsched.schoolsched_api.model.ScheduleConstraint;
import com.schoolsched.schoolsched_api.model.ScheduleEntry;
import com.schoolsched.schoolsched_api.model.ScheduleKey;
import com.schoolsched.schoolsched_api.model.SlotStatus;

class ConflictResolverServiceTest {

    private static final ScheduleKey GRID_A = new ScheduleKey(YEAR, SESSION, "A", "1");

    private InMemorySchoolData data;
    private ConflictResolverService resolver;

    @BeforeEach
    void setUp() {
        data = new InMemorySchoolData();
        resolver = data.conflictResolver();
        data.add(fullWeek("A"));
    }

    @Test
    void cleanPublishedScheduleHasNoFindings() {
        publishA();

        assertThat(resolver.resolveConflicts("A")).isEmpty();
    }

    @Test
    void unpublishedClassHasNoFindings() {
        assertThat(resolver.resolveConflicts("A")).isEmpty();
    }

    @Test
    void reportsAMissingCellAsEmptySlot() {
        publishA();
        data.entries.values().removeIf(e -> e.getDayOfWeek() == 2 && e.getPeriodNumber() == 4);

        List<ConflictDetail> conflicts = resolver.resolveConflicts("A");

        assertThat(conflicts).hasSize(1);
        ConflictDetail empty = conflicts.get(0);
        assertThat(empty.type()).isEqualTo(Type.EMPTY_SLOT);
        assertThat(empty.severity()).isEqualTo(Severity.ERROR);
        assertThat(empty.section()).isEqualTo("1");
        assertThat(empty.day()).isEqualTo(2);
        assertThat(empty.period()).isEqualTo(4);
    }

    @Test
    void reportsTeacherBookedInAnotherClassAtTheSameTime() {
        publishA();
        ScheduleEntry foreign = new ScheduleEntry(new ScheduleKey(YEAR, SESSION, "B", "1"), 0, 0, "B-S1",
                "Subject 1", "T1", "Teacher 1");
        foreign.setId("foreign");
        data.entries.put(foreign.getId(), foreign);

        List<ConflictDetail> conflicts = resolver.resolveConflicts("A");

        assertThat(conflicts).hasSize(1);
        assertThat(conflicts.get(0).type()).isEqualTo(Type.TEACHER_DOUBLE_BOOKED);
        assertThat(conflicts.get(0).teacherId()).isEqualTo("T1");
        assertThat(conflicts.get(0).message()).contains("class B section 1");
    }

    @Test
    void reportsCellThatAvailabilityNoLongerHolds() {
        publishA();
        AvailabilitySlot slot = data.availability.get("T2").slotAt(0, 1);
        slot.setStatus(SlotStatus.FREE);
        slot.setAssignment(null);

        List<ConflictDetail> conflicts = resolver.resolveConflicts("A");

        assertThat(conflicts).hasSize(1);
        assertThat(conflicts.get(0).type()).isEqualTo(Type.AVAILABILITY_MISMATCH);
        assertThat(conflicts.get(0).teacherId()).isEqualTo("T2");
        assertThat(conflicts.get(0).message()).contains("is free instead of held by this schedule");
    }

    @Test
    void forbiddenCellSeverityFollowsPriority() {
        publishA();
        data.constraints.add(forbidden("F-HIGH", "A-S1", 3));
        data.constraints.add(forbidden("F-LOW", "A-S1", 2));

        List<ConflictDetail> conflicts = resolver.resolveConflicts("A");

        assertThat(conflicts).hasSize(2);
        assertThat(conflicts.get(0).severity()).isEqualTo(Severity.ERROR);
        assertThat(conflicts.get(0).constraintId()).isEqualTo("F-HIGH");
        assertThat(conflicts.get(0).priorityLevel()).isEqualTo(3);
        assertThat(conflicts.get(1).severity()).isEqualTo(Severity.WARNING);
        assertThat(conflicts.get(1).constraintId()).isEqualTo("F-LOW");
        assertThat(conflicts).extracting(ConflictDetail::type).containsOnly(Type.CONSTRAINT_VIOLATION);
    }

    @Test
    void reassignedSubjectLeavesStrayCellsListedAfterErrors() {
        publishA();
        data.entries.values().removeIf(e -> e.getDayOfWeek() == 4 && e.getPeriodNumber() == 0);
        data.assignments.removeIf(a -> a.getSubjectId().equals("A-S6"));
        data.assignments.add(assignment("T5", "A", "A-S6", null));

        List<ConflictDetail> conflicts = resolver.resolveConflicts("A");

        assertThat(conflicts).hasSize(6);
        assertThat(conflicts.get(0).type()).isEqualTo(Type.EMPTY_SLOT);
        assertThat(conflicts.subList(1, 6)).extracting(ConflictDetail::type).containsOnly(Type.STRAY_ASSIGNMENT);
        assertThat(conflicts.subList(1, 6)).extracting(ConflictDetail::severity).containsOnly(Severity.WARNING);
        assertThat(conflicts.subList(1, 6)).extracting(ConflictDetail::teacherId).containsOnly("T6");
        assertThat(conflicts.subList(1, 6)).extracting(ConflictDetail::day).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    void malformedAvailabilityIsReportedPerTeacher() {
        publishA();
        data.availability.get("T3").getSlots().remove(29);

        List<ConflictDetail> conflicts = resolver.resolveConflicts("A");

        assertThat(conflicts).hasSize(1);
        assertThat(conflicts.get(0).type()).isEqualTo(Type.AVAILABILITY_MISMATCH);
        assertThat(conflicts.get(0).teacherId()).isEqualTo("T3");
        assertThat(conflicts.get(0).section()).isNull();
        assertThat(conflicts.get(0).message()).contains("expected 30 slots but found 29");
    }

    @Test
    void clashBetweenTwoSectionsOfTheClassIsReportedOnce() {
        data.add(catalog("C", 2, 5, 5, 5, 5, 5, 5));
        ScheduleWorkflowService workflow = data.workflow();
        SchedulePreview preview = workflow.generatePreview(new GenerateScheduleRequest(YEAR, SESSION, "C", null),
                "scheduler");
        workflow.publish(new PublishRequest(preview.getToken(), null, null), "admin");
        ScheduleEntry first = cellAt(new ScheduleKey(YEAR, SESSION, "C", "1"), 0, 0);
        ScheduleEntry second = cellAt(new ScheduleKey(YEAR, SESSION, "C", "2"), 0, 0);
        second.setTeacherId(first.getTeacherId());
        second.setTeacherName(first.getTeacherName());

        List<ConflictDetail> doubleBookings = resolver.resolveConflicts("C").stream()
                .filter(c -> c.type() == Type.TEACHER_DOUBLE_BOOKED)
                .collect(Collectors.toList());

        assertThat(doubleBookings).singleElement().satisfies(c -> {
            assertThat(c.section()).isEqualTo("1");
            assertThat(c.message()).contains("class C section 2");
        });
    }

    private ScheduleEntry cellAt(ScheduleKey key, int day, int period) {
        return data.entriesOf(key).stream()
                .filter(e -> e.getDayOfWeek() == day && e.getPeriodNumber() == period)
                .findFirst().orElseThrow();
    }

    private void publishA() {
        ScheduleWorkflowService workflow = data.workflow();
        SchedulePreview preview = workflow.generatePreview(new GenerateScheduleRequest(YEAR, SESSION, "A", null),
                "scheduler");
        workflow.publish(new PublishRequest(preview.getToken(), null, null), "admin");
        assertThat(data.entriesOf(GRID_A)).hasSize(30);
    }

    private static ScheduleConstraint forbidden(String id, String subjectId, int priority) {
        ScheduleConstraint constraint = new ScheduleConstraint(YEAR, ConstraintType.FORBIDDEN);
        constraint.setId(id);
        constraint.setSubjectId(subjectId);
        constraint.setDayOfWeek(1);
        constraint.setPeriodNumber(0);
        constraint.setPriorityLevel(priority);
        return constraint;
    }
}
