package com.schoolsched.schoolsched_api.service;

import static com.schoolsched.schoolsched_api.ScheduleFixtures.SESSION;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.YEAR;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.catalog;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.freeFirst;
import static com.schoolsched.schoolsched_api.ScheduleFixtures.fullWeek;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.dao.OptimisticLockingFailureException;

import com.schoolsched.schoolsched_api.ScheduleFixtures.Catalog;
import com.schoolsched.schoolsched_api.dto.FeasibilityReport;
import com.schoolsched.schoolsched_api.dto.GenerateScheduleRequest;
import com.schoolsched.schoolsched_api.dto.ObstructionDetail;
import com.schoolsched.schoolsched_api.dto.ObstructionType;
import com.schoolsched.schoolsched_api.dto.PreviewResponse;
import com.schoolsched.schoolsched_api.dto.PublishRequest;
import com.schoolsched.schoolsched_api.dto.PublishResponse;
import com.schoolsched.schoolsched_api.exception.AvailabilityConflictException;
import com.schoolsched.schoolsched_api.exception.FeasibilityException;
import com.schoolsched.schoolsched_api.exception.NameConflictException;
import com.schoolsched.schoolsched_api.exception.ScheduleBusyException;
import com.schoolsched.schoolsched_api.model.ScheduleKey;
import com.schoolsched.schoolsched_api.model.SessionType;
import com.schoolsched.schoolsched_api.model.SlotStatus;
import com.schoolsched.schoolsched_api.model.TeacherAvailability;
import com.schoolsched.schoolsched_api.solver.SlotDistributionGenerator;

class ScheduleWorkflowServiceTest {

    private static final ScheduleKey GRID_A = new ScheduleKey(YEAR, SESSION, "A", "1");
    private static final ScheduleKey GRID_B = new ScheduleKey(YEAR, SESSION, "B", "1");

    private InMemorySchoolData data;
    private ScheduleWorkflowService workflow;

    @BeforeEach
    void setUp() {
        data = new InMemorySchoolData();
        workflow = data.workflow();
    }

    @Test
    void previewIsHeldInMemoryOnly() {
        data.add(fullWeek("A"));

        SchedulePreview preview = workflow.generatePreview(request("A"), "scheduler");

        assertThat(preview.getCellCount()).isEqualTo(30);
        assertThat(preview.getClassDisplayName()).isEqualTo("Grade 7");
        assertThat(workflow.getState(preview.getToken())).isEqualTo(GenerationState.PREVIEW_READY);
        assertThat(data.entries).isEmpty();
        verify(data.entryRepository, never()).saveAll(anyIterable());
        verify(data.availabilityRepository, never()).save(any(TeacherAvailability.class));
    }

    @Test
    void previewResponseListsEveryCell() {
        data.add(catalog("A", 2, 5, 5, 5, 5, 5, 5));

        PreviewResponse response = workflow.toResponse(workflow.generatePreview(request("A"), "scheduler"));

        assertThat(response.cellCount()).isEqualTo(60);
        assertThat(response.state()).isEqualTo(GenerationState.PREVIEW_READY);
        assertThat(response.grids()).extracting(PreviewResponse.SectionGrid::section).containsExactly("1", "2");
        assertThat(response.grids().get(0).cells()).hasSize(30);
    }

    @Test
    void publishWritesThirtyCellsAndConsumesAvailability() {
        data.add(fullWeek("A"));
        SchedulePreview preview = workflow.generatePreview(request("A"), "scheduler");

        PublishResponse response = workflow.publish(new PublishRequest(preview.getToken(), null, null), "admin");

        assertThat(response.publishedCount()).isEqualTo(30);
        assertThat(response.schedules()).singleElement().satisfies(grid -> {
            assertThat(grid.name()).isEqualTo("Grade 7 - section 1 (morning)");
            assertThat(grid.cellCount()).isEqualTo(30);
        });
        assertThat(data.entriesOf(GRID_A)).hasSize(30);
        assertThat(data.headers).hasSize(1);
        for (int i = 1; i <= 6; i++) {
            assertThat(data.countStatus("T" + i, SlotStatus.ASSIGNED)).isEqualTo(5);
            assertThat(data.countStatus("T" + i, SlotStatus.FREE)).isEqualTo(25);
        }
        assertThat(workflow.getState(preview.getToken())).isEqualTo(GenerationState.PUBLISHED);
        assertThatThrownBy(() -> workflow.getPreview(preview.getToken())).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void discardTouchesNothingPersistent() {
        data.add(fullWeek("A"));
        SchedulePreview preview = workflow.generatePreview(request("A"), "scheduler");

        workflow.discard(preview.getToken());

        assertThat(workflow.getState(preview.getToken())).isEqualTo(GenerationState.DISCARDED);
        assertThat(data.entries).isEmpty();
        assertThat(data.headers).isEmpty();
        assertThat(data.countStatus("T1", SlotStatus.FREE)).isEqualTo(30);
        verify(data.entryRepository, never()).saveAll(anyIterable());
        verify(data.availabilityRepository, never()).save(any(TeacherAvailability.class));
        assertThatThrownBy(() -> workflow.discard(preview.getToken())).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void infeasibleRequestNeverReachesTheGenerator() {
        Catalog catalog = fullWeek("A");
        catalog.assignments.get(1).setTeacherId("T1");
        catalog.availability.put("T1", freeFirst("T1", 8));
        data.add(catalog);
        SlotDistributionGenerator generator = spy(new SlotDistributionGenerator());
        workflow = data.workflow(generator);

        assertThatThrownBy(() -> workflow.generatePreview(request("A"), "scheduler"))
                .isInstanceOfSatisfying(FeasibilityException.class, e ->
                        assertThat(e.getObstructions()).singleElement().satisfies(o -> {
                            assertThat(o.type()).isEqualTo(ObstructionType.INSUFFICIENT_TEACHER_AVAILABILITY);
                            assertThat(o.teacherId()).isEqualTo("T1");
                            assertThat(o.shortfall()).isEqualTo(2);
                        }));
        verify(generator, never()).generate(any());
        assertThat(data.previewStore.size()).isZero();
    }

    @Test
    void failedRequestsLeaveNoStateBehind() {
        data.add(catalog("A", 1, 5, 5, 5, 5, 5, 4));

        for (int i = 0; i < 50; i++) {
            assertThatThrownBy(() -> workflow.generatePreview(request("A"), "scheduler"))
                    .isInstanceOf(FeasibilityException.class);
        }

        assertThat(data.previewStore.size()).isZero();
        assertThat(data.previewStore.stateCount()).isZero();
    }

    @Test
    void validateReportsWithoutHoldingAnything() {
        data.add(catalog("A", 1, 5, 5, 5, 5, 5, 4));

        FeasibilityReport report = workflow.validateFeasibility(request("A"));

        assertThat(report.feasible()).isFalse();
        assertThat(report.obstructions()).extracting(ObstructionDetail::type).containsExactly(ObstructionType.HOURS_MISMATCH);
        assertThat(data.previewStore.size()).isZero();
    }

    @Test
    void secondPublishOfTheSameTeacherSlotsIsRejected() {
        data.add(fullWeek("A"));
        data.add(gradeEight("B"));
        SchedulePreview previewA = workflow.generatePreview(request("A"), "scheduler");
        SchedulePreview previewB = workflow.generatePreview(request("B"), "scheduler");
        workflow.publish(new PublishRequest(previewA.getToken(), null, null), "admin");

        assertThatThrownBy(() -> workflow.publish(new PublishRequest(previewB.getToken(), null, null), "admin"))
                .isInstanceOfSatisfying(AvailabilityConflictException.class, e -> {
                    assertThat(e.getConflicts()).hasSize(30);
                    assertThat(e.getConflicts()).anySatisfy(c -> {
                        assertThat(c.teacherId()).isEqualTo("T1");
                        assertThat(c.day()).isZero();
                        assertThat(c.period()).isZero();
                        assertThat(c.currentStatus()).isEqualTo(SlotStatus.ASSIGNED);
                    });
                });
        assertThat(data.entriesOf(GRID_B)).isEmpty();
        assertThat(data.entriesOf(GRID_A)).hasSize(30);
        assertThat(data.countStatus("T1", SlotStatus.ASSIGNED)).isEqualTo(5);
        assertThat(workflow.getState(previewB.getToken())).isEqualTo(GenerationState.FAILED);
    }

    @Test
    void publishDeleteAndPublishAgain() {
        data.add(fullWeek("A"));
        ScheduleDeletionService deletion = data.deletionService();
        publish("A", null);

        assertThat(deletion.deleteClassSchedule(YEAR, SESSION, "A", "1").deletedCount()).isEqualTo(30);
        assertThat(data.entries).isEmpty();
        assertThat(data.headers).isEmpty();
        assertThat(data.countStatus("T1", SlotStatus.FREE)).isEqualTo(30);

        PublishResponse again = publish("A", null);

        assertThat(again.publishedCount()).isEqualTo(30);
        assertThat(data.countStatus("T1", SlotStatus.ASSIGNED)).isEqualTo(5);
    }

    @Test
    void publishingOverAnExistingGridIsANameConflict() {
        data.add(fullWeek("A"));
        publish("A", null);
        SchedulePreview second = workflow.generatePreview(request("A"), "scheduler");

        assertThatThrownBy(() -> workflow.publish(new PublishRequest(second.getToken(), null, null), "admin"))
                .isInstanceOf(NameConflictException.class)
                .hasMessageContaining("Delete it before publishing again");
        assertThat(workflow.getState(second.getToken())).isEqualTo(GenerationState.PREVIEW_READY);
        assertThat(data.entries).hasSize(30);
    }

    @Test
    void scheduleNameIsUniqueWithinTheYear() {
        data.add(fullWeek("A"));
        data.add(gradeEight("B"));
        publish("A", "Grade 7 Blue");
        SchedulePreview previewB = workflow.generatePreview(request("B"), "scheduler");

        assertThatThrownBy(() -> workflow.publish(new PublishRequest(previewB.getToken(), "Grade 7 Blue", null), "admin"))
                .isInstanceOfSatisfying(NameConflictException.class,
                        e -> assertThat(e.getExistingName()).isEqualTo("Grade 7 Blue"));
        assertThat(data.entriesOf(GRID_B)).isEmpty();
    }

    @Test
    void customNameGetsSectionSuffixWhenSeveralGridsArePublished() {
        data.add(catalog("A", 2, 5, 5, 5, 5, 5, 5));

        PublishResponse response = publish("A", "Blue");

        assertThat(response.publishedCount()).isEqualTo(60);
        assertThat(response.schedules()).extracting(PublishResponse.PublishedGrid::name)
                .containsExactly("Blue - section 1", "Blue - section 2");
        assertThat(data.countStatus("T1", SlotStatus.ASSIGNED)).isEqualTo(10);
    }

    @Test
    void publishWithoutTokenRegeneratesFirst() {
        data.add(fullWeek("A"));

        PublishResponse response = workflow.publish(new PublishRequest(null, "Fresh", request("A")), "admin");

        assertThat(response.publishedCount()).isEqualTo(30);
        assertThat(response.schedules().get(0).name()).isEqualTo("Fresh");
    }

    @Test
    void failedPublishWithoutTokenDropsTheRegeneratedPreview() {
        data.add(fullWeek("A"));
        publish("A", null);
        int statesBefore = data.previewStore.stateCount();

        assertThatThrownBy(() -> workflow.publish(new PublishRequest(null, "Again", request("A")), "admin"))
                .isInstanceOf(NameConflictException.class);

        assertThat(data.previewStore.size()).isZero();
        assertThat(data.previewStore.stateCount()).isEqualTo(statesBefore);
        assertThat(data.entries).hasSize(30);
    }

    @Test
    void publishRequiresTokenOrRequest() {
        assertThatThrownBy(() -> workflow.publish(new PublishRequest(null, "x", null), "admin"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void expiredPreviewCannotBePublished() {
        data.add(fullWeek("A"));
        SchedulePreview preview = workflow.generatePreview(request("A"), "scheduler");
        data.clock.advance(Duration.ofMinutes(31));

        assertThatThrownBy(() -> workflow.publish(new PublishRequest(preview.getToken(), null, null), "admin"))
                .isInstanceOf(NoSuchElementException.class);
        assertThat(workflow.getState(preview.getToken())).isEqualTo(GenerationState.DISCARDED);
        assertThat(data.entries).isEmpty();
    }

    @Test
    void staleAvailabilityDuringPublishUndoesEveryWrite() {
        data.add(fullWeek("A"));
        SchedulePreview preview = workflow.generatePreview(request("A"), "scheduler");
        doThrow(new OptimisticLockingFailureException("stale"))
                .when(data.availabilityRepository)
                .save(ArgumentMatchers.<TeacherAvailability>argThat(a -> a != null && "T3".equals(a.getTeacherId())));

        assertThatThrownBy(() -> workflow.publish(new PublishRequest(preview.getToken(), null, null), "admin"))
                .isInstanceOf(AvailabilityConflictException.class);
        assertThat(data.entries).isEmpty();
        assertThat(data.headers).isEmpty();
        for (int i = 1; i <= 6; i++) {
            assertThat(data.countStatus("T" + i, SlotStatus.ASSIGNED)).isZero();
        }
        assertThat(workflow.getState(preview.getToken())).isEqualTo(GenerationState.FAILED);
    }

    @Test
    void concurrentRequestForTheSameClassIsRefused() throws Exception {
        data.add(fullWeek("A"));
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> data.lockRegistry.withLock(ScheduleKey.classLockKey(YEAR, SESSION, "A"), () -> {
            held.countDown();
            awaitQuietly(release);
            return null;
        }));
        holder.start();
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> workflow.generatePreview(request("A"), "scheduler"))
                    .isInstanceOf(ScheduleBusyException.class);
        } finally {
            release.countDown();
            holder.join(5000);
        }
        assertThat(workflow.generatePreview(request("A"), "scheduler").getCellCount()).isEqualTo(30);
    }

    @Test
    void unknownTokenIsNotFound() {
        assertThatThrownBy(() -> workflow.getState("missing")).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> workflow.getPreview("missing")).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void requestForBothSessionsIsRejected() {
        GenerateScheduleRequest both = new GenerateScheduleRequest(YEAR, SessionType.BOTH, "A", null);

        assertThatThrownBy(() -> workflow.generatePreview(both, "scheduler")).isInstanceOf(IllegalArgumentException.class);
    }

    private PublishResponse publish(String classId, String name) {
        SchedulePreview preview = workflow.generatePreview(request(classId), "scheduler");
        return workflow.publish(new PublishRequest(preview.getToken(), name, null), "admin");
    }

    /** Same teachers as {@code fullWeek("A")} but a different display name. */
    static Catalog gradeEight(String classId) {
        Catalog catalog = fullWeek(classId);
        catalog.schoolClass.setGradeNumber(8);
        return catalog;
    }

    private static GenerateScheduleRequest request(String classId) {
        return new GenerateScheduleRequest(YEAR, SESSION, classId, null);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
