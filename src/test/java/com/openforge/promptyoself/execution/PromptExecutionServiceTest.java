package com.openforge.promptyoself.execution;

import com.openforge.promptyoself.delivery.PromptDelivery;
import com.openforge.promptyoself.domain.Reminder;
import com.openforge.promptyoself.domain.ScheduleType;
import com.openforge.promptyoself.schedule.RecurrenceCalculator;
import com.openforge.promptyoself.store.ReminderStore;
import com.openforge.promptyoself.store.ReminderUpdate;
import com.openforge.promptyoself.store.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PromptExecutionServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 1, 1, 10, 0);

    @Mock private ReminderStore store;
    @Mock private PromptDelivery delivery;
    @Captor private ArgumentCaptor<ReminderUpdate> patchCaptor;

    private PromptExecutionService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        service = new PromptExecutionService(store, new RecurrenceCalculator(), delivery, clock);
        when(store.update(anyLong(), any())).thenReturn(true);
        when(delivery.deliver(anyString(), anyString())).thenReturn(true);
    }

    private static Reminder reminder(long id, ScheduleType type, String value, Integer max, int count) {
        Reminder r = Reminder.builder()
                .agentId("agent-" + id)
                .message("prompt " + id)
                .scheduleType(type)
                .scheduleValue(value)
                .nextRun(NOW.minusSeconds(30))
                .maxRepetitions(max)
                .repetitionCount(count)
                .active(true)
                .build();
        r.setId(id);
        return r;
    }

    private ReminderUpdate capturedPatch(long id) {
        verify(store).update(eq(id), patchCaptor.capture());
        return patchCaptor.getValue();
    }

    // ------------------------------------------------------------------
    // Successful delivery
    // ------------------------------------------------------------------

    @Test
    void nothingDue_doesNothing() {
        when(store.due(NOW)).thenReturn(List.of());

        assertThat(service.executeDuePrompts()).isEmpty();
        verifyNoInteractions(delivery);
    }

    @Test
    void interval_reschedulesFromNow() {
        when(store.due(NOW)).thenReturn(List.of(reminder(1, ScheduleType.INTERVAL, "1m", null, 4)));

        List<ExecutionOutcome> outcomes = service.executeDuePrompts();

        verify(delivery).deliver("agent-1", "prompt 1");
        ReminderUpdate patch = capturedPatch(1);
        assertThat(patch.lastRun()).isEqualTo(NOW);
        assertThat(patch.nextRun()).isEqualTo(NOW.plusMinutes(1));
        assertThat(patch.repetitionCount()).isEqualTo(5);
        assertThat(patch.active()).isNull();
        assertThat(patch.clearNextRun()).isFalse();

        assertThat(outcomes).singleElement().satisfies(o -> {
            assertThat(o.delivered()).isTrue();
            assertThat(o.nextRun()).isEqualTo(NOW.plusMinutes(1));
            assertThat(o.repetitionCount()).isEqualTo(5);
            assertThat(o.maxRepetitions()).isNull();
            assertThat(o.completed()).isFalse();
            assertThat(o.error()).isNull();
        });
    }

    @Test
    void cron_reschedulesToNextMatch() {
        when(store.due(NOW)).thenReturn(List.of(reminder(2, ScheduleType.CRON, "0 9 * * *", null, 0)));

        service.executeDuePrompts();

        assertThat(capturedPatch(2).nextRun()).isEqualTo(LocalDateTime.of(2025, 1, 2, 9, 0));
    }

    @Test
    void repetitionCap_deactivatesOnTheLastAllowedDelivery() {
        when(store.due(NOW)).thenReturn(List.of(reminder(3, ScheduleType.INTERVAL, "1m", 3, 2)));

        ExecutionOutcome outcome = service.executeDuePrompts().get(0);

        ReminderUpdate patch = capturedPatch(3);
        assertThat(patch.repetitionCount()).isEqualTo(3);
        assertThat(patch.active()).isFalse();
        assertThat(patch.clearNextRun()).isTrue();
        assertThat(outcome.completed()).isTrue();
        assertThat(outcome.nextRun()).isNull();
        assertThat(outcome.maxRepetitions()).isEqualTo(3);
    }

    @Test
    void repetitionCap_notYetReached() {
        when(store.due(NOW)).thenReturn(List.of(reminder(4, ScheduleType.INTERVAL, "1m", 3, 1)));

        ExecutionOutcome outcome = service.executeDuePrompts().get(0);

        ReminderUpdate patch = capturedPatch(4);
        assertThat(patch.repetitionCount()).isEqualTo(2);
        assertThat(patch.active()).isNull();
        assertThat(outcome.completed()).isFalse();
    }

    @Test
    void once_isTerminalAfterOneDelivery() {
        when(store.due(NOW)).thenReturn(List.of(reminder(5, ScheduleType.ONCE, "2025-01-01T09:59:30Z", null, 0)));

        ExecutionOutcome outcome = service.executeDuePrompts().get(0);

        ReminderUpdate patch = capturedPatch(5);
        assertThat(patch.active()).isFalse();
        assertThat(patch.clearNextRun()).isTrue();
        assertThat(patch.repetitionCount()).isEqualTo(1);
        assertThat(outcome.delivered()).isTrue();
        assertThat(outcome.nextRun()).isNull();
        assertThat(outcome.completed()).isFalse();
    }

    // ------------------------------------------------------------------
    // Failed delivery
    // ------------------------------------------------------------------

    @Test
    void failedDelivery_onlyRecordsTheAttempt() {
        Reminder r = reminder(6, ScheduleType.INTERVAL, "1m", 3, 1);
        when(store.due(NOW)).thenReturn(List.of(r));
        when(delivery.deliver("agent-6", "prompt 6")).thenReturn(false);

        ExecutionOutcome outcome = service.executeDuePrompts().get(0);

        ReminderUpdate patch = capturedPatch(6);
        assertThat(patch.lastRun()).isEqualTo(NOW);
        assertThat(patch.nextRun()).isNull();
        assertThat(patch.clearNextRun()).isFalse();
        assertThat(patch.active()).isNull();
        assertThat(patch.repetitionCount()).isNull();

        assertThat(outcome.delivered()).isFalse();
        assertThat(outcome.error()).isEqualTo("Failed to deliver prompt");
        assertThat(outcome.nextRun()).isEqualTo(r.getNextRun());
    }

    // ------------------------------------------------------------------
    // Per-item isolation
    // ------------------------------------------------------------------

    @Test
    void deliveryException_isCapturedAndBatchContinues() {
        when(store.due(NOW)).thenReturn(List.of(
                reminder(7, ScheduleType.INTERVAL, "1m", null, 0),
                reminder(8, ScheduleType.INTERVAL, "1m", null, 0)));
        when(delivery.deliver("agent-7", "prompt 7")).thenThrow(new IllegalStateException("socket closed"));

        List<ExecutionOutcome> outcomes = service.executeDuePrompts();

        assertThat(outcomes).hasSize(2);
        assertThat(outcomes.get(0).delivered()).isFalse();
        assertThat(outcomes.get(0).error()).isEqualTo("socket closed");
        assertThat(outcomes.get(0).nextRun()).isEqualTo(NOW.minusSeconds(30));
        assertThat(outcomes.get(1).delivered()).isTrue();
        verify(store, never()).update(eq(7L), any());
        verify(store).update(eq(8L), any());
    }

    @Test
    void storeFailureOnUpdate_isCapturedPerItem() {
        when(store.due(NOW)).thenReturn(List.of(
                reminder(9, ScheduleType.INTERVAL, "1m", null, 0),
                reminder(10, ScheduleType.INTERVAL, "1m", null, 0)));
        when(store.update(eq(9L), any())).thenThrow(new StorageException("lock timeout", null));

        List<ExecutionOutcome> outcomes = service.executeDuePrompts();

        assertThat(outcomes.get(0).delivered()).isFalse();
        assertThat(outcomes.get(0).error()).isEqualTo("lock timeout");
        assertThat(outcomes.get(1).delivered()).isTrue();
    }

    @Test
    void corruptedScheduleValue_isReportedAsItemError() {
        when(store.due(NOW)).thenReturn(List.of(reminder(11, ScheduleType.INTERVAL, "every now and then", null, 0)));

        ExecutionOutcome outcome = service.executeDuePrompts().get(0);

        assertThat(outcome.delivered()).isFalse();
        assertThat(outcome.error()).contains("every now and then");
        verify(store, never()).update(anyLong(), any());
    }

    @Test
    void unknownStoredType_isReportedAsItemError() {
        Reminder r = reminder(12, ScheduleType.INTERVAL, "1m", null, 0);
        ReflectionTestUtils.setField(r, "scheduleType", "fortnightly");
        when(store.due(NOW)).thenReturn(List.of(r));

        ExecutionOutcome outcome = service.executeDuePrompts().get(0);

        assertThat(outcome.delivered()).isFalse();
        assertThat(outcome.error()).isEqualTo("Unknown schedule type: fortnightly");
    }

    @Test
    void rowDeletedBeforeWriteBack_isReportedAsNotRecorded() {
        when(store.due(NOW)).thenReturn(List.of(reminder(13, ScheduleType.INTERVAL, "1m", null, 2)));
        when(store.update(eq(13L), any())).thenReturn(false);

        ExecutionOutcome outcome = service.executeDuePrompts().get(0);

        assertThat(outcome.delivered()).isTrue();
        assertThat(outcome.nextRun()).isNull();
        assertThat(outcome.repetitionCount()).isNull();
        assertThat(outcome.error()).isEqualTo("Schedule 13 no longer exists; delivery was not recorded");
    }

    // ------------------------------------------------------------------
    // Overlapping passes
    // ------------------------------------------------------------------

    @Test
    void overlappingPass_isSkippedWhileAnotherIsDelivering() throws Exception {
        when(store.due(NOW)).thenReturn(List.of(reminder(14, ScheduleType.INTERVAL, "1m", 1, 0)));

        CountDownLatch inDelivery = new CountDownLatch(1);
        CountDownLatch release    = new CountDownLatch(1);
        when(delivery.deliver("agent-14", "prompt 14")).thenAnswer(inv -> {
            inDelivery.countDown();
            assertThat(release.await(5, TimeUnit.SECONDS)).isTrue();
            return true;
        });

        CompletableFuture<List<ExecutionOutcome>> first = CompletableFuture.supplyAsync(service::executeDuePrompts);
        assertThat(inDelivery.await(5, TimeUnit.SECONDS)).isTrue();

        List<ExecutionOutcome> second = service.executeDuePrompts();
        release.countDown();
        List<ExecutionOutcome> firstOutcomes = first.get(5, TimeUnit.SECONDS);

        assertThat(second).isEmpty();
        assertThat(firstOutcomes).singleElement().satisfies(o -> {
            assertThat(o.delivered()).isTrue();
            assertThat(o.repetitionCount()).isEqualTo(1);
            assertThat(o.completed()).isTrue();
        });
        verify(delivery, times(1)).deliver(anyString(), anyString());
        ReminderUpdate patch = capturedPatch(14);
        assertThat(patch.repetitionCount()).isEqualTo(1);
        assertThat(patch.active()).isFalse();
    }

    @Test
    void lockIsReleasedAfterEachPass() {
        when(store.due(NOW)).thenReturn(List.of(reminder(15, ScheduleType.INTERVAL, "1m", null, 0)));
        when(delivery.deliver("agent-15", "prompt 15")).thenThrow(new IllegalStateException("boom"));

        assertThat(service.executeDuePrompts()).hasSize(1);
        assertThat(service.executeDuePrompts()).hasSize(1);
        verify(delivery, times(2)).deliver("agent-15", "prompt 15");
    }
}
