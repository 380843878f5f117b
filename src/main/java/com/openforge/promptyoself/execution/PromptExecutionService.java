package com.openforge.promptyoself.execution;

import com.openforge.promptyoself.delivery.PromptDelivery;
import com.openforge.promptyoself.domain.Reminder;
import com.openforge.promptyoself.schedule.RecurrenceCalculator;
import com.openforge.promptyoself.store.ReminderStore;
import com.openforge.promptyoself.store.ReminderUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One polling pass over the due reminders.
 *
 * Per reminder:
 *   deliver → last_run := now
 *     failed    → nothing else changes; the row stays due and the next pass retries it
 *     delivered → repetition_count + 1, then either
 *                   cap reached / no next occurrence → active := false, next_run := null
 *                   otherwise                        → next_run := next occurrence after now
 *
 * Items are independent: a fault on one is recorded in its outcome and the
 * pass moves on.  Delivery happens outside any store transaction, so no
 * row lock is held across the network call.
 *
 * Passes never overlap.  The scheduler and an on-demand execute share this
 * service; a pass that finds another one in progress returns no outcomes
 * instead of re-delivering the same due rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromptExecutionService {

    private final ReminderStore        store;
    private final RecurrenceCalculator calculator;
    private final PromptDelivery       delivery;
    private final Clock                clock;

    private final ReentrantLock passLock = new ReentrantLock();

    public List<ExecutionOutcome> executeDuePrompts() {
        if (!passLock.tryLock()) {
            log.info("[Executor] Another execution pass is in progress; skipping");
            return List.of();
        }
        try {
            return runPass();
        } finally {
            passLock.unlock();
        }
    }

    private List<ExecutionOutcome> runPass() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Reminder> due = store.due(now);
        if (due.isEmpty()) {
            log.debug("[Executor] No due reminders at {}", now);
            return List.of();
        }

        log.info("[Executor] {} reminder(s) due at {}", due.size(), now);
        List<ExecutionOutcome> outcomes = new ArrayList<>(due.size());
        for (Reminder reminder : due) {
            outcomes.add(executeOne(reminder, now));
        }

        long delivered = outcomes.stream().filter(ExecutionOutcome::delivered).count();
        log.info("[Executor] Pass finished: {}/{} delivered", delivered, outcomes.size());
        return outcomes;
    }

    private ExecutionOutcome executeOne(Reminder r, LocalDateTime now) {
        try {
            boolean delivered = delivery.deliver(r.getAgentId(), r.getMessage());

            if (!delivered) {
                if (!store.update(r.getId(), ReminderUpdate.builder().lastRun(now).build())) {
                    log.warn("[Executor] Reminder {} disappeared before its failed attempt was recorded", r.getId());
                }
                log.warn("[Executor] Delivery of reminder {} to agent {} failed; retrying next pass",
                        r.getId(), r.getAgentId());
                return ExecutionOutcome.notDelivered(r.getId(), r.getAgentId(), r.getNextRun());
            }

            int count = r.repetitions() + 1;
            ReminderUpdate.ReminderUpdateBuilder patch = ReminderUpdate.builder()
                    .lastRun(now)
                    .repetitionCount(count);

            boolean capReached = r.getMaxRepetitions() != null && count >= r.getMaxRepetitions();
            Optional<LocalDateTime> next = capReached
                    ? Optional.empty()
                    : calculator.nextOccurrence(r.getScheduleType(), r.getScheduleValue(), now);

            if (next.isPresent()) {
                patch.nextRun(next.get());
            } else {
                patch.active(false).clearNextRun(true);
            }
            if (!store.update(r.getId(), patch.build())) {
                log.warn("[Executor] Reminder {} was delivered but disappeared before the run was recorded",
                        r.getId());
                return ExecutionOutcome.deliveredNotRecorded(r.getId(), r.getAgentId());
            }

            if (next.isPresent()) {
                log.info("[Executor] Delivered reminder {} to agent {} (#{}); next run {}",
                        r.getId(), r.getAgentId(), count, next.get());
            } else {
                log.info("[Executor] Delivered reminder {} to agent {} (#{}); completed",
                        r.getId(), r.getAgentId(), count);
            }
            return ExecutionOutcome.delivered(r.getId(), r.getAgentId(), next.orElse(null),
                    count, r.getMaxRepetitions(), capReached);

        } catch (RuntimeException e) {
            log.error("[Executor] Reminder {} failed: {}", r.getId(), e.getMessage(), e);
            return ExecutionOutcome.failed(r.getId(), r.getAgentId(), r.getNextRun(), e.getMessage());
        }
    }
}
