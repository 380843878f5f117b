package com.openforge.promptyoself.store;

import com.openforge.promptyoself.domain.Reminder;
import com.openforge.promptyoself.domain.ScheduleType;
import com.openforge.promptyoself.repository.ReminderRepository;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable table of reminders: CRUD plus the due-item query.
 *
 * Every public operation is one transaction, so a concurrent due query
 * never observes a half-written row and a failed write leaves no partial
 * patch behind.  {@link #update} locks the row for the duration of the
 * patch; nothing here is ever called while a delivery is in flight.
 *
 * Any persistence fault is rethrown as {@link StorageException}.
 */
@Slf4j
@Service
public class ReminderStore {

    private final ReminderRepository  repository;
    private final TransactionTemplate tx;
    private final Clock               clock;

    public ReminderStore(ReminderRepository repository,
                         PlatformTransactionManager transactionManager,
                         Clock clock) {
        this.repository = repository;
        this.tx         = new TransactionTemplate(transactionManager);
        this.clock      = clock;
    }

    // ── Create ───────────────────────────────────────────────────────────────

    /**
     * Inserts an active reminder with repetition_count = 0.
     *
     * @return the assigned id
     */
    public long create(String agentId,
                       String message,
                       ScheduleType scheduleType,
                       String scheduleValue,
                       LocalDateTime nextRun,
                       Integer maxRepetitions) {
        Reminder saved = inTransaction("create", () -> repository.saveAndFlush(Reminder.builder()
                .agentId(agentId)
                .message(message)
                .scheduleType(scheduleType)
                .scheduleValue(scheduleValue)
                .nextRun(nextRun)
                .maxRepetitions(maxRepetitions)
                .active(true)
                .repetitionCount(0)
                .build()));
        log.info("[Store] Created reminder {} for agent {} ({} '{}') next_run={}",
                saved.getId(), agentId, scheduleType.wireName(), scheduleValue, nextRun);
        return saved.getId();
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    /**
     * @param agentId    null for every agent
     * @param activeOnly exclude cancelled / completed rows
     * @param limit      null or non-positive for no limit
     */
    public List<Reminder> list(String agentId, boolean activeOnly, Integer limit) {
        Pageable page = limit != null && limit > 0 ? PageRequest.of(0, limit) : Pageable.unpaged();
        List<Reminder> result = inTransaction("list",
                () -> repository.search(agentId, activeOnly, page));
        log.debug("[Store] Listed {} reminders agent={} activeOnly={}", result.size(), agentId, activeOnly);
        return result;
    }

    public Optional<Reminder> get(long id) {
        return inTransaction("get", () -> repository.findById(id));
    }

    /** Every active row whose next_run is at or before {@code now}. */
    public List<Reminder> due(LocalDateTime now) {
        List<Reminder> result = inTransaction("due", () -> repository.findDue(now));
        if (!result.isEmpty()) {
            log.debug("[Store] {} reminders due at {}", result.size(), now);
        }
        return result;
    }

    // ── Write ────────────────────────────────────────────────────────────────

    /**
     * Applies a field-level patch under a row lock.
     *
     * @return false if no reminder has that id
     */
    public boolean update(long id, ReminderUpdate patch) {
        return inTransaction("update", () -> {
            Optional<Reminder> found = repository.findByIdForUpdate(id);
            if (found.isEmpty()) return false;

            Reminder r = found.get();
            if (patch.lastRun() != null)         r.setLastRun(patch.lastRun());
            if (patch.clearNextRun())            r.setNextRun(null);
            else if (patch.nextRun() != null)    r.setNextRun(patch.nextRun());
            if (patch.active() != null)          r.setActive(patch.active());
            if (patch.repetitionCount() != null) r.setRepetitionCount(patch.repetitionCount());
            repository.saveAndFlush(r);
            return true;
        });
    }

    /** Sets active = false.  The row is kept. */
    public boolean cancel(long id) {
        boolean found = update(id, ReminderUpdate.cancel());
        if (found) {
            log.info("[Store] Cancelled reminder {}", id);
        }
        return found;
    }

    // ── Maintenance ──────────────────────────────────────────────────────────

    /**
     * Deletes inactive reminders created more than {@code olderThanDays} ago.
     *
     * @return number of rows deleted
     */
    public int cleanupInactive(int olderThanDays) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(olderThanDays);
        int deleted = inTransaction("cleanup", () -> repository.deleteInactiveCreatedBefore(cutoff));
        log.info("[Store] Retention cleanup removed {} inactive reminders created before {}", deleted, cutoff);
        return deleted;
    }

    public StoreStats stats() {
        return inTransaction("stats", () -> {
            long total  = repository.count();
            long active = repository.countByActiveTrue();
            return new StoreStats(
                    total,
                    active,
                    total - active,
                    repository.findFirstByOrderByCreatedAtAsc().map(Reminder::getCreatedAt).orElse(null),
                    repository.findFirstByOrderByCreatedAtDesc().map(Reminder::getCreatedAt).orElse(null));
        });
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return tx.execute(status -> work.get());
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            log.error("[Store] {} failed: {}", operation, e.getMessage(), e);
            throw new StorageException("Reminder store %s failed: %s".formatted(operation, e.getMessage()), e);
        }
    }
}
