package com.openforge.promptyoself.execution;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Result of processing one due reminder in an execution pass.
 *
 * nextRun is null once the reminder has completed (or is a fired one-shot);
 * on a failed delivery it carries the unchanged, still-due time.
 * error is set only for a failed delivery, a fault while processing the item,
 * or a delivery whose row disappeared before it could be recorded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionOutcome(
        long          id,
        String        agentId,
        boolean       delivered,
        LocalDateTime nextRun,
        Integer       repetitionCount,
        Integer       maxRepetitions,
        Boolean       completed,
        String        error
) {

    static final String DELIVERY_FAILED = "Failed to deliver prompt";

    public static ExecutionOutcome delivered(long id, String agentId, LocalDateTime nextRun,
                                             int repetitionCount, Integer maxRepetitions,
                                             boolean completed) {
        return new ExecutionOutcome(id, agentId, true, nextRun, repetitionCount, maxRepetitions, completed, null);
    }

    /** Delivered, but the row was gone by write-back time, so nothing was persisted. */
    public static ExecutionOutcome deliveredNotRecorded(long id, String agentId) {
        return new ExecutionOutcome(id, agentId, true, null, null, null, null,
                "Schedule %d no longer exists; delivery was not recorded".formatted(id));
    }

    public static ExecutionOutcome notDelivered(long id, String agentId, LocalDateTime nextRun) {
        return failed(id, agentId, nextRun, DELIVERY_FAILED);
    }

    public static ExecutionOutcome failed(long id, String agentId, LocalDateTime nextRun, String error) {
        return new ExecutionOutcome(id, agentId, false, nextRun, null, null, null, error);
    }
}
