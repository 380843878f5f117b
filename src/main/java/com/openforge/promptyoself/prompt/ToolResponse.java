package com.openforge.promptyoself.prompt;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.promptyoself.execution.ExecutionOutcome;
import com.openforge.promptyoself.letta.model.AgentSummary;
import com.openforge.promptyoself.prompt.dto.ReminderView;
import com.openforge.promptyoself.store.StoreStats;

import java.time.LocalDateTime;
import java.util.List;

/**
 * The uniform envelope every public prompt operation returns.
 *
 * Fields:
 *   status      - "success" or "error"
 *   message     - human-readable summary
 *   error       - failure text; only on errors
 *   code        - machine-readable failure kind (a registration reason,
 *                 NOT_FOUND, INVALID_ARGUMENT, UPSTREAM_ERROR, INTERNAL_ERROR)
 *   the rest    - operation-specific payload; null fields are omitted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResponse(
        String                 status,
        String                 message,
        String                 error,
        String                 code,
        Long                   id,
        LocalDateTime          nextRun,
        Long                   cancelledId,
        List<ReminderView>     schedules,
        List<ExecutionOutcome> executed,
        List<AgentSummary>     agents,
        Integer                count,
        Integer                agentCount,
        Integer                deleted,
        StoreStats             stats
) {

    public static final String SUCCESS = "success";
    public static final String ERROR   = "error";

    public static final String NOT_FOUND        = "NOT_FOUND";
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
    public static final String UPSTREAM_ERROR   = "UPSTREAM_ERROR";
    public static final String INTERNAL_ERROR   = "INTERNAL_ERROR";

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    // ── Static factory helpers ───────────────────────────────────────────────

    public static ToolResponse registered(long id, LocalDateTime nextRun) {
        return new ToolResponse(SUCCESS, "Prompt scheduled with ID " + id, null, null, id, nextRun, null,
                null, null, null, null, null, null, null);
    }

    public static ToolResponse listed(List<ReminderView> schedules) {
        return new ToolResponse(SUCCESS, null, null, null, null, null, null,
                schedules, null, null, schedules.size(), null, null, null);
    }

    public static ToolResponse cancelled(long id) {
        return new ToolResponse(SUCCESS, "Schedule %d cancelled".formatted(id), null, null,
                null, null, id, null, null, null, null, null, null, null);
    }

    public static ToolResponse executed(List<ExecutionOutcome> outcomes) {
        return new ToolResponse(SUCCESS, "%d prompts executed".formatted(outcomes.size()), null, null,
                null, null, null, null, outcomes, null, outcomes.size(), null, null, null);
    }

    public static ToolResponse agents(List<AgentSummary> agents) {
        return new ToolResponse(SUCCESS, null, null, null, null, null, null,
                null, null, agents, agents.size(), null, null, null);
    }

    public static ToolResponse connected(String message, Integer agentCount) {
        return new ToolResponse(SUCCESS, message, null, null, null, null, null,
                null, null, null, null, agentCount, null, null);
    }

    public static ToolResponse statistics(StoreStats stats) {
        return new ToolResponse(SUCCESS, null, null, null, null, null, null,
                null, null, null, null, null, null, stats);
    }

    public static ToolResponse cleanedUp(int deleted, int days) {
        return new ToolResponse(SUCCESS,
                "Deleted %d inactive schedules older than %d days".formatted(deleted, days), null, null,
                null, null, null, null, null, null, null, null, deleted, null);
    }

    public static ToolResponse error(String code, String error) {
        return new ToolResponse(ERROR, null, error, code, null, null, null,
                null, null, null, null, null, null, null);
    }
}
