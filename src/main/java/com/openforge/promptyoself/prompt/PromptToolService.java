package com.openforge.promptyoself.prompt;

import com.openforge.promptyoself.config.SchedulerProperties;
import com.openforge.promptyoself.execution.ExecutionOutcome;
import com.openforge.promptyoself.execution.PromptExecutionService;
import com.openforge.promptyoself.letta.LettaDeliveryService;
import com.openforge.promptyoself.prompt.dto.ReminderView;
import com.openforge.promptyoself.registration.RegisterCommand;
import com.openforge.promptyoself.registration.RegistrationException;
import com.openforge.promptyoself.registration.RegistrationResult;
import com.openforge.promptyoself.registration.RegistrationService;
import com.openforge.promptyoself.store.ReminderStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Public boundary of the prompt scheduler.
 *
 * Every operation answers with a {@link ToolResponse}; nothing thrown by the
 * layers below escapes.  Transports (the REST controller today) only have to
 * map the envelope onto their own status codes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromptToolService {

    private final RegistrationService    registrationService;
    private final ReminderStore          store;
    private final PromptExecutionService executionService;
    private final LettaDeliveryService   letta;
    private final SchedulerProperties    schedulerProperties;

    public ToolResponse register(RegisterCommand command) {
        try {
            RegistrationResult result = registrationService.register(command);
            return ToolResponse.registered(result.id(), result.nextRun());
        } catch (RegistrationException e) {
            log.warn("[Prompts] Registration rejected ({}): {}", e.getReason(), e.getMessage());
            return ToolResponse.error(e.getReason().name(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Prompts] Registration failed: {}", e.getMessage(), e);
            return ToolResponse.error(ToolResponse.INTERNAL_ERROR, "Failed to register prompt: " + e.getMessage());
        }
    }

    public ToolResponse list(String agentId, boolean showAll, Integer limit) {
        if (limit != null && limit <= 0) {
            return ToolResponse.error(ToolResponse.INVALID_ARGUMENT, "limit must be a positive integer");
        }
        try {
            List<ReminderView> schedules = store.list(blankToNull(agentId), !showAll, limit).stream()
                    .map(ReminderView::from)
                    .toList();
            return ToolResponse.listed(schedules);
        } catch (RuntimeException e) {
            log.error("[Prompts] Listing failed: {}", e.getMessage(), e);
            return ToolResponse.error(ToolResponse.INTERNAL_ERROR, "Failed to list prompts: " + e.getMessage());
        }
    }

    public ToolResponse cancel(long id) {
        try {
            if (store.cancel(id)) {
                return ToolResponse.cancelled(id);
            }
            return ToolResponse.error(ToolResponse.NOT_FOUND,
                    "Schedule %d not found".formatted(id));
        } catch (RuntimeException e) {
            log.error("[Prompts] Cancel of {} failed: {}", id, e.getMessage(), e);
            return ToolResponse.error(ToolResponse.INTERNAL_ERROR, "Failed to cancel prompt: " + e.getMessage());
        }
    }

    public ToolResponse execute() {
        try {
            List<ExecutionOutcome> outcomes = executionService.executeDuePrompts();
            return ToolResponse.executed(outcomes);
        } catch (RuntimeException e) {
            log.error("[Prompts] Execution pass failed: {}", e.getMessage(), e);
            return ToolResponse.error(ToolResponse.INTERNAL_ERROR, "Failed to execute prompts: " + e.getMessage());
        }
    }

    public ToolResponse listAgents() {
        try {
            return ToolResponse.agents(letta.listAgents());
        } catch (RuntimeException e) {
            log.warn("[Prompts] Agent listing failed: {}", e.getMessage());
            return ToolResponse.error(ToolResponse.UPSTREAM_ERROR, "Failed to list agents: " + e.getMessage());
        }
    }

    public ToolResponse testConnection() {
        LettaDeliveryService.ConnectionStatus status = letta.testConnection();
        return status.connected()
                ? ToolResponse.connected(status.message(), status.agentCount())
                : ToolResponse.error(ToolResponse.UPSTREAM_ERROR, status.message());
    }

    public ToolResponse stats() {
        try {
            return ToolResponse.statistics(store.stats());
        } catch (RuntimeException e) {
            log.error("[Prompts] Stats query failed: {}", e.getMessage(), e);
            return ToolResponse.error(ToolResponse.INTERNAL_ERROR, "Failed to read statistics: " + e.getMessage());
        }
    }

    /** @param days retention in days; null falls back to promptyoself.scheduler.retention-days */
    public ToolResponse cleanup(Integer days) {
        int retention = days != null ? days : schedulerProperties.retentionDays();
        if (retention <= 0) {
            return ToolResponse.error(ToolResponse.INVALID_ARGUMENT, "days must be a positive integer");
        }
        try {
            return ToolResponse.cleanedUp(store.cleanupInactive(retention), retention);
        } catch (RuntimeException e) {
            log.error("[Prompts] Cleanup failed: {}", e.getMessage(), e);
            return ToolResponse.error(ToolResponse.INTERNAL_ERROR, "Failed to clean up schedules: " + e.getMessage());
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
