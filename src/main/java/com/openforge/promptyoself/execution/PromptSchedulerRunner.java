package com.openforge.promptyoself.execution;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives {@link PromptExecutionService} on a fixed delay.
 * Disable with {@code promptyoself.scheduler.enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "promptyoself.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PromptSchedulerRunner {

    private final PromptExecutionService executionService;

    @Scheduled(initialDelayString = "${promptyoself.scheduler.poll-interval-ms:60000}",
               fixedDelayString   = "${promptyoself.scheduler.poll-interval-ms:60000}")
    public void poll() {
        try {
            executionService.executeDuePrompts();
        } catch (RuntimeException e) {
            // the pass is re-run on the next tick
            log.error("[Scheduler] Execution pass failed: {}", e.getMessage(), e);
        }
    }
}
