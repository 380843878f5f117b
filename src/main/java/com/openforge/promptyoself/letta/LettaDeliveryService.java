package com.openforge.promptyoself.letta;

import com.openforge.promptyoself.delivery.AgentDirectory;
import com.openforge.promptyoself.delivery.PromptDelivery;
import com.openforge.promptyoself.letta.model.AgentSummary;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Letta-backed delivery and agent lookup.
 *
 * Call graph for deliver():
 *
 *   lettaCircuitBreaker
 *     └─ lettaRetry (exponential back-off)
 *           └─ LettaClient.sendMessage()
 *
 * deliver() never throws: once retries are exhausted (or the breaker is
 * open) it returns false and the execution pass leaves the reminder due.
 */
@Slf4j
@Service
public class LettaDeliveryService implements PromptDelivery, AgentDirectory {

    private final LettaClient    client;
    private final CircuitBreaker circuitBreaker;
    private final Retry          retry;

    public LettaDeliveryService(LettaClient client,
                                CircuitBreaker lettaCircuitBreaker,
                                Retry lettaRetry) {
        this.client         = client;
        this.circuitBreaker = lettaCircuitBreaker;
        this.retry          = lettaRetry;
    }

    @Override
    public boolean deliver(String agentId, String text) {
        Runnable send = CircuitBreaker.decorateRunnable(circuitBreaker,
                Retry.decorateRunnable(retry, () -> client.sendMessage(agentId, text)));
        try {
            send.run();
            log.info("[Letta] Delivered prompt to agent {} ({} chars)", agentId, text.length());
            return true;
        } catch (Exception e) {
            log.error("[Letta] Delivery to agent {} failed after retries: {}", agentId, e.getMessage());
            return false;
        }
    }

    @Override
    public AgentValidation validate(String agentId) {
        try {
            return client.listAgents().stream()
                    .filter(agent -> agentId.equals(agent.id()))
                    .findFirst()
                    .map(agent -> AgentValidation.found(agent.displayName()))
                    .orElseGet(() -> AgentValidation.missing("Agent %s not found".formatted(agentId)));
        } catch (Exception e) {
            log.warn("[Letta] Could not validate agent {}: {}", agentId, e.getMessage());
            return AgentValidation.missing("Failed to validate agent %s: %s".formatted(agentId, e.getMessage()));
        }
    }

    /** Lists every agent on the server.  Failures propagate as {@link LettaClient.LettaException}. */
    public List<AgentSummary> listAgents() {
        return client.listAgents();
    }

    public ConnectionStatus testConnection() {
        try {
            int count = client.listAgents().size();
            return new ConnectionStatus(true, "Connection to Letta server successful", count);
        } catch (Exception e) {
            log.warn("[Letta] Connection test against {} failed: {}", client.baseUrl(), e.getMessage());
            return new ConnectionStatus(false, "Failed to connect to Letta server: " + e.getMessage(), null);
        }
    }

    /** @param agentCount number of agents seen; null when the server was unreachable */
    public record ConnectionStatus(boolean connected, String message, Integer agentCount) {}
}
