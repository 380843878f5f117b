package com.openforge.promptyoself.letta;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.promptyoself.letta.model.AgentSummary;
import com.openforge.promptyoself.letta.model.SendMessageRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Stateless HTTP client for the Letta REST API.
 *
 *   sendMessage() → POST {base}/v1/agents/{agent_id}/messages
 *   listAgents()  → GET  {base}/v1/agents/
 *
 * Every call is a single attempt; any transport error or non-2xx status
 * becomes a {@link LettaException}.  Retry and circuit breaking are layered
 * on top by {@link LettaDeliveryService}.
 */
@Slf4j
@Component
public class LettaClient {

    private static final TypeReference<List<AgentSummary>> AGENT_LIST = new TypeReference<>() {};

    private final HttpClient      httpClient;
    private final ObjectMapper    objectMapper;
    private final LettaProperties properties;

    public LettaClient(HttpClient httpClient, ObjectMapper objectMapper, LettaProperties properties) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.properties   = properties;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public void sendMessage(String agentId, String text) {
        String body = serialize(SendMessageRequest.userText(text));
        HttpRequest request = requestBuilder("/v1/agents/" + encode(agentId) + "/messages")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        log.debug("[Letta] → POST messages agent={} prompt-length={}", agentId, text.length());
        HttpResponse<String> response = send(request);
        checkStatus(response, "send message to agent " + agentId);
    }

    public List<AgentSummary> listAgents() {
        HttpRequest request = requestBuilder("/v1/agents/").GET().build();
        HttpResponse<String> response = send(request);
        checkStatus(response, "list agents");
        try {
            List<AgentSummary> agents = objectMapper.readValue(response.body(), AGENT_LIST);
            log.debug("[Letta] ← {} agent(s)", agents.size());
            return agents;
        } catch (JsonProcessingException e) {
            throw new LettaException("Unparseable agent list from " + properties.baseUrl(), e);
        }
    }

    public String baseUrl() {
        return stripTrailingSlash(properties.baseUrl());
    }

    // ── HTTP helpers ─────────────────────────────────────────────────────────

    private HttpRequest.Builder requestBuilder(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + path))
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + properties.bearerToken())
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()));
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LettaException("Network error calling Letta at " + baseUrl(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LettaException("Interrupted calling Letta at " + baseUrl(), e);
        }
    }

    private void checkStatus(HttpResponse<String> response, String action) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) return;

        String body = response.body();
        if (body != null && body.length() > 512) {
            body = body.substring(0, 512) + "…";
        }
        throw new LettaException("Failed to %s: HTTP %d %s".formatted(action, status, body == null ? "" : body));
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new LettaException("Failed to serialise Letta request", e);
        }
    }

    private static String encode(String pathSegment) {
        return URLEncoder.encode(pathSegment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class LettaException extends RuntimeException {
        public LettaException(String message) { super(message); }
        public LettaException(String message, Throwable cause) { super(message, cause); }
    }
}
