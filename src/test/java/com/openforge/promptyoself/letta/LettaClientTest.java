package com.openforge.promptyoself.letta;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.promptyoself.config.AppConfig;
import com.openforge.promptyoself.letta.model.AgentSummary;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Exercises the client against a local HTTP server standing in for Letta. */
class LettaClientTest {

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();

    private HttpServer server;
    private String baseUrl;

    private final AtomicReference<String> lastMethod = new AtomicReference<>();
    private final AtomicReference<String> lastPath   = new AtomicReference<>();
    private final AtomicReference<String> lastAuth   = new AtomicReference<>();
    private final AtomicReference<String> lastBody   = new AtomicReference<>();

    private volatile int    status       = 200;
    private volatile String responseBody = "{}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastMethod.set(exchange.getRequestMethod());
        lastPath.set(exchange.getRequestURI().getRawPath());
        lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
        lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));

        byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private LettaClient client(String apiKey, String password) {
        return new LettaClient(HttpClient.newHttpClient(), objectMapper,
                new LettaProperties(baseUrl + "/", apiKey, password, 5, 3));
    }

    @Test
    void sendMessage_postsSingleUserTextMessage() throws IOException {
        client("key-123", null).sendMessage("agent-42", "time to reflect");

        assertThat(lastMethod.get()).isEqualTo("POST");
        assertThat(lastPath.get()).isEqualTo("/v1/agents/agent-42/messages");
        assertThat(lastAuth.get()).isEqualTo("Bearer key-123");

        JsonNode message = objectMapper.readTree(lastBody.get()).path("messages").get(0);
        assertThat(message.path("role").asText()).isEqualTo("user");
        assertThat(message.path("content").get(0).path("type").asText()).isEqualTo("text");
        assertThat(message.path("content").get(0).path("text").asText()).isEqualTo("time to reflect");
    }

    @Test
    void serverPasswordIsUsedWhenNoApiKey() {
        client(" ", "s3cret").sendMessage("a", "x");
        assertThat(lastAuth.get()).isEqualTo("Bearer s3cret");
    }

    @Test
    void placeholderTokenForUnsecuredServers() {
        client(null, null).sendMessage("a", "x");
        assertThat(lastAuth.get()).isEqualTo("Bearer " + LettaProperties.UNSECURED_TOKEN);
    }

    @Test
    void non2xxIsALettaException() {
        status = 404;
        responseBody = "{\"detail\":\"Agent not found\"}";

        assertThatThrownBy(() -> client("k", null).sendMessage("missing", "x"))
                .isInstanceOf(LettaClient.LettaException.class)
                .hasMessageContaining("HTTP 404")
                .hasMessageContaining("Agent not found");
    }

    @Test
    void listAgents_readsSnakeCaseFieldsAndIgnoresTheRest() {
        responseBody = """
                [
                  {"id": "agent-1", "name": "Helper", "created_at": "2025-01-01T00:00:00Z",
                   "last_updated": "2025-01-02T00:00:00Z", "llm_config": {"model": "x"}},
                  {"id": "agent-2"}
                ]
                """;

        List<AgentSummary> agents = client("k", null).listAgents();

        assertThat(lastMethod.get()).isEqualTo("GET");
        assertThat(lastPath.get()).isEqualTo("/v1/agents/");
        assertThat(agents).extracting(AgentSummary::id).containsExactly("agent-1", "agent-2");
        assertThat(agents.get(0).createdAt()).isEqualTo("2025-01-01T00:00:00Z");
        assertThat(agents.get(1).displayName()).isEqualTo("Unknown");
    }

    @Test
    void listAgents_malformedBody() {
        responseBody = "<html>oops</html>";
        assertThatThrownBy(() -> client("k", null).listAgents())
                .isInstanceOf(LettaClient.LettaException.class);
    }

    @Test
    void unreachableServerIsALettaException() {
        LettaClient unreachable = new LettaClient(HttpClient.newHttpClient(), objectMapper,
                new LettaProperties("http://127.0.0.1:1", null, null, 2, 1));

        assertThatThrownBy(unreachable::listAgents)
                .isInstanceOf(LettaClient.LettaException.class)
                .hasMessageContaining("Network error");
    }
}
