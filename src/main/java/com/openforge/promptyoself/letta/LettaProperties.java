package com.openforge.promptyoself.letta;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Letta server connection settings, under the "promptyoself.letta" prefix:
 *
 * promptyoself:
 *   letta:
 *     base-url: http://localhost:8283
 *     api-key: ${LETTA_API_KEY:}
 *     server-password: ${LETTA_SERVER_PASSWORD:}
 *     timeout-seconds: 30
 *     max-retries: 3
 *
 * Authentication: the api key if set, else the server password, else a
 * placeholder token that unsecured servers accept.
 */
@ConfigurationProperties(prefix = "promptyoself.letta")
public record LettaProperties(
        @DefaultValue("http://localhost:8283") String baseUrl,
        String apiKey,
        String serverPassword,
        @DefaultValue("30") int timeoutSeconds,
        @DefaultValue("3") int maxRetries
) {

    static final String UNSECURED_TOKEN = "dummy-token-for-unsecured-server";

    public String bearerToken() {
        if (hasText(apiKey))         return apiKey;
        if (hasText(serverPassword)) return serverPassword;
        return UNSECURED_TOKEN;
    }

    /** Which credential {@link #bearerToken()} picked; for logs. */
    public String authMethod() {
        if (hasText(apiKey))         return "api_key";
        if (hasText(serverPassword)) return "server_password";
        return "none";
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
