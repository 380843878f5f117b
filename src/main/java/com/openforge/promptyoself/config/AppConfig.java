package com.openforge.promptyoself.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Core infrastructure beans:
 *  - UTC Clock                → every "now" in the service; tests swap in a fixed clock
 *  - Java HttpClient          → the only HTTP engine, used by LettaClient
 *  - Jackson ObjectMapper     → snake_case on the wire (agent_id, next_run …), ISO-8601 dates
 */
@Configuration
public class AppConfig {

    /** Stored timestamps are UTC-naive, so "now" is always read in UTC. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Small bounded pool for the HttpClient's async plumbing.  Calls are made
     * with send(), so the pool only services connection housekeeping.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService lettaHttpExecutor() {
        return Executors.newFixedThreadPool(4);
    }

    /**
     * Single, shared HttpClient instance.
     * 10 s connect timeout; per-request timeouts come from LettaProperties.
     */
    @Bean
    public HttpClient httpClient(ExecutorService lettaHttpExecutor) {
        return HttpClient.newBuilder()
                .executor(lettaHttpExecutor)
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper, also picked up by Spring MVC:
     *  - snake_case property names
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (Letta adds agent fields freely)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
