package com.openforge.promptyoself.config;

import com.openforge.promptyoself.letta.LettaProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the product + version
 *   - Letta: endpoint and auth method (the credential is masked)
 *   - Scheduler: whether the in-process poller runs, and how often
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource          dataSource;
    private final LettaProperties     lettaProperties;
    private final SchedulerProperties schedulerProperties;
    private final Environment         env;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            PromptYourself  -  Startup Summary            ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Letta                                                   ║
                ║    Base URL       : {}
                ║    Auth           : {}  key={}
                ║    Timeout / Try  : {}s / {} attempts
                ╠══════════════════════════════════════════════════════════╣
                ║  Scheduler                                               ║
                ║    Enabled        : {}
                ║    Poll Interval  : {} ms
                ║    Retention      : {} days
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                probeDatabase(),

                lettaProperties.baseUrl(),
                lettaProperties.authMethod(),
                maskKey(lettaProperties.apiKey() != null && !lettaProperties.apiKey().isBlank()
                        ? lettaProperties.apiKey() : lettaProperties.serverPassword()),
                lettaProperties.timeoutSeconds(),
                lettaProperties.maxRetries(),

                schedulerProperties.enabled() ? "✔ enabled" : "✘ disabled",
                schedulerProperties.pollIntervalMs(),
                schedulerProperties.retentionDays()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            var meta = conn.getMetaData();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = meta.getURL().replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  " + meta.getDatabaseProductName() + " "
                    + meta.getDatabaseProductVersion() + "  url=" + safeUrl;
        } catch (SQLException e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /** First 6 chars + "..." + last 4; "(not set)" when absent. */
    private static String maskKey(String key) {
        if (key == null || key.isBlank()) return "(not set)";
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
