package com.openforge.promptyoself.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * promptyoself:
 *   scheduler:
 *     enabled: true            # run the polling pass in-process
 *     poll-interval-ms: 60000  # delay between passes
 *     retention-days: 30       # default age for inactive-row cleanup
 */
@ConfigurationProperties(prefix = "promptyoself.scheduler")
public record SchedulerProperties(
        @DefaultValue("true")  boolean enabled,
        @DefaultValue("60000") long pollIntervalMs,
        @DefaultValue("30")    int retentionDays
) {}
