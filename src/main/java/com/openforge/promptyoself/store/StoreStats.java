package com.openforge.promptyoself.store;

import java.time.LocalDateTime;

/** Table statistics for monitoring. */
public record StoreStats(
        long          totalReminders,
        long          activeReminders,
        long          inactiveReminders,
        LocalDateTime oldestReminder,
        LocalDateTime newestReminder
) {}
