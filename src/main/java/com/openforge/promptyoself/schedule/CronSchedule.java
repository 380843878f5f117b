package com.openforge.promptyoself.schedule;

import org.springframework.scheduling.support.CronExpression;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A classic 5-field cron expression (minute hour day-of-month month day-of-week)
 * evaluated with Spring's {@link CronExpression}.
 *
 * Spring's parser takes 6 fields (seconds first) and ANDs day-of-month with
 * day-of-week.  Classic cron ORs them when both are restricted, e.g.
 * "0 9 1 * MON" fires on the 1st of the month AND on every Monday.  To get
 * that behaviour the expression is split into two alternatives, one per
 * restricted day field, and the earlier match wins.
 */
public final class CronSchedule {

    private static final int FIELD_COUNT = 5;

    private final String expression;
    private final List<CronExpression> alternatives;

    private CronSchedule(String expression, List<CronExpression> alternatives) {
        this.expression   = expression;
        this.alternatives = alternatives;
    }

    /**
     * @throws ScheduleException.InvalidScheduleValue when the text is not a
     *         syntactically valid 5-field expression
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleException.InvalidScheduleValue("Cron expression is empty");
        }
        String[] f = expression.trim().split("\\s+");
        if (f.length != FIELD_COUNT) {
            throw new ScheduleException.InvalidScheduleValue(
                    "Cron expression must have %d fields, got %d: %s"
                            .formatted(FIELD_COUNT, f.length, expression));
        }

        String minute = f[0], hour = f[1], dayOfMonth = f[2], month = f[3], dayOfWeek = f[4];
        try {
            List<CronExpression> parsed;
            if (isRestricted(dayOfMonth) && isRestricted(dayOfWeek)) {
                parsed = List.of(
                        CronExpression.parse(join(minute, hour, dayOfMonth, month, "*")),
                        CronExpression.parse(join(minute, hour, "*", month, dayOfWeek)));
            } else {
                parsed = List.of(CronExpression.parse(join(minute, hour, dayOfMonth, month, dayOfWeek)));
            }
            return new CronSchedule(expression.trim(), parsed);
        } catch (IllegalArgumentException e) {
            throw new ScheduleException.InvalidScheduleValue(
                    "Invalid cron expression: " + expression, e);
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (ScheduleException.InvalidScheduleValue e) {
            return false;
        }
    }

    /**
     * The first matching minute strictly after {@code base}.
     *
     * @throws ScheduleException.InvalidScheduleValue when the expression can
     *         never match (e.g. 30 February)
     */
    public LocalDateTime next(LocalDateTime base) {
        LocalDateTime earliest = null;
        for (CronExpression cron : alternatives) {
            LocalDateTime candidate = cron.next(base);
            if (candidate != null && (earliest == null || candidate.isBefore(earliest))) {
                earliest = candidate;
            }
        }
        if (earliest == null) {
            throw new ScheduleException.InvalidScheduleValue(
                    "Cron expression never fires: " + expression);
        }
        return earliest;
    }

    public String expression() {
        return expression;
    }

    private static boolean isRestricted(String field) {
        return !"*".equals(field) && !"?".equals(field);
    }

    private static String join(String minute, String hour, String dom, String month, String dow) {
        return String.join(" ", "0", minute, hour, dom, month, dow);
    }
}
