package com.openforge.promptyoself.schedule;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the user-supplied time strings accepted by registration
 * ("time" for one-shot reminders, "start_at" for intervals).
 *
 * Order of attempts:
 *   1. normalize - trim; keep a trailing 'Z'; rewrite
 *      "2025-12-25 10:00:00 UTC" to "2025-12-25T10:00:00Z"
 *   2. strict ISO-8601, with or without offset
 *   3. a lenient list of common human formats
 *
 * The result remembers whether an offset was present, so the "is it in the
 * future" check can use a clock of the same awareness.
 */
public final class ScheduleTimeParser {

    private static final List<DateTimeFormatter> LENIENT_DATE_TIMES = List.of(
            isoLike('T'),
            isoLike(' '),
            formatter("yyyy/MM/dd HH:mm[:ss]"),
            formatter("dd.MM.yyyy HH:mm[:ss]"),
            formatter("[MMMM][MMM] d, yyyy h:mm[:ss] a"),
            formatter("[MMMM][MMM] d, yyyy HH:mm[:ss]"),
            formatter("[MMMM][MMM] d yyyy HH:mm[:ss]"),
            formatter("d [MMMM][MMM] yyyy HH:mm[:ss]"),
            formatter("EEE, d MMM yyyy HH:mm:ss XXX")
    );

    private static final List<DateTimeFormatter> LENIENT_DATES = List.of(
            formatter("yyyy-MM-dd"),
            formatter("yyyy/MM/dd"),
            formatter("dd.MM.yyyy"),
            formatter("[MMMM][MMM] d, yyyy"),
            formatter("d [MMMM][MMM] yyyy")
    );

    private ScheduleTimeParser() {}

    /** A parsed time; {@code offset} is null for a naive value. */
    public record ParsedTime(LocalDateTime local, ZoneOffset offset) {

        public boolean isAware() {
            return offset != null;
        }

        /** Strictly after "now" measured on a clock of the same awareness. */
        public boolean isAfter(Clock clock) {
            if (isAware()) {
                return OffsetDateTime.of(local, offset).isAfter(OffsetDateTime.now(clock));
            }
            return local.isAfter(LocalDateTime.now(clock));
        }

        /** The storage form: UTC, timezone-naive. Naive input is taken as UTC. */
        public LocalDateTime toUtc() {
            if (!isAware()) return local;
            return OffsetDateTime.of(local, offset)
                    .withOffsetSameInstant(ZoneOffset.UTC)
                    .toLocalDateTime();
        }
    }

    public static Optional<ParsedTime> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();

        String normalized = normalize(raw);
        Optional<ParsedTime> strict = parseIso(normalized);
        if (strict.isPresent()) return strict;

        return parseLenient(raw.trim());
    }

    /**
     * "2025-12-25T10:00:00Z" is returned as is; "2025-12-25 10:00:00 UTC"
     * becomes "2025-12-25T10:00:00Z"; anything else is only trimmed.
     */
    static String normalize(String value) {
        String v = value.trim();
        if (v.endsWith("Z")) return v;
        if (v.toUpperCase(Locale.ROOT).endsWith(" UTC")) {
            String core = v.substring(0, v.length() - 4).trim();
            if (!core.contains("T") && core.contains(" ")) {
                int sep = core.indexOf(' ');
                core = core.substring(0, sep) + "T" + core.substring(sep + 1).trim();
            }
            return core + "Z";
        }
        return v;
    }

    private static Optional<ParsedTime> parseIso(String value) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) {
                return Optional.of(new ParsedTime(odt.toLocalDateTime(), odt.getOffset()));
            }
            return Optional.of(new ParsedTime((LocalDateTime) parsed, null));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<ParsedTime> parseLenient(String value) {
        for (DateTimeFormatter f : LENIENT_DATE_TIMES) {
            try {
                TemporalAccessor parsed = f.parseBest(value, OffsetDateTime::from, LocalDateTime::from);
                if (parsed instanceof OffsetDateTime odt) {
                    return Optional.of(new ParsedTime(odt.toLocalDateTime(), odt.getOffset()));
                }
                return Optional.of(new ParsedTime((LocalDateTime) parsed, null));
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        for (DateTimeFormatter f : LENIENT_DATES) {
            try {
                return Optional.of(new ParsedTime(LocalDate.parse(value, f).atStartOfDay(), null));
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        return Optional.empty();
    }

    /**
     * yyyy-MM-dd{sep}HH:mm[:ss[.fraction]] with an optional offset in any of
     * the forms "+05:00", "+0500", "+05" or "Z", optionally after a space.
     * Covers "+0000" offsets and the 6-digit microseconds of "2025-12-25 10:00:00.123456".
     */
    private static DateTimeFormatter isoLike(char separator) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern("yyyy-MM-dd")
                .appendLiteral(separator)
                .appendPattern("HH:mm")
                .optionalStart()
                    .appendPattern(":ss")
                    .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                .optionalEnd()
                .optionalStart().appendLiteral(' ').optionalEnd()
                .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
                .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
                .optionalStart().appendOffset("+HH", "Z").optionalEnd()
                .toFormatter(Locale.ENGLISH);
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
