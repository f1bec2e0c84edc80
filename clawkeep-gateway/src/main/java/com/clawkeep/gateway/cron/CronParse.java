package com.clawkeep.gateway.cron;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Cron date/time parsing utilities.
 */
public final class CronParse {

    private CronParse() {
    }

    private static final Pattern ISO_TZ_RE = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATE_TIME_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T");
    private static final Pattern OFFSET_NO_COLON_RE = Pattern.compile("([+-]\\d{2})(\\d{2})$");
    private static final Pattern NUMERIC_RE = Pattern.compile("^\\d+$");

    /**
     * Normalize a date string to a parseable ISO-8601 instant.
     * A date only (2024-01-01) becomes midnight UTC, a date-time without
     * zone gets Z appended, and +hhmm offsets gain a colon.
     */
    static String normalizeUtcIso(String raw) {
        if (ISO_TZ_RE.matcher(raw).find())
            return OFFSET_NO_COLON_RE.matcher(raw).replaceFirst("$1:$2");
        if (ISO_DATE_RE.matcher(raw).matches())
            return raw + "T00:00:00Z";
        if (ISO_DATE_TIME_RE.matcher(raw).find())
            return raw + "Z";
        return raw;
    }

    /**
     * Parse an absolute time input and return epoch milliseconds.
     * Accepts:
     * <ul>
     * <li>Numeric strings (interpreted as epoch ms)</li>
     * <li>ISO-8601 date/datetime strings, with or without offset</li>
     * </ul>
     *
     * @return epoch milliseconds, or null if parsing fails
     */
    public static Long parseAbsoluteTimeMs(String input) {
        if (input == null)
            return null;
        String raw = input.trim();
        if (raw.isEmpty())
            return null;

        if (NUMERIC_RE.matcher(raw).matches()) {
            try {
                long n = Long.parseLong(raw);
                return n > 0 ? n : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }

        try {
            String normalized = normalizeUtcIso(raw);
            return Instant.parse(normalized).toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
