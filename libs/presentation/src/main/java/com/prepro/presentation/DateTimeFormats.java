package com.prepro.presentation;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Named date/time formats, looked up by name from templates and formatting helpers.
 * <p>
 * Built in:
 * <ul>
 *   <li>{@code db}: 2024-01-31 10:00:00</li>
 *   <li>{@code date}: 2024-01-31</li>
 *   <li>{@code short}: 31 Jan 10:00</li>
 *   <li>{@code long}: January 31, 2024 10:00</li>
 *   <li>{@code full_date_and_time}: Wednesday, January 31, 2024 at 10:00 AM</li>
 *   <li>{@code iso8601}: 2024-01-31T10:00:00Z</li>
 * </ul>
 * Instances are immutable; {@link #with} returns a copy.
 */
public final class DateTimeFormats {

    /** Format used for the title of relative-time tags. */
    public static final String FULL_DATE_AND_TIME = "full_date_and_time";

    private static final DateTimeFormats DEFAULTS = new DateTimeFormats(builtIns());

    private final Map<String, DateTimeFormatter> formatters;

    private DateTimeFormats(Map<String, DateTimeFormatter> formatters) {
        this.formatters = Map.copyOf(formatters);
    }

    public static DateTimeFormats defaults() {
        return DEFAULTS;
    }

    private static Map<String, DateTimeFormatter> builtIns() {
        Map<String, DateTimeFormatter> formats = new LinkedHashMap<>();
        formats.put("db", pattern("yyyy-MM-dd HH:mm:ss"));
        formats.put("date", pattern("yyyy-MM-dd"));
        formats.put("short", pattern("dd MMM HH:mm"));
        formats.put("long", pattern("MMMM dd, yyyy HH:mm"));
        formats.put(FULL_DATE_AND_TIME, pattern("EEEE, MMMM d, yyyy 'at' h:mm a"));
        formats.put("iso8601", DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        return formats;
    }

    private static DateTimeFormatter pattern(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH);
    }

    /**
     * Returns a copy with a format added or replaced.
     *
     * @param name    format name
     * @param pattern a {@link DateTimeFormatter} pattern
     * @throws IllegalArgumentException if the name is blank or the pattern is invalid
     */
    public DateTimeFormats with(String name, String pattern) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern for '" + name + "' must not be null or blank");
        }
        Map<String, DateTimeFormatter> copy = new LinkedHashMap<>(formatters);
        copy.put(name, pattern(pattern));
        return new DateTimeFormats(copy);
    }

    /** Returns a copy with every pattern of {@code patterns} added or replaced. */
    public DateTimeFormats withAll(Map<String, String> patterns) {
        DateTimeFormats result = this;
        for (Map.Entry<String, String> entry : patterns.entrySet()) {
            result = result.with(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Formats an instant in a zone.
     *
     * @throws IllegalArgumentException if no format has that name
     */
    public String format(Instant time, String name, ZoneId zone) {
        DateTimeFormatter formatter = formatters.get(name);
        if (formatter == null) {
            throw new IllegalArgumentException("unknown date/time format '" + name + "'");
        }
        return formatter.format(time.atZone(zone));
    }

    public Set<String> names() {
        return formatters.keySet();
    }
}
