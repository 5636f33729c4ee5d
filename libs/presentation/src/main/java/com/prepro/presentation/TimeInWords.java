package com.prepro.presentation;

import java.time.Duration;
import java.time.Instant;
import java.time.Year;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Approximate distance between two instants in English words.
 * <p>
 * The wording buckets are:
 * <pre>
 * 0 - 29 s                   less than a minute
 * 30 s - 1 min 29 s          1 minute
 * 1 min 30 s - 44 min 29 s   [2..44] minutes
 * 44 min 30 s - 89 min 29 s  about 1 hour
 * 89 min 30 s - 23 h 59 min  about [2..24] hours
 * 23 h 59 min 30 s - 41 h    1 day
 * 41 h - 29 days 23 h        [2..29] days
 * 29 days 23 h - 59 days     about 1 month
 * 59 days - 1 year           [2..12] months
 * 1 year and more            about / over / almost N years
 * </pre>
 * The year buckets discount the leap days between the two instants.
 */
public final class TimeInWords {

    private static final long MINUTES_IN_DAY = 1440;
    private static final long MINUTES_IN_MONTH = 43_200;
    private static final long MINUTES_IN_YEAR = 525_600;
    private static final long MINUTES_IN_QUARTER_YEAR = 131_400;
    private static final long MINUTES_IN_THREE_QUARTERS_YEAR = 394_200;

    private TimeInWords() {
        // utility class
    }

    /**
     * Describes the distance between two instants, in either order.
     *
     * @param zone the zone used to tell which calendar years (and leap days) lie between them
     */
    public static String distance(Instant from, Instant to, ZoneId zone) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to must not be null");
        }
        Instant earlier = from.isAfter(to) ? to : from;
        Instant later = from.isAfter(to) ? from : to;
        long seconds = Duration.between(earlier, later).getSeconds();
        long minutes = Math.round(seconds / 60.0);

        if (minutes <= 1) {
            return minutes == 0 ? "less than a minute" : "1 minute";
        }
        if (minutes < 45) {
            return minutes + " minutes";
        }
        if (minutes < 90) {
            return "about 1 hour";
        }
        if (minutes < MINUTES_IN_DAY) {
            return "about " + Math.round(minutes / 60.0) + " hours";
        }
        if (minutes < 2520) {
            return "1 day";
        }
        if (minutes < MINUTES_IN_MONTH) {
            return Math.round(minutes / (double) MINUTES_IN_DAY) + " days";
        }
        if (minutes < 2 * MINUTES_IN_MONTH) {
            return "about 1 month";
        }
        if (minutes < MINUTES_IN_YEAR) {
            return Math.round(minutes / (double) MINUTES_IN_MONTH) + " months";
        }
        return years(earlier, later, minutes, zone);
    }

    private static String years(Instant earlier, Instant later, long minutes, ZoneId zone) {
        ZonedDateTime start = earlier.atZone(zone);
        ZonedDateTime end = later.atZone(zone);
        int fromYear = start.getYear() + (start.getMonthValue() >= 3 ? 1 : 0);
        int toYear = end.getYear() - (end.getMonthValue() < 3 ? 1 : 0);
        long leapDays = 0;
        for (int year = fromYear; year <= toYear; year++) {
            if (Year.isLeap(year)) {
                leapDays++;
            }
        }
        long adjusted = minutes - leapDays * MINUTES_IN_DAY;
        long years = adjusted / MINUTES_IN_YEAR;
        long remainder = adjusted % MINUTES_IN_YEAR;

        if (remainder < MINUTES_IN_QUARTER_YEAR) {
            return "about " + plural(years, "year");
        }
        if (remainder < MINUTES_IN_THREE_QUARTERS_YEAR) {
            return "over " + plural(years, "year");
        }
        return "almost " + plural(years + 1, "year");
    }

    private static String plural(long count, String unit) {
        return count + " " + (count == 1 ? unit : unit + "s");
    }
}
