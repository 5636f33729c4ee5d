package com.prepro.presentation;

import com.prepro.mediation.ViewContext;
import org.apache.commons.text.StringEscapeUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A {@link ViewContext} rendering HTML tags and English relative times, for applications
 * without a template engine of their own. The clock's zone is used for named formats and for
 * calendar-year arithmetic.
 */
public class DefaultViewContext implements ViewContext {

    private static final Pattern TAG_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9-]*");

    private final Clock clock;
    private final DateTimeFormats formats;

    /** UTC system clock and the built-in formats. */
    public DefaultViewContext() {
        this(Clock.systemUTC(), DateTimeFormats.defaults());
    }

    public DefaultViewContext(Clock clock, DateTimeFormats formats) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (formats == null) {
            throw new IllegalArgumentException("formats must not be null");
        }
        this.clock = clock;
        this.formats = formats;
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public String timeAgoInWords(Instant time) {
        return TimeInWords.distance(time, clock.instant(), clock.getZone());
    }

    @Override
    public String contentTag(String name, String content, Map<String, String> attributes) {
        if (name == null || !TAG_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid tag name: " + name);
        }
        StringBuilder html = new StringBuilder("<").append(name);
        if (attributes != null) {
            attributes.forEach((key, value) -> {
                if (!TAG_NAME.matcher(key).matches()) {
                    throw new IllegalArgumentException("invalid attribute name: " + key);
                }
                html.append(' ').append(key).append("=\"")
                        .append(StringEscapeUtils.escapeHtml4(value == null ? "" : value))
                        .append('"');
            });
        }
        return html.append('>')
                .append(StringEscapeUtils.escapeHtml4(content == null ? "" : content))
                .append("</").append(name).append('>')
                .toString();
    }

    @Override
    public String format(Instant time, String formatName) {
        if (time == null) {
            throw new IllegalArgumentException("time must not be null");
        }
        return formats.format(time, formatName, clock.getZone());
    }

    public Clock clock() {
        return clock;
    }

    public DateTimeFormats formats() {
        return formats;
    }
}
