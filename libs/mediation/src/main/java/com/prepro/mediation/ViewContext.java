package com.prepro.mediation;

import java.time.Instant;
import java.util.Map;

/**
 * The presentation layer's rendering primitives, passed through the mediators untouched and
 * used only by the formatting helpers of presented records.
 */
public interface ViewContext {

    /** The current instant, against which past and future are told apart. */
    default Instant now() {
        return Instant.now();
    }

    /**
     * Describes the distance between {@code time} and now in words, without a direction,
     * e.g. {@code "about 2 hours"} or {@code "3 days"}.
     */
    String timeAgoInWords(Instant time);

    /**
     * Renders a tag with escaped content and attributes, e.g.
     * {@code <span title="...">3 days ago</span>}.
     *
     * @param name       tag name
     * @param content    text content, escaped by the implementation
     * @param attributes tag attributes in rendering order; may be empty
     */
    String contentTag(String name, String content, Map<String, String> attributes);

    /**
     * Formats {@code time} with a named format (e.g. {@code "full_date_and_time"}).
     *
     * @throws IllegalArgumentException if the format name is unknown
     */
    String format(Instant time, String formatName);
}
