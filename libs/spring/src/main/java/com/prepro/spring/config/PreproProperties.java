package com.prepro.spring.config;

import jakarta.validation.constraints.NotBlank;
import java.time.ZoneId;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings bound from the {@code prepro.*} prefix:
 *
 * <pre>
 * prepro:
 *   service-name: blog
 *   time-zone: Europe/Berlin
 *   formats:
 *     month: MMMM yyyy
 * </pre>
 *
 * @param serviceName value of the {@code service} tag on mediation metrics
 * @param timeZone    zone in which presented timestamps are rendered
 * @param formats     named date/time patterns, added to or replacing the built-in ones
 */
@ConfigurationProperties(prefix = "prepro")
@Validated
public record PreproProperties(@NotBlank String serviceName, String timeZone, Map<String, String> formats) {

    public static final String DEFAULT_SERVICE_NAME = "prepro";

    /** Applies defaults before Bean Validation runs. */
    public PreproProperties {
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = DEFAULT_SERVICE_NAME;
        }
        if (timeZone == null || timeZone.isBlank()) {
            timeZone = "UTC";
        }
        formats = formats == null ? Map.of() : Map.copyOf(formats);
    }

    /**
     * The configured zone.
     *
     * @throws java.time.DateTimeException if {@link #timeZone} is not a valid zone id
     */
    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }
}
