package com.prepro.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link DefaultViewContext} and {@link DateTimeFormats}.
 */
@DisplayName("DefaultViewContext")
class DefaultViewContextTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private final DefaultViewContext view =
            new DefaultViewContext(Clock.fixed(NOW, ZoneOffset.UTC), DateTimeFormats.defaults());

    @Nested
    @DisplayName("contentTag()")
    class ContentTag {

        @Test
        @DisplayName("renders attributes in order and escapes content")
        void rendersAndEscapes() {
            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("class", "label");
            attributes.put("title", "say \"hi\" & <leave>");

            String html = view.contentTag("span", "<b>bold</b>", attributes);

            assertThat(html).isEqualTo(
                    "<span class=\"label\" title=\"say &quot;hi&quot; &amp; &lt;leave&gt;\">&lt;b&gt;bold&lt;/b&gt;</span>");
        }

        @Test
        @DisplayName("renders an empty tag for null content")
        void nullContent() {
            assertThat(view.contentTag("em", null, Map.of())).isEqualTo("<em></em>");
        }

        @Test
        @DisplayName("rejects invalid tag and attribute names")
        void invalidNames() {
            assertThatThrownBy(() -> view.contentTag("span onclick", "x", Map.of()))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> view.contentTag("span", "x", Map.of("on click", "y")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("format()")
    class Format {

        @Test
        @DisplayName("formats built-in named formats in the clock's zone")
        void builtIns() {
            assertThat(view.format(NOW, "date")).isEqualTo("2024-06-15");
            assertThat(view.format(NOW, "db")).isEqualTo("2024-06-15 12:00:00");
            assertThat(view.format(NOW, DateTimeFormats.FULL_DATE_AND_TIME))
                    .isEqualTo("Saturday, June 15, 2024 at 12:00 PM");
        }

        @Test
        @DisplayName("uses the zone of the clock")
        void zone() {
            var tokyo = new DefaultViewContext(Clock.fixed(NOW, ZoneId.of("Asia/Tokyo")), DateTimeFormats.defaults());

            assertThat(tokyo.format(NOW, "db")).isEqualTo("2024-06-15 21:00:00");
        }

        @Test
        @DisplayName("custom formats extend the built-ins")
        void custom() {
            var formats = DateTimeFormats.defaults().withAll(Map.of("month", "MMMM yyyy"));
            var custom = new DefaultViewContext(Clock.fixed(NOW, ZoneOffset.UTC), formats);

            assertThat(custom.format(NOW, "month")).isEqualTo("June 2024");
            assertThat(custom.formats().names()).contains("month", "db");
            assertThat(DateTimeFormats.defaults().names()).doesNotContain("month");
        }

        @Test
        @DisplayName("unknown formats are rejected")
        void unknown() {
            assertThatThrownBy(() -> view.format(NOW, "nope"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("nope");
        }
    }

    @Test
    @DisplayName("describes distances against the clock")
    void timeAgoInWords() {
        assertThat(view.now()).isEqualTo(NOW);
        assertThat(view.timeAgoInWords(NOW.minusSeconds(600))).isEqualTo("10 minutes");
    }
}
