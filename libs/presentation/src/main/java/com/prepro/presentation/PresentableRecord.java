package com.prepro.presentation;

import com.prepro.mediation.Presentable;
import com.prepro.mediation.RequestContext;
import com.prepro.mediation.ViewContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Base class for records rendered through a {@link com.prepro.mediation.ReadMediator}.
 * <p>
 * Once presented, a record carries the {@link RequestContext} of the call, and the helpers
 * below use its view context to render values. They never throw: when a value cannot be
 * rendered they return {@value #NOT_AVAILABLE}.
 *
 * @param <A> the actor type
 */
public abstract class PresentableRecord<A> implements Presentable<A> {

    /** Output of a helper that could not render its value. */
    public static final String NOT_AVAILABLE = "N/A";

    /** Placeholder text for blank values. */
    public static final String BLANK_PLACEHOLDER = "None Given";

    /** Format name selecting relative wording in {@link #formattedDatetime}. */
    public static final String DISTANCE_IN_WORDS = "distance_in_words";

    private static final Logger log = LoggerFactory.getLogger(PresentableRecord.class);
    private static final Pattern LEADING_ONE = Pattern.compile("^1\\s+");

    private RequestContext<A> requestContext;

    @Override
    public void attachRequestContext(RequestContext<A> context) {
        this.requestContext = context;
    }

    @Override
    public RequestContext<A> requestContext() {
        return requestContext;
    }

    /**
     * The actor this record was presented to, or {@code null} if it was not presented or the
     * actor was anonymous.
     */
    protected A actor() {
        return requestContext == null ? null : requestContext.actor();
    }

    public String formattedDatetime(Instant time, String format) {
        return formattedDatetime(time, format, RelativeTimeOptions.defaults());
    }

    /**
     * Formats a timestamp: {@value #DISTANCE_IN_WORDS} gives "3 days ago" or "in 3 days"
     * depending on which side of now it falls; any other name selects a named format.
     */
    public String formattedDatetime(Instant time, String format, RelativeTimeOptions options) {
        if (time == null) {
            return NOT_AVAILABLE;
        }
        try {
            if (DISTANCE_IN_WORDS.equals(format)) {
                Instant now = view().now();
                if (now == null) {
                    return NOT_AVAILABLE;
                }
                return time.isBefore(now) ? timeAgoInWords(time, options) : timeFromNowInWords(time, options);
            }
            return view().format(time, format);
        } catch (RuntimeException e) {
            log.debug("Cannot format {} as '{}'", time, format, e);
            return NOT_AVAILABLE;
        }
    }

    public String timeAgoInWords(Instant time) {
        return timeAgoInWords(time, RelativeTimeOptions.defaults());
    }

    /**
     * Renders a past time as e.g. {@code <span title="...">2 hours ago</span>}, with the
     * absolute time as the title. "about" qualifiers are dropped.
     */
    public String timeAgoInWords(Instant time, RelativeTimeOptions options) {
        return relative(time, options, false);
    }

    public String timeFromNowInWords(Instant time) {
        return timeFromNowInWords(time, RelativeTimeOptions.defaults());
    }

    /**
     * Renders a future time as e.g. {@code <span title="...">in 2 hours</span>}.
     */
    public String timeFromNowInWords(Instant time, RelativeTimeOptions options) {
        return relative(time, options, true);
    }

    /** "Yes" for true, "No" for false or null. */
    public String formattedBoolean(Boolean value) {
        return Boolean.TRUE.equals(value) ? "Yes" : "No";
    }

    /**
     * A labelled placeholder for a blank value, {@code <span class="label">None Given</span>};
     * plain text if this record carries no view context.
     */
    public String indicateBlank() {
        ViewContext view = viewOrNull();
        if (view == null) {
            return BLANK_PLACEHOLDER;
        }
        try {
            return view.contentTag("span", BLANK_PLACEHOLDER, Map.of("class", "label"));
        } catch (RuntimeException e) {
            log.debug("Cannot render blank placeholder", e);
            return BLANK_PLACEHOLDER;
        }
    }

    private String relative(Instant time, RelativeTimeOptions options, boolean future) {
        if (time == null) {
            return NOT_AVAILABLE;
        }
        RelativeTimeOptions effective = options == null ? RelativeTimeOptions.defaults() : options;
        try {
            ViewContext view = view();
            String words = view.timeAgoInWords(time).replace("about ", "");
            if (effective.suppressOne()) {
                words = LEADING_ONE.matcher(words).replaceFirst("");
            }
            String text = future ? effective.prefix() + words : words + effective.suffix();
            if (effective.textOnly()) {
                return text;
            }
            String title = view.format(time, DateTimeFormats.FULL_DATE_AND_TIME);
            return view.contentTag("span", text, Map.of("title", title));
        } catch (RuntimeException e) {
            log.debug("Cannot describe {} relative to now", time, e);
            return NOT_AVAILABLE;
        }
    }

    private ViewContext view() {
        if (requestContext == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has not been presented");
        }
        return requestContext.requireViewContext();
    }

    private ViewContext viewOrNull() {
        return requestContext == null ? null : requestContext.viewContext();
    }
}
