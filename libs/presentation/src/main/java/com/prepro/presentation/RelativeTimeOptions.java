package com.prepro.presentation;

/**
 * Rendering options for relative times.
 *
 * @param prefix      printed before a future distance, default {@code "in "}
 * @param suffix      printed after a past distance, default {@code " ago"}
 * @param suppressOne drop a leading {@code "1 "} from the distance, so that "in the last month"
 *                    reads better than "in the last 1 month"
 * @param textOnly    return plain text instead of a {@code <span>} carrying the absolute time
 *                    as its title
 */
public record RelativeTimeOptions(String prefix, String suffix, boolean suppressOne, boolean textOnly) {

    private static final RelativeTimeOptions DEFAULTS = new RelativeTimeOptions("in ", " ago", false, false);

    public RelativeTimeOptions {
        if (prefix == null) {
            prefix = "";
        }
        if (suffix == null) {
            suffix = "";
        }
    }

    public static RelativeTimeOptions defaults() {
        return DEFAULTS;
    }

    public RelativeTimeOptions withPrefix(String prefix) {
        return new RelativeTimeOptions(prefix, suffix, suppressOne, textOnly);
    }

    public RelativeTimeOptions withSuffix(String suffix) {
        return new RelativeTimeOptions(prefix, suffix, suppressOne, textOnly);
    }

    public RelativeTimeOptions withSuppressOne(boolean suppressOne) {
        return new RelativeTimeOptions(prefix, suffix, suppressOne, textOnly);
    }

    public RelativeTimeOptions withTextOnly(boolean textOnly) {
        return new RelativeTimeOptions(prefix, suffix, suppressOne, textOnly);
    }
}
