package com.prepro.mediation;

import java.util.List;

/**
 * The outcome of {@link ReadMediator#present}: the decorated record or records, and whether the
 * target was a collection.
 *
 * @param records    the decorated records, in the order they were supplied
 * @param collection true if the target was a collection (a listing)
 * @param <R>        the record type
 */
public record Presentation<R>(List<R> records, boolean collection) {

    public Presentation {
        records = List.copyOf(records);
        if (!collection && records.size() != 1) {
            throw new IllegalArgumentException("a single presentation holds exactly one record");
        }
    }

    static <R> Presentation<R> ofSingle(R record) {
        return new Presentation<>(List.of(record), false);
    }

    static <R> Presentation<R> ofCollection(List<R> records) {
        return new Presentation<>(records, true);
    }

    /**
     * Returns the presented record of a single fetch.
     *
     * @throws IllegalStateException if this presentation is a listing
     */
    public R single() {
        if (collection) {
            throw new IllegalStateException("presentation is a listing of " + records.size() + " record(s)");
        }
        return records.get(0);
    }
}
