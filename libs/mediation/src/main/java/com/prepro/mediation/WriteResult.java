package com.prepro.mediation;

/**
 * The record a write operation worked on and whether the provider persisted it.
 * <p>
 * An unsuccessful result still carries the record, with the caller's attributes assigned, so
 * the input can be shown again alongside whatever validation errors the record exposes.
 *
 * @param record  the created, updated, or destroyed record
 * @param success whether the provider reported the record as persisted
 * @param <R>     the record type
 */
public record WriteResult<R>(R record, boolean success) {
}
