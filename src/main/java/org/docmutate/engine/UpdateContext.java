package org.docmutate.engine;

/**
 * Whether an update is being applied to an existing document or to a document being created by an upsert.
 * Only {@link #INSERT} applies {@code $setOnInsert}.
 */
public enum UpdateContext {
    UPDATE,
    INSERT
}
