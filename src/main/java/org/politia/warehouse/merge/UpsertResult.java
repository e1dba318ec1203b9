package org.politia.warehouse.merge;

import lombok.Value;

/**
 * The stored entity after an upsert, and whether the upsert created, changed or left it alone.
 */
@Value
public class UpsertResult<T> {
    T entity;
    UpsertAction action;

    public static <T> UpsertResult<T> created(T entity) {
        return new UpsertResult<>(entity, UpsertAction.CREATED);
    }

    public static <T> UpsertResult<T> updated(T entity) {
        return new UpsertResult<>(entity, UpsertAction.UPDATED);
    }

    public static <T> UpsertResult<T> skipped(T entity) {
        return new UpsertResult<>(entity, UpsertAction.SKIPPED);
    }
}
