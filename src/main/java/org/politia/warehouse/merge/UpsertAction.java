package org.politia.warehouse.merge;

/**
 * What an upsert did to the store.
 */
public enum UpsertAction {
    CREATED,
    UPDATED,
    SKIPPED
}
