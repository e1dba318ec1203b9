package org.politia.warehouse.pipeline;

/**
 * The raw unit types, in the order a run processes them.
 */
public enum UnitKind {
    PROFILE,
    TRANSCRIPT
}
