package org.politia.warehouse.pipeline;

/**
 * Lifecycle of one unit. {@code COMMITTED} and {@code ROLLED_BACK} are terminal; there is no retry
 * transition, a rolled-back unit is only retried by a later run over the same input.
 */
public enum UnitState {
    PENDING,
    PROCESSING,
    COMMITTED,
    ROLLED_BACK;

    public boolean canTransitionTo(UnitState next) {
        switch (this) {
            case PENDING:
                return next == PROCESSING;
            case PROCESSING:
                return next == COMMITTED || next == ROLLED_BACK;
            default:
                return false;
        }
    }

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK;
    }
}
