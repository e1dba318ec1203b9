package org.politia.warehouse.pipeline;

import lombok.Getter;

/**
 * Tracks one unit through {@code PENDING -> PROCESSING -> COMMITTED | ROLLED_BACK}.
 */
@Getter
public class UnitExecution {

    private final String unitId;
    private final UnitKind kind;
    private final UnitCounters counters = new UnitCounters();
    private UnitState state = UnitState.PENDING;
    private Throwable failure;

    public UnitExecution(String unitId, UnitKind kind) {
        this.unitId = unitId;
        this.kind = kind;
    }

    public void start() {
        transition(UnitState.PROCESSING);
    }

    public void commit() {
        transition(UnitState.COMMITTED);
    }

    public void rollBack(Throwable cause) {
        transition(UnitState.ROLLED_BACK);
        this.failure = cause;
    }

    public UnitReport report() {
        if (!state.isTerminal()) {
            throw new IllegalStateException("Unit " + unitId + " has not finished: " + state);
        }
        boolean committed = state == UnitState.COMMITTED;
        return UnitReport.builder()
            .unitId(unitId)
            .kind(kind)
            .outcome(state)
            .created(committed ? counters.getCreated() : 0)
            .updated(committed ? counters.getUpdated() : 0)
            .skipped(committed ? counters.getSkipped() : 0)
            .rejected(committed ? counters.getRejected() : 0)
            .placeholdersCreated(committed ? counters.getPlaceholdersCreated() : 0)
            .failure(failure == null ? null : failure.getMessage())
            .build();
    }

    private void transition(UnitState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Unit " + unitId + " cannot go from " + state + " to " + next);
        }
        state = next;
    }
}
