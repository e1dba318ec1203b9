package org.politia.warehouse.pipeline;

import lombok.Builder;
import lombok.Value;

/**
 * Final outcome of one unit. Counts are zero for rolled-back units since nothing they wrote survived.
 */
@Value
@Builder
public class UnitReport {
    String unitId;
    UnitKind kind;
    UnitState outcome;
    int created;
    int updated;
    int skipped;
    int rejected;
    int placeholdersCreated;
    String failure;

    public boolean isCommitted() {
        return outcome == UnitState.COMMITTED;
    }
}
