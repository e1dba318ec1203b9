package org.politia.warehouse.pipeline.event;

import lombok.Value;
import org.politia.warehouse.pipeline.UnitReport;

/**
 * Published once per unit when it reaches a terminal state.
 */
@Value
public class UnitProcessedEvent {
    UnitReport report;
}
