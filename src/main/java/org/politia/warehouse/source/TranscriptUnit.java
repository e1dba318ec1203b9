package org.politia.warehouse.source;

import lombok.Builder;
import lombok.Value;
import org.politia.warehouse.entity.Chamber;

import java.time.LocalDate;
import java.util.List;

/**
 * One transcript file: the session identity taken from the file name, plus its topics in file order.
 */
@Value
@Builder
public class TranscriptUnit {
    String unitId;
    String sourceReference;
    int legislature;
    Chamber chamber;
    int sessionNumber;
    LocalDate date;
    @Builder.Default
    List<TranscriptTopic> topics = List.of();
}
