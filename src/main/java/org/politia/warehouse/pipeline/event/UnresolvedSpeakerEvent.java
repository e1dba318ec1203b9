package org.politia.warehouse.pipeline.event;

import lombok.Value;

/**
 * Published once per distinct speaker name of a committed unit that was attributed to a placeholder.
 */
@Value
public class UnresolvedSpeakerEvent {
    String unitId;
    String rawName;
    String normalizedName;
    String placeholderId;
    boolean ambiguous;
}
