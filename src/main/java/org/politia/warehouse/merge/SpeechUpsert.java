package org.politia.warehouse.merge;

import lombok.Value;
import org.politia.warehouse.resolve.SpeakerResolution;

/**
 * Result of writing one speech. {@code resolution} is null when the speech already existed and the
 * speaker was therefore never resolved.
 */
@Value
public class SpeechUpsert {
    String speechId;
    UpsertAction action;
    SpeakerResolution resolution;
    boolean placeholderCreated;

    public boolean isUnresolvedSpeaker() {
        return resolution != null && resolution.isPlaceholder();
    }
}
