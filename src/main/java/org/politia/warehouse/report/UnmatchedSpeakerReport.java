package org.politia.warehouse.report;

import lombok.Value;

import java.util.List;

/**
 * Every speaker still attributed to a placeholder, for manual re-linking.
 */
@Value
public class UnmatchedSpeakerReport {
    List<PlaceholderSpeaker> speakers;

    public int getTotalUnmatched() {
        return speakers.size();
    }
}
