package org.politia.warehouse.pipeline;

import lombok.AccessLevel;
import lombok.Getter;
import org.politia.warehouse.merge.UpsertAction;
import org.politia.warehouse.resolve.SpeakerResolution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running tally of one unit's record outcomes.
 */
@Getter
public class UnitCounters {

    private int created;
    private int updated;
    private int skipped;
    private int rejected;
    private int placeholdersCreated;
    @Getter(AccessLevel.NONE)
    private final Map<String, SpeakerResolution> unresolvedSpeakers = new LinkedHashMap<>();

    public void record(UpsertAction action) {
        switch (action) {
            case CREATED:
                created++;
                break;
            case UPDATED:
                updated++;
                break;
            default:
                skipped++;
        }
    }

    public void reject() {
        rejected++;
    }

    public void placeholderCreated() {
        placeholdersCreated++;
    }

    /**
     * Remembers an unresolved speaker once per distinct normalized name.
     */
    public void unresolved(SpeakerResolution resolution) {
        unresolvedSpeakers.putIfAbsent(resolution.getNormalizedName(), resolution);
    }

    public List<SpeakerResolution> unresolvedSpeakers() {
        return new ArrayList<>(unresolvedSpeakers.values());
    }
}
