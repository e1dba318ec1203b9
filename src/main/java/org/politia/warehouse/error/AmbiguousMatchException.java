package org.politia.warehouse.error;

import java.util.List;

/**
 * More than one known person matches a speaker name at a step that requires a unique candidate.
 */
public class AmbiguousMatchException extends Exception {

    private final List<String> candidateIds;

    public AmbiguousMatchException(String key, List<String> candidateIds) {
        super("Ambiguous match for '" + key + "': " + candidateIds.size() + " candidates");
        this.candidateIds = List.copyOf(candidateIds);
    }

    public List<String> getCandidateIds() {
        return candidateIds;
    }
}
