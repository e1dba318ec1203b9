package org.politia.warehouse.resolve;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of resolving one speaker name. For placeholders it also carries the names the placeholder
 * person is created with.
 */
@Value
@Builder
public class SpeakerResolution {
    String rawName;
    String normalizedName;
    String personId;
    MatchStrategy strategy;
    /**
     * True when the surname-only step found several candidates and refused to pick one.
     */
    boolean ambiguous;
    String placeholderFullName;
    String placeholderGivenName;
    String placeholderFamilyName;

    public boolean isPlaceholder() {
        return strategy == MatchStrategy.PLACEHOLDER;
    }
}
