package org.politia.warehouse.report;

import lombok.Builder;
import lombok.Value;

/**
 * A placeholder person and how many speeches currently point at it.
 */
@Value
@Builder
public class PlaceholderSpeaker {
    String personId;
    String fullName;
    String normalizedName;
    String familyName;
    String givenName;
    long speechCount;
}
