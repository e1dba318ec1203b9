package org.politia.warehouse.repository;

import lombok.Value;

/**
 * Name projection of a source-originated person, used to build the speaker roster.
 */
@Value
public class KnownPerson {
    String personId;
    String fullName;
    String familyName;
    String givenName;
}
