package org.politia.warehouse.resolve;

/**
 * Which step of the matching cascade produced a resolution, in cascade order.
 */
public enum MatchStrategy {
    EXACT,
    REVERSED,
    SURNAME_FIRST,
    GIVEN_FIRST,
    SURNAME_AND_FIRST_GIVEN,
    SURNAME_ONLY,
    PLACEHOLDER
}
