package org.politia.warehouse.error;

/**
 * A single sub-record of a unit was rejected. The record is skipped and the unit carries on.
 */
public abstract class RecordValidationException extends Exception {

    protected RecordValidationException(String message) {
        super(message);
    }
}
