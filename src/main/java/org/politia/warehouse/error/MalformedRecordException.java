package org.politia.warehouse.error;

/**
 * A record does not have the structure its source promises (wrong JSON shape, missing required field).
 */
public class MalformedRecordException extends RecordValidationException {

    public MalformedRecordException(String message) {
        super(message);
    }
}
