package org.politia.warehouse.error;

/**
 * A record's text or title is empty once normalized.
 */
public class EmptyContentException extends RecordValidationException {

    public EmptyContentException(String message) {
        super(message);
    }
}
