package org.politia.warehouse.error;

/**
 * Any failure that aborts a whole unit: reading or parsing the unit, or a store transaction failure.
 * The unit's transaction is rolled back and the run moves on to the next unit.
 */
public class UnitProcessingException extends RuntimeException {

    private final String unitId;

    public UnitProcessingException(String unitId, String message) {
        super(message);
        this.unitId = unitId;
    }

    public UnitProcessingException(String unitId, String message, Throwable cause) {
        super(message, cause);
        this.unitId = unitId;
    }

    public String getUnitId() {
        return unitId;
    }
}
