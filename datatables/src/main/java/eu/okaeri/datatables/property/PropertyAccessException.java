package eu.okaeri.datatables.property;

import eu.okaeri.datatables.DataTablesException;

/**
 * Thrown when reading a resolved property from a record fails.
 */
public class PropertyAccessException extends DataTablesException {

    public PropertyAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
