package eu.okaeri.datatables;

/**
 * Base exception for all failures raised while turning a grid request
 * into filter and order expressions.
 */
public class DataTablesException extends RuntimeException {

    public DataTablesException(String message) {
        super(message);
    }

    public DataTablesException(String message, Throwable cause) {
        super(message, cause);
    }
}
