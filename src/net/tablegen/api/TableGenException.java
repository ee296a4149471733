package net.tablegen.api;

/**
 * Generic superclass for checked table generator exceptions.
 */
public class TableGenException extends Exception {

    public TableGenException() {
        super();
    }
    public TableGenException(String message) {
        super(message);
    }
    public TableGenException(Throwable cause) {
        super(cause);
    }
    public TableGenException(String message, Throwable cause) {
        super(message, cause);
    }

}
