package net.tablegen.api;

/**
 * Exception thrown when a grammar cannot be used for table construction.
 * This covers symbols lacking a display name, malformed grammar input, and
 * (if so configured) grammars whose tables contain unresolved conflicts.
 */
public class InvalidGrammarException extends TableGenException {

    public InvalidGrammarException() {
        super();
    }
    public InvalidGrammarException(String message) {
        super(message);
    }
    public InvalidGrammarException(Throwable cause) {
        super(cause);
    }
    public InvalidGrammarException(String message, Throwable cause) {
        super(message, cause);
    }

}
