package aptvantage.researchflow.engine.persistence;

/**
 * A write or read against the workflow store failed for infrastructure reasons. Writes failing this way may
 * succeed when retried.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
