package aptvantage.researchflow.engine.persistence;

/**
 * The workflow store could not be written after all retries. Callers should treat the service as unavailable;
 * no in-memory state was changed.
 */
public class PersistenceUnavailableException extends RuntimeException {

    public PersistenceUnavailableException(String operation, Throwable cause) {
        super("Workflow store unavailable while attempting [%s]".formatted(operation), cause);
    }
}
