package aptvantage.researchflow.engine.persistence;

public class StaleInstanceException extends RuntimeException {

    public StaleInstanceException(String requestId, int expectedVersion) {
        super("Request [%s] is no longer at version [%s]".formatted(requestId, expectedVersion));
    }
}
