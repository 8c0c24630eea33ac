package aptvantage.researchflow.engine;

import java.util.NoSuchElementException;

public class UnknownRequestException extends NoSuchElementException {

    public UnknownRequestException(String requestId) {
        super("No request found with id [%s]".formatted(requestId));
    }
}
