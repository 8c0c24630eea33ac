package aptvantage.researchflow.engine;

import aptvantage.researchflow.model.EscalationAction;

public class EscalationConflictException extends RuntimeException {

    public EscalationConflictException(String escalationId, EscalationAction action) {
        super("Escalation [%s] was already resolved with [%s]".formatted(escalationId, action));
    }
}
