package aptvantage.researchflow.engine;

import aptvantage.researchflow.model.EventType;
import aptvantage.researchflow.model.WorkflowState;

public class InvalidTransitionException extends RuntimeException {

    private final WorkflowState state;
    private final EventType event;

    public InvalidTransitionException(String requestId, WorkflowState state, EventType event) {
        this(requestId, state, event, "not permitted");
    }

    public InvalidTransitionException(String requestId, WorkflowState state, EventType event, String reason) {
        super("Request [%s] cannot handle [%s] in state [%s]: %s".formatted(requestId, event, state, reason));
        this.state = state;
        this.event = event;
    }

    public WorkflowState getState() {
        return state;
    }

    public EventType getEvent() {
        return event;
    }
}
