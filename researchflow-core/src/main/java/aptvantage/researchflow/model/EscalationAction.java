package aptvantage.researchflow.model;

/**
 * Remedial actions a human can choose when resolving an escalation.
 */
public enum EscalationAction {
    RETRY_FROM_STATE(EventType.ESCALATION_RETRY),
    FORCE_FAIL(EventType.ESCALATION_FORCE_FAIL),
    FORCE_COMPLETE_WITH_OVERRIDE(EventType.ESCALATION_FORCE_COMPLETE);

    private final EventType eventType;

    EscalationAction(EventType eventType) {
        this.eventType = eventType;
    }

    public EventType eventType() {
        return eventType;
    }
}
