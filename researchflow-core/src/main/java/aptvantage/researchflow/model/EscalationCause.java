package aptvantage.researchflow.model;

public enum EscalationCause {
    AGENT_FAILURE,
    APPROVAL_TIMEOUT,
    SCOPE_CHANGE_CONFLICT
}
