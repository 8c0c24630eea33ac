package aptvantage.researchflow.model;

public enum EventType {
    SUBMITTED,
    AGENT_SUCCEEDED,
    AGENT_FAILED_TERMINALLY,
    APPROVAL_APPROVED,
    APPROVAL_MODIFIED,
    APPROVAL_REJECTED,
    APPROVAL_TIMED_OUT,
    SCOPE_CHANGE_REQUESTED,
    SCOPE_CHANGE_RESOLVED,
    CANCEL_REQUESTED,
    ESCALATION_RETRY,
    ESCALATION_FORCE_FAIL,
    ESCALATION_FORCE_COMPLETE;

    public boolean isApprovalEvent() {
        return this == APPROVAL_APPROVED
                || this == APPROVAL_MODIFIED
                || this == APPROVAL_REJECTED
                || this == APPROVAL_TIMED_OUT;
    }
}
