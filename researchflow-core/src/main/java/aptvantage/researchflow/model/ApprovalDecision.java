package aptvantage.researchflow.model;

public enum ApprovalDecision {
    APPROVE(ApprovalStatus.APPROVED, EventType.APPROVAL_APPROVED),
    MODIFY(ApprovalStatus.MODIFIED, EventType.APPROVAL_MODIFIED),
    REJECT(ApprovalStatus.REJECTED, EventType.APPROVAL_REJECTED);

    private final ApprovalStatus status;
    private final EventType eventType;

    ApprovalDecision(ApprovalStatus status, EventType eventType) {
        this.status = status;
        this.eventType = eventType;
    }

    public ApprovalStatus status() {
        return status;
    }

    public EventType eventType() {
        return eventType;
    }
}
