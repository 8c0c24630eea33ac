package aptvantage.researchflow.model;

public enum ApprovalStatus {
    PENDING, APPROVED, MODIFIED, REJECTED, TIMED_OUT, WITHDRAWN;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
