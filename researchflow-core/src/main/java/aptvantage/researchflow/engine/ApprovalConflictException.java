package aptvantage.researchflow.engine;

import aptvantage.researchflow.model.ApprovalStatus;

public class ApprovalConflictException extends RuntimeException {

    public ApprovalConflictException(String approvalId, ApprovalStatus status) {
        super("Approval [%s] is already [%s]".formatted(approvalId, status));
    }
}
