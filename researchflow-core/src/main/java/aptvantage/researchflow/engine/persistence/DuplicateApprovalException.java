package aptvantage.researchflow.engine.persistence;

import aptvantage.researchflow.model.ApprovalKind;

public class DuplicateApprovalException extends RuntimeException {

    public DuplicateApprovalException(String requestId, ApprovalKind kind) {
        super("Request [%s] already has a pending approval of kind [%s]".formatted(requestId, kind));
    }
}
