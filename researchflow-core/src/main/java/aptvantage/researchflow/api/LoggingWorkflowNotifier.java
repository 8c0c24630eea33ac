package aptvantage.researchflow.api;

import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.EscalationRecord;
import aptvantage.researchflow.model.WorkflowInstance;
import com.google.common.flogger.FluentLogger;

public class LoggingWorkflowNotifier implements WorkflowNotifier {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    @Override
    public void gateOpened(ApprovalRecord approval) {
        logger.atInfo().log("Approval [%s] of kind [%s] is waiting for review on request [%s]",
                approval.approvalId(), approval.kind(), approval.requestId());
    }

    @Override
    public void escalationRaised(EscalationRecord escalation) {
        logger.atWarning().log("Escalation [%s] raised for request [%s] with severity [%s]: %s",
                escalation.escalationId(), escalation.requestId(), escalation.severity(), escalation.detail());
    }

    @Override
    public void terminalStateReached(WorkflowInstance instance) {
        logger.atInfo().log("Request [%s] finished in state [%s]", instance.requestId(), instance.state());
    }
}
