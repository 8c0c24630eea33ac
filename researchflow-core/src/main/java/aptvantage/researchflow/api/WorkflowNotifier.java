package aptvantage.researchflow.api;

import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.EscalationRecord;
import aptvantage.researchflow.model.WorkflowInstance;

/**
 * Receives notifications about things a human may need to act on. Calls are made asynchronously and a failure in
 * a notifier never affects workflow progression.
 */
public interface WorkflowNotifier {

    void gateOpened(ApprovalRecord approval);

    void escalationRaised(EscalationRecord escalation);

    void terminalStateReached(WorkflowInstance instance);
}
