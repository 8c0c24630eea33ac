package aptvantage.researchflow.model;

import com.google.common.collect.ImmutableMap;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * An input to the state machine. The payload carries agent output, a reviewer's modifications or a scope change
 * delta depending on the event type.
 */
public record WorkflowEvent(
        EventType type,
        ApprovalKind approvalKind,
        Map<String, Serializable> payload,
        AgentTask routingHint,
        String detail,
        boolean accepted
) {

    public WorkflowEvent {
        Objects.requireNonNull(type, "type");
        payload = payload == null ? ImmutableMap.of() : ImmutableMap.copyOf(payload);
    }

    public static WorkflowEvent agentSucceeded(Map<String, Serializable> output, AgentTask routingHint) {
        return new WorkflowEvent(EventType.AGENT_SUCCEEDED, null, output, routingHint, null, false);
    }

    public static WorkflowEvent agentFailed(String error) {
        return new WorkflowEvent(EventType.AGENT_FAILED_TERMINALLY, null, null, null, error, false);
    }

    public static WorkflowEvent approval(EventType type, ApprovalKind kind, Map<String, Serializable> modifications,
                                         String notes) {
        if (!type.isApprovalEvent()) {
            throw new IllegalArgumentException("Not an approval event [%s]".formatted(type));
        }
        return new WorkflowEvent(type, Objects.requireNonNull(kind, "kind"), modifications, null, notes, false);
    }

    public static WorkflowEvent scopeChangeRequested(Map<String, Serializable> delta, String reason) {
        return new WorkflowEvent(EventType.SCOPE_CHANGE_REQUESTED, null, delta, null, reason, false);
    }

    public static WorkflowEvent scopeChangeResolved(boolean accepted, Map<String, Serializable> delta, String detail) {
        return new WorkflowEvent(EventType.SCOPE_CHANGE_RESOLVED, ApprovalKind.SCOPE_CHANGE, delta, null, detail,
                accepted);
    }

    public static WorkflowEvent cancel(String reason) {
        return new WorkflowEvent(EventType.CANCEL_REQUESTED, null, null, null, reason, false);
    }

    public static WorkflowEvent escalation(EscalationAction action, String detail) {
        return new WorkflowEvent(action.eventType(), null, null, null, detail, false);
    }
}
