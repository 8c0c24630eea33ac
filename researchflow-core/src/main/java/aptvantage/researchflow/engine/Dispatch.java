package aptvantage.researchflow.engine;

import aptvantage.researchflow.model.AgentTask;
import aptvantage.researchflow.model.WorkflowInstance;
import aptvantage.researchflow.model.WorkflowState;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry into a work state. A dispatch owns the attempt budget for its agent task and is only valid while the
 * instance is still at {@code instanceVersion}.
 */
public record Dispatch(
        String requestId,
        AgentTask task,
        WorkflowState state,
        int instanceVersion,
        String dispatchId,
        int attempt,
        Instant readyAt
) {

    public static Dispatch first(WorkflowInstance instance, AgentTask task, Instant readyAt) {
        return new Dispatch(instance.requestId(), task, instance.state(), instance.version(),
                UUID.randomUUID().toString(), 1, readyAt);
    }

    public Dispatch nextAttempt(Instant readyAt) {
        return new Dispatch(requestId, task, state, instanceVersion, dispatchId, attempt + 1, readyAt);
    }

    public Dispatch deferredUntil(Instant readyAt) {
        return new Dispatch(requestId, task, state, instanceVersion, dispatchId, attempt, readyAt);
    }
}
