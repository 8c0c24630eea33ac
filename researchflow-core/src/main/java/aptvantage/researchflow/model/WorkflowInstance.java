package aptvantage.researchflow.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one research request. Instances are immutable; every transition produces a new instance with one
 * more history entry, and the length of the history is the version used for optimistic concurrency.
 */
public record WorkflowInstance(
        String requestId,
        List<HistoryEntry> history,
        WorkflowContext context,
        WorkflowState resumeState,
        WorkflowContext scopeSnapshot,
        Instant createdAt
) {

    public WorkflowInstance {
        Objects.requireNonNull(requestId, "requestId");
        history = List.copyOf(history);
        if (history.isEmpty()) {
            throw new IllegalArgumentException("Instance [%s] has no history".formatted(requestId));
        }
        context = context == null ? WorkflowContext.empty() : context;
    }

    public static WorkflowInstance submitted(String requestId, WorkflowState initialState, WorkflowContext context,
                                             Instant now) {
        return new WorkflowInstance(
                requestId,
                List.of(new HistoryEntry(initialState, EventType.SUBMITTED, now, "submitted")),
                context,
                null,
                null,
                now);
    }

    public WorkflowState state() {
        return history.get(history.size() - 1).state();
    }

    public int version() {
        return history.size();
    }

    public Instant updatedAt() {
        return history.get(history.size() - 1).timestamp();
    }

    public boolean isTerminal() {
        return state().isTerminal();
    }
}
