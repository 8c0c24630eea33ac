package aptvantage.researchflow.model;

import java.time.Instant;
import java.util.List;

public record RequestStatus(
        String requestId,
        WorkflowState state,
        String description,
        List<HistoryEntry> history,
        Instant createdAt,
        Instant updatedAt
) {

    public static RequestStatus of(WorkflowInstance instance) {
        return new RequestStatus(
                instance.requestId(),
                instance.state(),
                instance.state().description(),
                instance.history(),
                instance.createdAt(),
                instance.updatedAt());
    }
}
