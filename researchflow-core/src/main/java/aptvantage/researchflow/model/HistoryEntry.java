package aptvantage.researchflow.model;

import java.time.Instant;

public record HistoryEntry(
        WorkflowState state,
        EventType event,
        Instant timestamp,
        String detail
) {
}
