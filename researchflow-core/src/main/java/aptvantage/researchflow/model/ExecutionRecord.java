package aptvantage.researchflow.model;

import com.google.common.collect.ImmutableMap;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

public record ExecutionRecord(
        String requestId,
        String agentId,
        String task,
        String dispatchId,
        int attempt,
        Instant startedAt,
        Instant finishedAt,
        ExecutionOutcome outcome,
        Map<String, Serializable> result,
        String error
) {

    public ExecutionRecord {
        result = result == null ? ImmutableMap.of() : ImmutableMap.copyOf(result);
    }
}
