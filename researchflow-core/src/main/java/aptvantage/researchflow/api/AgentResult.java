package aptvantage.researchflow.api;

import aptvantage.researchflow.model.AgentTask;

import com.google.common.collect.ImmutableMap;

import java.io.Serializable;
import java.util.Map;
import java.util.Optional;

public record AgentResult(
        boolean success,
        Map<String, Serializable> output,
        String error,
        boolean retryable,
        String nextAgent,
        String nextTask
) {

    public AgentResult {
        output = output == null ? ImmutableMap.of() : ImmutableMap.copyOf(output);
    }

    public static AgentResult ok(Map<String, ? extends Serializable> output) {
        return new AgentResult(true, ImmutableMap.copyOf(output), null, false, null, null);
    }

    public static AgentResult ok() {
        return ok(Map.of());
    }

    public static AgentResult failure(String error) {
        return new AgentResult(false, Map.of(), error, true, null, null);
    }

    public static AgentResult permanentFailure(String error) {
        return new AgentResult(false, Map.of(), error, false, null, null);
    }

    /**
     * Ask the orchestrator to continue with the given agent and task instead of the default next state. Hints the
     * workflow does not permit from the current state are ignored.
     */
    public AgentResult routeTo(String agentId, String taskName) {
        return new AgentResult(success, output, error, retryable, agentId, taskName);
    }

    public Optional<AgentTask> routingHint() {
        if (nextAgent == null || nextTask == null) {
            return Optional.empty();
        }
        return Optional.of(new AgentTask(nextAgent, nextTask));
    }
}
