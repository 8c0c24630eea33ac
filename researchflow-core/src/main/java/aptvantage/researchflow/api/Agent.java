package aptvantage.researchflow.api;

import aptvantage.researchflow.model.WorkflowContext;

/**
 * A unit of work invoked by the orchestrator when a request enters the work state mapped to this agent. Agents
 * are stateless per invocation; anything they need must come from the context and anything they produce must be
 * returned in the result.
 * <p>
 * A thrown exception is treated as a transient failure and retried according to the configured {@link RetryPolicy}.
 */
public interface Agent {

    String id();

    AgentResult execute(String taskName, WorkflowContext context) throws Exception;
}
