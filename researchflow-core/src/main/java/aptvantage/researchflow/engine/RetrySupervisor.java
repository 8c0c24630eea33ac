package aptvantage.researchflow.engine;

import aptvantage.researchflow.api.Agent;
import aptvantage.researchflow.api.AgentResult;
import aptvantage.researchflow.api.RetryPolicy;
import aptvantage.researchflow.engine.persistence.DurableWrites;
import aptvantage.researchflow.engine.persistence.WorkflowStore;
import aptvantage.researchflow.model.AgentRunState;
import aptvantage.researchflow.model.AgentTask;
import aptvantage.researchflow.model.EscalationCause;
import aptvantage.researchflow.model.ExecutionOutcome;
import aptvantage.researchflow.model.ExecutionRecord;
import aptvantage.researchflow.model.Severity;
import aptvantage.researchflow.model.WorkflowContext;
import com.google.common.flogger.FluentLogger;

import java.io.Serializable;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Runs a single attempt of a dispatch and decides what happens next. The supervisor never waits between attempts:
 * a retryable failure is reported with the instant the next attempt may start and the caller re-queues the
 * dispatch.
 */
public class RetrySupervisor {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final AgentRegistry agents;
    private final RetryPolicy policy;
    private final WorkflowStore store;
    private final DurableWrites durableWrites;
    private final EscalationManager escalations;
    private final Clock clock;

    private final ConcurrentMap<String, Map<String, AgentRunState>> runStates = new ConcurrentHashMap<>();

    public RetrySupervisor(AgentRegistry agents,
                           RetryPolicy policy,
                           WorkflowStore store,
                           DurableWrites durableWrites,
                           EscalationManager escalations,
                           Clock clock) {
        this.agents = agents;
        this.policy = policy;
        this.store = store;
        this.durableWrites = durableWrites;
        this.escalations = escalations;
        this.clock = clock;
    }

    public AttemptOutcome attempt(Dispatch dispatch, WorkflowContext context) {
        AgentTask task = dispatch.task();
        setRunState(dispatch.requestId(), task.agentId(), AgentRunState.WORKING);
        Instant startedAt = clock.instant();
        AgentResult result = invoke(dispatch, context);
        Instant finishedAt = clock.instant();

        if (result.success()) {
            record(dispatch, startedAt, finishedAt, ExecutionOutcome.SUCCESS, result.output(), null);
            setRunState(dispatch.requestId(), task.agentId(), AgentRunState.IDLE);
            logger.atInfo().log("Agent [%s] completed [%s] for request [%s] on attempt [%s]",
                    task.agentId(), task.task(), dispatch.requestId(), dispatch.attempt());
            return AttemptOutcome.succeeded(result);
        }

        String error = result.error() == null ? "agent reported failure without detail" : result.error();
        if (result.retryable() && policy.hasAttemptsAfter(dispatch.attempt())) {
            record(dispatch, startedAt, finishedAt, ExecutionOutcome.RETRYING, null, error);
            setRunState(dispatch.requestId(), task.agentId(), AgentRunState.FAILED);
            Instant retryAt = finishedAt.plus(policy.delayAfter(dispatch.attempt()));
            logger.atWarning().log("Agent [%s] failed attempt [%s] of [%s] for request [%s], retrying at [%s]: %s",
                    task.agentId(), dispatch.attempt(), policy.maxAttempts(), dispatch.requestId(), retryAt, error);
            return AttemptOutcome.retryAt(retryAt, error);
        }

        record(dispatch, startedAt, finishedAt, ExecutionOutcome.FAILURE, null, error);
        setRunState(dispatch.requestId(), task.agentId(), AgentRunState.FAILED);
        logger.atSevere().log("Agent [%s] failed [%s] for request [%s] after [%s] attempt(s): %s",
                task.agentId(), task.task(), dispatch.requestId(), dispatch.attempt(), error);
        return AttemptOutcome.failedTerminally(error, result.retryable() ? Severity.HIGH : Severity.CRITICAL);
    }

    /**
     * Raise the single AGENT_FAILURE escalation for a dispatch that failed terminally. Only called while the
     * dispatch is still current, so a request that moved on during the last attempt is never escalated.
     *
     * @return the id of the raised escalation
     */
    public String escalate(Dispatch dispatch, AttemptOutcome outcome) {
        if (outcome.kind() != AttemptOutcome.Kind.FAILED_TERMINALLY) {
            throw new IllegalArgumentException("only a terminal failure can be escalated, got [%s]"
                    .formatted(outcome.kind()));
        }
        setRunState(dispatch.requestId(), dispatch.task().agentId(), AgentRunState.WAITING_FOR_HUMAN);
        return escalations.raise(
                dispatch.requestId(),
                EscalationCause.AGENT_FAILURE,
                outcome.severity(),
                describeFailure(dispatch, outcome.error()),
                "Fix the cause and retry from [%s], or force the request to fail".formatted(dispatch.state()));
    }

    private AgentResult invoke(Dispatch dispatch, WorkflowContext context) {
        AgentTask task = dispatch.task();
        Optional<Agent> agent = agents.find(task.agentId());
        if (agent.isEmpty()) {
            return AgentResult.permanentFailure("No agent registered with id [%s]".formatted(task.agentId()));
        }
        try {
            AgentResult result = agent.get().execute(task.task(), context);
            return result == null ? AgentResult.failure("agent returned no result") : result;
        } catch (Exception e) {
            logger.atWarning().withCause(e).log("Agent [%s] threw while running [%s] for request [%s]",
                    task.agentId(), task.task(), dispatch.requestId());
            return AgentResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void record(Dispatch dispatch, Instant startedAt, Instant finishedAt, ExecutionOutcome outcome,
                        Map<String, Serializable> output, String error) {
        ExecutionRecord execution = new ExecutionRecord(
                dispatch.requestId(),
                dispatch.task().agentId(),
                dispatch.task().task(),
                dispatch.dispatchId(),
                dispatch.attempt(),
                startedAt,
                finishedAt,
                outcome,
                output,
                error);
        durableWrites.run("record execution", () -> store.appendExecution(execution));
    }

    private String describeFailure(Dispatch dispatch, String lastError) {
        String attempts = store.findExecutions(dispatch.requestId()).stream()
                .filter(execution -> execution.dispatchId().equals(dispatch.dispatchId()))
                .map(execution -> "attempt %s: %s".formatted(execution.attempt(), execution.error()))
                .collect(Collectors.joining("; "));
        return "Agent [%s] failed task [%s] in state [%s]. Last error: %s. Attempts: %s".formatted(
                dispatch.task().agentId(), dispatch.task().task(), dispatch.state(), lastError, attempts);
    }

    private void setRunState(String requestId, String agentId, AgentRunState state) {
        runStates.computeIfAbsent(requestId, id -> new ConcurrentHashMap<>()).put(agentId, state);
    }

    /**
     * Current run state of each agent that has worked on a request, keyed by request id then agent id.
     */
    public Map<String, Map<String, AgentRunState>> runStates() {
        Map<String, Map<String, AgentRunState>> snapshot = new TreeMap<>();
        runStates.forEach((requestId, states) -> snapshot.put(requestId, Map.copyOf(states)));
        return snapshot;
    }

    public AgentRunState runState(String requestId, String agentId) {
        return runStates.getOrDefault(requestId, Map.of()).getOrDefault(agentId, AgentRunState.IDLE);
    }

    public void release(String requestId) {
        runStates.remove(requestId);
    }
}
