package aptvantage.researchflow.engine;

import aptvantage.researchflow.api.ApprovalPolicies;
import aptvantage.researchflow.api.OrchestratorSettings;
import aptvantage.researchflow.engine.persistence.DurableWrites;
import aptvantage.researchflow.engine.persistence.DuplicateApprovalException;
import aptvantage.researchflow.engine.persistence.PersistenceUnavailableException;
import aptvantage.researchflow.engine.persistence.StaleInstanceException;
import aptvantage.researchflow.engine.persistence.WorkflowStore;
import aptvantage.researchflow.model.AgentRunState;
import aptvantage.researchflow.model.AgentTask;
import aptvantage.researchflow.model.ApprovalDecision;
import aptvantage.researchflow.model.ApprovalKind;
import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.ApprovalStatus;
import aptvantage.researchflow.model.EscalationAction;
import aptvantage.researchflow.model.EscalationCause;
import aptvantage.researchflow.model.EscalationRecord;
import aptvantage.researchflow.model.EventType;
import aptvantage.researchflow.model.ExecutionRecord;
import aptvantage.researchflow.model.RequestStatus;
import aptvantage.researchflow.model.Severity;
import aptvantage.researchflow.model.WorkflowContext;
import aptvantage.researchflow.model.WorkflowEvent;
import aptvantage.researchflow.model.WorkflowInstance;
import aptvantage.researchflow.model.WorkflowState;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;

import java.io.Serializable;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives every live request through the {@link WorkflowEngine}. Each request progresses under its own lock; agent
 * work runs outside the lock on the worker executor and its result is applied only if the request has not moved
 * on in the meantime. Every transition is persisted before the in-memory view changes.
 */
public class Orchestrator {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private static final DateTimeFormatter REQUEST_DATE =
            DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    private static final String ORCHESTRATOR = "orchestrator";

    private final WorkflowEngine engine;
    private final WorkflowStore store;
    private final DurableWrites durableWrites;
    private final RetrySupervisor supervisor;
    private final ApprovalGateway approvals;
    private final EscalationManager escalations;
    private final NotificationDispatcher notifications;
    private final LiveInstances live;
    private final DispatchQueue queue;
    private final Executor workers;
    private final ApprovalPolicies policies;
    private final OrchestratorSettings settings;
    private final Clock clock;

    public Orchestrator(WorkflowEngine engine,
                        WorkflowStore store,
                        DurableWrites durableWrites,
                        RetrySupervisor supervisor,
                        ApprovalGateway approvals,
                        EscalationManager escalations,
                        NotificationDispatcher notifications,
                        LiveInstances live,
                        DispatchQueue queue,
                        Executor workers,
                        ApprovalPolicies policies,
                        OrchestratorSettings settings,
                        Clock clock) {
        this.engine = engine;
        this.store = store;
        this.durableWrites = durableWrites;
        this.supervisor = supervisor;
        this.approvals = approvals;
        this.escalations = escalations;
        this.notifications = notifications;
        this.live = live;
        this.queue = queue;
        this.workers = workers;
        this.policies = policies;
        this.settings = settings;
        this.clock = clock;
    }

    public String submit(Map<String, ? extends Serializable> initialContext) {
        String requestId = newRequestId();
        WorkflowInstance instance = engine.start(requestId, WorkflowContext.of(initialContext));
        live.withLock(requestId, () -> {
            durableWrites.run("submit request", () -> store.createInstance(instance));
            live.put(instance);
            logger.atInfo().log("Request [%s] submitted", requestId);
            afterTransition(null, instance, null);
        });
        return requestId;
    }

    public RequestStatus status(String requestId) {
        return live.get(requestId)
                .or(() -> store.findInstance(requestId))
                .map(RequestStatus::of)
                .orElseThrow(() -> new UnknownRequestException(requestId));
    }

    public RequestStatus resolveApproval(String approvalId,
                                         ApprovalDecision decision,
                                         String reviewer,
                                         String notes,
                                         Map<String, ? extends Serializable> modifications) {
        checkNull(decision, "decision");
        ApprovalRecord pending = approvals.find(approvalId)
                .orElseThrow(() -> new NoSuchElementException("No approval found with id [%s]".formatted(approvalId)));
        if (!pending.isPending()) {
            throw new ApprovalConflictException(approvalId, pending.status());
        }
        Map<String, Serializable> delta = modifications == null
                ? ImmutableMap.of()
                : ImmutableMap.copyOf(modifications);
        String requestId = pending.requestId();
        return live.callWithLock(requestId, () -> {
            WorkflowInstance current = requireLive(requestId, decision.eventType());
            ApprovalKind gateKind = engine.requiresApproval(current.state()).orElse(null);
            if (gateKind != pending.kind()) {
                throw new InvalidTransitionException(requestId, current.state(), decision.eventType(),
                        "approval [%s] is for [%s] but the request waits on [%s]"
                                .formatted(approvalId, pending.kind(), gateKind));
            }
            // check the decision can be applied before the record is resolved for good
            ApprovalRecord preview = pending.resolve(decision.status(), reviewer, notes, delta, clock.instant());
            engine.advance(current, ApprovalGateway.eventFor(preview));

            ApprovalGateway.ApprovalResolution resolution =
                    approvals.resolve(approvalId, decision, reviewer, notes, delta);
            return RequestStatus.of(apply(current, resolution.event()));
        });
    }

    public RequestStatus requestScopeChange(String requestId, Map<String, ? extends Serializable> delta,
                                            String reason) {
        if (delta == null || delta.isEmpty()) {
            throw new IllegalArgumentException("A scope change must carry the changed values");
        }
        Map<String, Serializable> changes = ImmutableMap.copyOf(delta);
        return live.callWithLock(requestId, () -> {
            WorkflowInstance current = requireLive(requestId, EventType.SCOPE_CHANGE_REQUESTED);
            if (current.state() == WorkflowState.SCOPE_CHANGE_REVIEW) {
                escalations.raise(requestId,
                        EscalationCause.SCOPE_CHANGE_CONFLICT,
                        Severity.MEDIUM,
                        "Scope change requested while another is under review: %s".formatted(reason),
                        "Resolve the scope change under review, then resubmit this change");
                throw new InvalidTransitionException(requestId, current.state(), EventType.SCOPE_CHANGE_REQUESTED,
                        "a scope change is already under review");
            }
            return RequestStatus.of(apply(current, WorkflowEvent.scopeChangeRequested(changes, reason)));
        });
    }

    public RequestStatus resolveEscalation(String escalationId, EscalationAction action, String resolver) {
        checkNull(action, "action");
        EscalationRecord escalation = escalations.find(escalationId)
                .orElseThrow(() -> new NoSuchElementException(
                        "No escalation found with id [%s]".formatted(escalationId)));
        if (!escalation.isOpen()) {
            throw new EscalationConflictException(escalationId, escalation.action());
        }
        String requestId = escalation.requestId();
        return live.callWithLock(requestId, () -> {
            Optional<WorkflowInstance> current = live.get(requestId);
            boolean drivesTransition = current.isPresent()
                    && current.get().state() == WorkflowState.HUMAN_REVIEW
                    && escalation.cause() != EscalationCause.SCOPE_CHANGE_CONFLICT;
            if (!drivesTransition) {
                escalations.resolve(escalationId, action, resolver);
                logger.atInfo().log("Escalation [%s] acknowledged without changing request [%s]",
                        escalationId, requestId);
                return status(requestId);
            }
            engine.advance(current.get(), WorkflowEvent.escalation(action, null));

            EscalationManager.EscalationResolution resolution = escalations.resolve(escalationId, action, resolver);
            return RequestStatus.of(apply(current.get(), resolution.event()));
        });
    }

    public RequestStatus cancel(String requestId, String reason) {
        return live.callWithLock(requestId, () -> {
            WorkflowInstance current = requireLive(requestId, EventType.CANCEL_REQUESTED);
            return RequestStatus.of(apply(current, WorkflowEvent.cancel(reason)));
        });
    }

    public List<ApprovalRecord> pendingApprovals(ApprovalKind kind) {
        return approvals.pending(kind);
    }

    public List<ApprovalRecord> approvals(String requestId) {
        return approvals.forRequest(requestId);
    }

    public List<ExecutionRecord> executions(String requestId) {
        return store.findExecutions(requestId);
    }

    public List<EscalationRecord> openEscalations() {
        return escalations.open();
    }

    public List<EscalationRecord> escalations(String requestId) {
        return escalations.forRequest(requestId);
    }

    public Map<String, Map<String, AgentRunState>> agentRunStates() {
        return supervisor.runStates();
    }

    /**
     * Hand every dispatch that is due to the worker executor.
     *
     * @return the number of dispatches handed off
     */
    public int tick() {
        List<Dispatch> ready = queue.drainReady(clock.instant());
        for (Dispatch dispatch : ready) {
            try {
                workers.execute(() -> runDispatch(dispatch));
            } catch (RejectedExecutionException e) {
                logger.atWarning().withCause(e).log("Workers refused dispatch for request [%s], re-queueing",
                        dispatch.requestId());
                queue.add(dispatch);
            }
        }
        return ready.size();
    }

    /**
     * Time out overdue approvals and re-open any gate that lost its pending record.
     *
     * @return the number of approvals that timed out
     */
    public int sweepTimeouts() {
        List<ApprovalGateway.ApprovalResolution> timedOut = approvals.sweepTimeouts(clock.instant());
        for (ApprovalGateway.ApprovalResolution resolution : timedOut) {
            String requestId = resolution.record().requestId();
            try {
                live.withLock(requestId, () -> applyTimeout(resolution));
            } catch (RuntimeException e) {
                logger.atSevere().withCause(e).log("Failed to apply timeout of approval [%s] to request [%s]",
                        resolution.record().approvalId(), requestId);
            }
        }
        for (WorkflowInstance instance : live.all()) {
            if (engine.requiresApproval(instance.state()).isPresent()) {
                try {
                    live.withLock(instance.requestId(), () -> live.get(instance.requestId())
                            .ifPresent(this::reconcileGate));
                } catch (RuntimeException e) {
                    logger.atSevere().withCause(e).log("Failed to reconcile gate of request [%s]",
                            instance.requestId());
                }
            }
        }
        return timedOut.size();
    }

    /**
     * Rebuild live instances from the store after a cold start. Work states are dispatched again and gate states
     * are checked for a missing or resolved-but-unapplied approval.
     *
     * @return the number of requests recovered
     */
    public int recover() {
        List<WorkflowInstance> active = store.findActiveInstances();
        int recovered = 0;
        for (WorkflowInstance instance : active) {
            if (live.contains(instance.requestId())) {
                continue;
            }
            try {
                engine.replay(instance.history());
            } catch (IllegalStateException e) {
                logger.atSevere().withCause(e).log("Request [%s] has an invalid history and was not recovered",
                        instance.requestId());
                continue;
            }
            live.withLock(instance.requestId(), () -> {
                live.put(instance);
                engine.requiresAgent(instance.state()).ifPresent(task ->
                        queue.add(Dispatch.first(instance, task, clock.instant())));
                if (engine.requiresApproval(instance.state()).isPresent()) {
                    reconcileGate(instance);
                }
            });
            recovered++;
        }
        logger.atInfo().log("Recovered [%s] active request(s)", recovered);
        return recovered;
    }

    private void runDispatch(Dispatch dispatch) {
        String requestId = dispatch.requestId();
        WorkflowContext context = live.callWithLock(requestId, () -> {
            WorkflowInstance current = live.get(requestId).orElse(null);
            if (current == null || current.version() != dispatch.instanceVersion()) {
                logger.atInfo().log("Discarding stale dispatch of [%s] for request [%s]", dispatch.task(), requestId);
                return null;
            }
            if (!live.tryStartWork(requestId)) {
                // a superseded agent call is still running, try again once it has had time to finish
                logger.atInfo().log("Request [%s] still has superseded agent work in flight, deferring [%s]",
                        requestId, dispatch.task());
                queue.add(dispatch.deferredUntil(clock.instant().plus(settings.dispatchInterval())));
                return null;
            }
            return current.context();
        });
        if (context == null) {
            return;
        }
        try {
            AttemptOutcome outcome = supervisor.attempt(dispatch, context);
            switch (outcome.kind()) {
                case SUCCEEDED -> applyIfCurrent(dispatch, WorkflowEvent.agentSucceeded(
                        outcome.result().output(), outcome.result().routingHint().orElse(null)));
                case RETRY_SCHEDULED -> queue.add(dispatch.nextAttempt(outcome.retryAt()));
                case FAILED_TERMINALLY -> applyIfCurrent(dispatch, WorkflowEvent.agentFailed(outcome.error()),
                        () -> supervisor.escalate(dispatch, outcome));
            }
        } catch (PersistenceUnavailableException e) {
            logger.atSevere().withCause(e).log("Could not record progress of [%s] for request [%s], dispatching again",
                    dispatch.task(), requestId);
            live.withLock(requestId, () -> live.get(requestId)
                    .filter(current -> current.version() == dispatch.instanceVersion())
                    .ifPresent(current -> queue.add(Dispatch.first(current, dispatch.task(),
                            clock.instant().plus(settings.dispatchInterval())))));
        } finally {
            live.withLock(requestId, () -> {
                live.finishWork(requestId);
                if (!live.contains(requestId)) {
                    supervisor.release(requestId);
                }
            });
        }
    }

    private void applyIfCurrent(Dispatch dispatch, WorkflowEvent event) {
        applyIfCurrent(dispatch, event, () -> {
        });
    }

    private void applyIfCurrent(Dispatch dispatch, WorkflowEvent event, Runnable beforeApply) {
        live.withLock(dispatch.requestId(), () -> {
            WorkflowInstance current = live.get(dispatch.requestId()).orElse(null);
            if (current == null || current.version() != dispatch.instanceVersion()) {
                logger.atInfo().log("Request [%s] moved on while [%s] was running, discarding its [%s]",
                        dispatch.requestId(), dispatch.task(), event.type());
                return;
            }
            try {
                beforeApply.run();
                apply(current, event);
            } catch (InvalidTransitionException | StaleInstanceException e) {
                logger.atWarning().withCause(e).log("Discarding [%s] for request [%s]",
                        event.type(), dispatch.requestId());
            }
        });
    }

    private void applyTimeout(ApprovalGateway.ApprovalResolution resolution) {
        ApprovalRecord record = resolution.record();
        WorkflowInstance current = live.get(record.requestId()).orElse(null);
        if (current == null || engine.requiresApproval(current.state()).orElse(null) != record.kind()) {
            logger.atInfo().log("Request [%s] is no longer waiting on [%s], ignoring timeout of approval [%s]",
                    record.requestId(), record.kind(), record.approvalId());
            return;
        }
        String recommendation = switch (policies.onTimeout(record.kind())) {
            case AUTO_REJECT -> "The request was rejected automatically; resubmit it if it is still needed";
            case HOLD_FOR_OVERRIDE -> "Review the request and retry from the gate, force it to fail or force it "
                    + "to complete";
        };
        escalations.raise(record.requestId(),
                EscalationCause.APPROVAL_TIMEOUT,
                Severity.HIGH,
                "Approval [%s] of kind [%s] was not resolved by [%s]"
                        .formatted(record.approvalId(), record.kind(), record.timeoutAt()),
                record.kind() == ApprovalKind.SCOPE_CHANGE
                        ? "The scope change was discarded; submit it again if it is still needed"
                        : recommendation);
        apply(current, resolution.event());
    }

    /**
     * Every entry into a gate state opens exactly one approval record, so fewer records than entries means the
     * record for the current entry was never written, and a resolved latest record means its decision was never
     * applied.
     */
    private void reconcileGate(WorkflowInstance instance) {
        ApprovalKind kind = engine.requiresApproval(instance.state()).orElseThrow();
        if (approvals.pendingFor(instance.requestId(), kind).isPresent()) {
            return;
        }
        long entries = instance.history().stream()
                .filter(entry -> entry.state() == instance.state())
                .count();
        List<ApprovalRecord> records = approvals.forRequest(instance.requestId()).stream()
                .filter(approval -> approval.kind() == kind)
                .toList();
        if (!records.isEmpty() && records.size() >= entries) {
            ApprovalRecord latest = records.get(records.size() - 1);
            if (latest.status() != ApprovalStatus.WITHDRAWN) {
                logger.atInfo().log("Applying unapplied [%s] decision of approval [%s] to request [%s]",
                        latest.status(), latest.approvalId(), instance.requestId());
                apply(instance, ApprovalGateway.eventFor(latest));
                return;
            }
        }
        logger.atInfo().log("Re-opening [%s] approval for request [%s]", kind, instance.requestId());
        openGate(instance, kind, instance.context().asMap(), ORCHESTRATOR);
    }

    private WorkflowInstance apply(WorkflowInstance current, WorkflowEvent event) {
        WorkflowInstance next = engine.advance(current, event);
        durableWrites.run("append transition", () -> store.appendTransition(next, current.version()));
        live.put(next);
        logger.atInfo().log("Request [%s] moved from [%s] to [%s] on [%s]",
                next.requestId(), current.state(), next.state(), event.type());
        afterTransition(current, next, event);
        return next;
    }

    private void afterTransition(WorkflowInstance previous, WorkflowInstance next, WorkflowEvent event) {
        String requestId = next.requestId();
        WorkflowState state = next.state();
        if (state.isTerminal()) {
            withdrawPending(requestId, "request %s".formatted(state.name().toLowerCase(Locale.ROOT)));
            supervisor.release(requestId);
            live.remove(requestId);
            notifications.terminalStateReached(next);
            logger.atInfo().log("Request [%s] reached terminal state [%s]", requestId, state);
            return;
        }
        if (event != null && event.type() == EventType.SCOPE_CHANGE_REQUESTED) {
            withdrawPending(requestId, "scope change requested");
        }
        engine.requiresAgent(state).ifPresent(task -> queue.add(Dispatch.first(next, task, clock.instant())));
        engine.requiresApproval(state).ifPresent(kind ->
                openGate(next, kind, gatePayload(next, event), submittedBy(previous)));
    }

    private void openGate(WorkflowInstance instance, ApprovalKind kind, Map<String, Serializable> payload,
                          String submittedBy) {
        try {
            approvals.open(instance.requestId(), kind, payload, submittedBy);
        } catch (DuplicateApprovalException e) {
            logger.atInfo().log("Request [%s] already has a pending [%s] approval", instance.requestId(), kind);
        } catch (PersistenceUnavailableException e) {
            logger.atSevere().withCause(e).log(
                    "Could not open [%s] approval for request [%s], it will be re-opened by the next sweep",
                    kind, instance.requestId());
        }
    }

    private void withdrawPending(String requestId, String reason) {
        try {
            approvals.withdrawPending(requestId, reason);
        } catch (PersistenceUnavailableException e) {
            logger.atSevere().withCause(e).log("Could not withdraw pending approvals of request [%s]", requestId);
        }
    }

    private static Map<String, Serializable> gatePayload(WorkflowInstance next, WorkflowEvent event) {
        if (event != null && (event.type() == EventType.AGENT_SUCCEEDED
                || event.type() == EventType.SCOPE_CHANGE_REQUESTED)) {
            return event.payload();
        }
        return next.context().asMap();
    }

    private String submittedBy(WorkflowInstance previous) {
        if (previous == null) {
            return ORCHESTRATOR;
        }
        return engine.requiresAgent(previous.state())
                .map(AgentTask::agentId)
                .orElse(ORCHESTRATOR);
    }

    private WorkflowInstance requireLive(String requestId, EventType event) {
        Optional<WorkflowInstance> current = live.get(requestId);
        if (current.isPresent()) {
            return current.get();
        }
        WorkflowInstance stored = store.findInstance(requestId)
                .orElseThrow(() -> new UnknownRequestException(requestId));
        throw new InvalidTransitionException(requestId, stored.state(), event, "request is no longer active");
    }

    private String newRequestId() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        return "REQ-%s-%s".formatted(REQUEST_DATE.format(clock.instant()), suffix);
    }

    private static void checkNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException("%s must not be null".formatted(name));
        }
    }

    public LiveInstances liveInstances() {
        return live;
    }
}
