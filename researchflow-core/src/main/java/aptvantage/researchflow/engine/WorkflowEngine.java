package aptvantage.researchflow.engine;

import aptvantage.researchflow.api.ApprovalPolicies;
import aptvantage.researchflow.model.AgentTask;
import aptvantage.researchflow.model.ApprovalKind;
import aptvantage.researchflow.model.EventType;
import aptvantage.researchflow.model.HistoryEntry;
import aptvantage.researchflow.model.WorkflowContext;
import aptvantage.researchflow.model.WorkflowEvent;
import aptvantage.researchflow.model.WorkflowInstance;
import aptvantage.researchflow.model.WorkflowState;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The request lifecycle state machine. {@link #advance} is a pure function of the instance, the event and the
 * transition table; the engine never performs side effects such as running agents or opening approvals.
 */
public class WorkflowEngine {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    public static final WorkflowState INITIAL_STATE = WorkflowState.REQUIREMENTS_GATHERING;

    private final TransitionTable table;
    private final Clock clock;

    public WorkflowEngine(ApprovalPolicies policies, Clock clock) {
        this.table = new TransitionTable(policies);
        this.clock = clock;
    }

    public WorkflowInstance start(String requestId, WorkflowContext context) {
        return WorkflowInstance.submitted(requestId, INITIAL_STATE, context, clock.instant());
    }

    public WorkflowInstance advance(WorkflowInstance instance, WorkflowEvent event) {
        WorkflowState from = instance.state();
        if (from.isTerminal()) {
            throw new InvalidTransitionException(instance.requestId(), from, event.type(), "state is terminal");
        }
        TransitionTable.Transition transition = table.find(from, event.type())
                .orElseThrow(() -> new InvalidTransitionException(instance.requestId(), from, event.type()));
        if (event.type().isApprovalEvent()) {
            ApprovalKind gateKind = requiresApproval(from).orElse(null);
            if (event.approvalKind() != gateKind) {
                throw new InvalidTransitionException(instance.requestId(), from, event.type(),
                        "approval kind [%s] does not match gate [%s]".formatted(event.approvalKind(), gateKind));
            }
        }

        WorkflowState target = target(instance, transition, event);
        WorkflowState resumeState = entersSideBranch(target) ? from : null;
        WorkflowContext snapshot = event.type() == EventType.SCOPE_CHANGE_REQUESTED ? instance.context() : null;
        WorkflowContext context = switch (event.type()) {
            case AGENT_SUCCEEDED, APPROVAL_MODIFIED -> instance.context().merge(event.payload());
            case SCOPE_CHANGE_RESOLVED -> {
                WorkflowContext original = instance.scopeSnapshot() == null
                        ? instance.context()
                        : instance.scopeSnapshot();
                yield event.accepted() ? original.merge(event.payload()) : original;
            }
            case SUBMITTED, AGENT_FAILED_TERMINALLY, APPROVAL_APPROVED, APPROVAL_REJECTED, APPROVAL_TIMED_OUT,
                 SCOPE_CHANGE_REQUESTED, CANCEL_REQUESTED, ESCALATION_RETRY, ESCALATION_FORCE_FAIL,
                 ESCALATION_FORCE_COMPLETE -> instance.context();
        };

        List<HistoryEntry> history = ImmutableList.<HistoryEntry>builder()
                .addAll(instance.history())
                .add(new HistoryEntry(target, event.type(), clock.instant(), event.detail()))
                .build();
        return new WorkflowInstance(instance.requestId(), history, context, resumeState, snapshot,
                instance.createdAt());
    }

    private WorkflowState target(WorkflowInstance instance, TransitionTable.Transition transition,
                                 WorkflowEvent event) {
        if (transition.resumes()) {
            if (instance.resumeState() == null) {
                throw new InvalidTransitionException(instance.requestId(), instance.state(), event.type(),
                        "no state to resume");
            }
            return instance.resumeState();
        }
        if (event.routingHint() != null) {
            Optional<WorkflowState> routed = stateFor(event.routingHint())
                    .filter(state -> transition.alternatives().contains(state));
            if (routed.isPresent()) {
                logger.atInfo().log("Request [%s] routed to [%s] by agent hint [%s]",
                        instance.requestId(), routed.get(), event.routingHint());
                return routed.get();
            }
            logger.atWarning().log("Ignoring routing hint [%s] for request [%s] in state [%s]",
                    event.routingHint(), instance.requestId(), instance.state());
        }
        return transition.target();
    }

    private static boolean entersSideBranch(WorkflowState target) {
        return target == WorkflowState.HUMAN_REVIEW || target == WorkflowState.SCOPE_CHANGE_REVIEW;
    }

    public Optional<AgentTask> requiresAgent(WorkflowState state) {
        AgentTask task = switch (state) {
            case REQUIREMENTS_GATHERING -> AgentTask.GATHER_REQUIREMENTS;
            case FEASIBILITY_VALIDATION -> AgentTask.VALIDATE_FEASIBILITY;
            case SCHEDULE_KICKOFF -> AgentTask.SCHEDULE_KICKOFF_MEETING;
            case DATA_EXTRACTION -> AgentTask.EXTRACT_DATA;
            case QA_VALIDATION -> AgentTask.VALIDATE_EXTRACTED_DATA;
            case DATA_DELIVERY -> AgentTask.DELIVER_DATA;
            case REQUIREMENTS_REVIEW, PHENOTYPE_REVIEW, EXTRACTION_APPROVAL, QA_REVIEW, SCOPE_CHANGE_REVIEW,
                 HUMAN_REVIEW, COMPLETED, REJECTED, FAILED, CANCELLED -> null;
        };
        return Optional.ofNullable(task);
    }

    public Optional<ApprovalKind> requiresApproval(WorkflowState state) {
        ApprovalKind kind = switch (state) {
            case REQUIREMENTS_REVIEW -> ApprovalKind.REQUIREMENTS_REVIEW;
            case PHENOTYPE_REVIEW -> ApprovalKind.CRITICAL_QUERY_REVIEW;
            case EXTRACTION_APPROVAL -> ApprovalKind.ACCESS_AUTHORIZATION;
            case QA_REVIEW -> ApprovalKind.QUALITY_REVIEW;
            case SCOPE_CHANGE_REVIEW -> ApprovalKind.SCOPE_CHANGE;
            case REQUIREMENTS_GATHERING, FEASIBILITY_VALIDATION, SCHEDULE_KICKOFF, DATA_EXTRACTION, QA_VALIDATION,
                 DATA_DELIVERY, HUMAN_REVIEW, COMPLETED, REJECTED, FAILED, CANCELLED -> null;
        };
        return Optional.ofNullable(kind);
    }

    public Optional<WorkflowState> stateFor(AgentTask task) {
        return Arrays.stream(WorkflowState.values())
                .filter(state -> requiresAgent(state).filter(task::equals).isPresent())
                .findFirst();
    }

    /**
     * Fold a history from its first entry, checking every step against the transition table.
     *
     * @throws IllegalStateException if the history is not a valid path through the table
     */
    public WorkflowState replay(List<HistoryEntry> history) {
        if (history.isEmpty()) {
            throw new IllegalStateException("Cannot replay an empty history");
        }
        HistoryEntry first = history.get(0);
        if (first.event() != EventType.SUBMITTED || first.state() != INITIAL_STATE) {
            throw new IllegalStateException("History must start with [%s] in [%s] but started with [%s] in [%s]"
                    .formatted(EventType.SUBMITTED, INITIAL_STATE, first.event(), first.state()));
        }
        WorkflowState current = first.state();
        WorkflowState resumeState = null;
        for (int i = 1; i < history.size(); i++) {
            HistoryEntry entry = history.get(i);
            WorkflowState from = current;
            TransitionTable.Transition transition = table.find(from, entry.event())
                    .orElseThrow(() -> new IllegalStateException("Event [%s] is not permitted in state [%s]"
                            .formatted(entry.event(), from)));
            boolean permitted = transition.resumes()
                    ? entry.state() == resumeState
                    : transition.permits(entry.state());
            if (!permitted) {
                throw new IllegalStateException("[%s] does not lead from [%s] to [%s]"
                        .formatted(entry.event(), from, entry.state()));
            }
            resumeState = entersSideBranch(entry.state()) ? from : null;
            current = entry.state();
        }
        return current;
    }

    public TransitionTable table() {
        return table;
    }
}
