package aptvantage.researchflow.engine;

import aptvantage.researchflow.api.ApprovalPolicies;
import aptvantage.researchflow.model.ApprovalKind;
import aptvantage.researchflow.model.EventType;
import aptvantage.researchflow.model.WorkflowState;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static aptvantage.researchflow.model.WorkflowState.*;

/**
 * The fixed set of permitted (state, event) pairs. Timeout routing is the only part that depends on
 * configuration; replay accepts either timeout target so histories stay valid when the policy changes.
 */
public final class TransitionTable {

    /**
     * @param target       the default next state, or null when the transition returns to the resume state
     * @param alternatives other states the transition may lead to
     */
    public record Transition(
            WorkflowState from,
            EventType event,
            WorkflowState target,
            Set<WorkflowState> alternatives,
            boolean resumes
    ) {

        public boolean permits(WorkflowState to) {
            return to == target || alternatives.contains(to);
        }
    }

    private final Map<WorkflowState, Map<EventType, Transition>> transitions = new EnumMap<>(WorkflowState.class);

    TransitionTable(ApprovalPolicies policies) {
        agentSucceeded(REQUIREMENTS_GATHERING, REQUIREMENTS_REVIEW);
        agentSucceeded(FEASIBILITY_VALIDATION, PHENOTYPE_REVIEW, REQUIREMENTS_GATHERING);
        agentSucceeded(SCHEDULE_KICKOFF, EXTRACTION_APPROVAL);
        agentSucceeded(DATA_EXTRACTION, QA_VALIDATION);
        agentSucceeded(QA_VALIDATION, QA_REVIEW, DATA_EXTRACTION);
        agentSucceeded(DATA_DELIVERY, COMPLETED);

        gate(REQUIREMENTS_REVIEW, ApprovalKind.REQUIREMENTS_REVIEW, FEASIBILITY_VALIDATION, REQUIREMENTS_GATHERING,
                policies);
        gate(PHENOTYPE_REVIEW, ApprovalKind.CRITICAL_QUERY_REVIEW, SCHEDULE_KICKOFF, REJECTED, policies);
        gate(EXTRACTION_APPROVAL, ApprovalKind.ACCESS_AUTHORIZATION, DATA_EXTRACTION, REJECTED, policies);
        gate(QA_REVIEW, ApprovalKind.QUALITY_REVIEW, DATA_DELIVERY, DATA_EXTRACTION, policies);

        for (WorkflowState state : WorkflowState.values()) {
            if (state.isTerminal()) {
                continue;
            }
            if (state.isWork()) {
                add(new Transition(state, EventType.AGENT_FAILED_TERMINALLY, HUMAN_REVIEW, Set.of(), false));
            }
            if (state != SCOPE_CHANGE_REVIEW && state != HUMAN_REVIEW) {
                add(new Transition(state, EventType.SCOPE_CHANGE_REQUESTED, SCOPE_CHANGE_REVIEW, Set.of(), false));
            }
            add(new Transition(state, EventType.CANCEL_REQUESTED, CANCELLED, Set.of(), false));
        }

        add(new Transition(SCOPE_CHANGE_REVIEW, EventType.SCOPE_CHANGE_RESOLVED, null, Set.of(), true));
        add(new Transition(HUMAN_REVIEW, EventType.ESCALATION_RETRY, null, Set.of(), true));
        add(new Transition(HUMAN_REVIEW, EventType.ESCALATION_FORCE_FAIL, FAILED, Set.of(), false));
        add(new Transition(HUMAN_REVIEW, EventType.ESCALATION_FORCE_COMPLETE, COMPLETED, Set.of(), false));
    }

    private void agentSucceeded(WorkflowState from, WorkflowState target, WorkflowState... alternatives) {
        add(new Transition(from, EventType.AGENT_SUCCEEDED, target, Set.of(alternatives), false));
    }

    private void gate(WorkflowState gate, ApprovalKind kind, WorkflowState onApproval, WorkflowState onRejection,
                      ApprovalPolicies policies) {
        add(new Transition(gate, EventType.APPROVAL_APPROVED, onApproval, Set.of(), false));
        add(new Transition(gate, EventType.APPROVAL_MODIFIED, onApproval, Set.of(), false));
        add(new Transition(gate, EventType.APPROVAL_REJECTED, onRejection, Set.of(), false));
        WorkflowState onTimeout = switch (policies.onTimeout(kind)) {
            case AUTO_REJECT -> REJECTED;
            case HOLD_FOR_OVERRIDE -> HUMAN_REVIEW;
        };
        WorkflowState otherTimeoutTarget = onTimeout == REJECTED ? HUMAN_REVIEW : REJECTED;
        add(new Transition(gate, EventType.APPROVAL_TIMED_OUT, onTimeout, Set.of(otherTimeoutTarget), false));
    }

    private void add(Transition transition) {
        transitions.computeIfAbsent(transition.from(), state -> new EnumMap<>(EventType.class))
                .put(transition.event(), transition);
    }

    public Optional<Transition> find(WorkflowState from, EventType event) {
        return Optional.ofNullable(transitions.getOrDefault(from, Map.of()).get(event));
    }

    public Collection<Transition> from(WorkflowState state) {
        return List.copyOf(transitions.getOrDefault(state, Map.of()).values());
    }
}
