package aptvantage.researchflow.engine;

import aptvantage.researchflow.api.ApprovalPolicies;
import aptvantage.researchflow.engine.persistence.InMemoryWorkflowStore;
import aptvantage.researchflow.engine.persistence.PersistenceException;
import aptvantage.researchflow.engine.persistence.WorkflowStore;
import aptvantage.researchflow.model.ApprovalDecision;
import aptvantage.researchflow.model.ApprovalKind;
import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.ApprovalStatus;
import aptvantage.researchflow.model.EventType;
import aptvantage.researchflow.model.HistoryEntry;
import aptvantage.researchflow.model.WorkflowContext;
import aptvantage.researchflow.model.WorkflowInstance;
import aptvantage.researchflow.model.WorkflowState;
import aptvantage.researchflow.support.MutableClock;
import aptvantage.researchflow.support.OrchestratorFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import org.mockito.Mockito;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;

/**
 * Each test runs a request partway on one orchestrator, then starts a second orchestrator over the same store as
 * a process restart would.
 */
@Execution(ExecutionMode.CONCURRENT)
class OrchestratorRecoveryTest {

    private final WorkflowStore store = Mockito.spy(new InMemoryWorkflowStore());
    private final OrchestratorFixture before = new OrchestratorFixture(store, ApprovalPolicies.defaults(),
            new MutableClock(OrchestratorFixture.START));

    private OrchestratorFixture restart() {
        OrchestratorFixture after = new OrchestratorFixture(store, before.policies, before.clock);
        after.orchestrator.recover();
        return after;
    }

    @Test
    public void workStateIsDispatchedAgain() {
        // given a request submitted but never dispatched before the restart
        String requestId = before.orchestrator.submit(Map.of("question", "asthma admissions"));

        // when a new orchestrator recovers
        OrchestratorFixture after = restart();
        after.drive();

        // then the work is picked up
        assertEquals(WorkflowState.REQUIREMENTS_REVIEW, after.state(requestId));
        assertEquals(1, after.counter.get("requirements_agent"));
        assertEquals(0, before.counter.get("requirements_agent"));
    }

    @Test
    public void pendingGateIsLeftAlone() {
        // given a request waiting for review
        String requestId = before.orchestrator.submit(Map.of());
        before.drive();
        ApprovalRecord review = before.pendingApproval(requestId, ApprovalKind.REQUIREMENTS_REVIEW);

        // when a new orchestrator recovers
        OrchestratorFixture after = restart();

        // then the same approval is still the only one and it can be resolved
        assertEquals(1, after.orchestrator.approvals(requestId).size());
        after.orchestrator.resolveApproval(review.approvalId(), ApprovalDecision.APPROVE, "reviewer", null, null);
        assertEquals(WorkflowState.FEASIBILITY_VALIDATION, after.state(requestId));
    }

    @Test
    public void missingGateRecordIsReopened() {
        // given a request that entered review while approvals could not be written
        doThrow(new PersistenceException("connection refused", null)).when(store).insertApproval(any());
        String requestId = before.orchestrator.submit(Map.of());
        before.drive();
        assertEquals(WorkflowState.REQUIREMENTS_REVIEW, before.state(requestId));
        assertTrue(store.findApprovals(requestId).isEmpty());

        // when the store is back and a new orchestrator recovers
        doCallRealMethod().when(store).insertApproval(any());
        OrchestratorFixture after = restart();

        // then the gate has a pending approval again
        ApprovalRecord reopened = after.pendingApproval(requestId, ApprovalKind.REQUIREMENTS_REVIEW);
        assertEquals("orchestrator", reopened.submittedBy());
    }

    @Test
    public void resolvedButUnappliedDecisionIsApplied() {
        // given a review decision that was recorded but never applied
        String requestId = before.orchestrator.submit(Map.of());
        before.drive();
        ApprovalRecord review = before.pendingApproval(requestId, ApprovalKind.REQUIREMENTS_REVIEW);
        store.resolveApproval(review.resolve(ApprovalStatus.APPROVED, "reviewer", "fine", null,
                before.clock.instant()));

        // when a new orchestrator recovers
        OrchestratorFixture after = restart();

        // then the decision takes effect and the workflow continues
        assertEquals(WorkflowState.FEASIBILITY_VALIDATION, after.state(requestId));
        after.drive();
        assertEquals(WorkflowState.PHENOTYPE_REVIEW, after.state(requestId));
        assertEquals(2, after.orchestrator.approvals(requestId).size());
    }

    @Test
    public void terminalAndCorruptRequestsAreNotRecovered() {
        // given a cancelled request
        String cancelled = before.orchestrator.submit(Map.of());
        before.orchestrator.cancel(cancelled, "duplicate");

        // and a request whose history does not start with a submission
        store.createInstance(new WorkflowInstance(
                "REQ-20240301-BADBAD00",
                List.of(new HistoryEntry(WorkflowState.DATA_EXTRACTION, EventType.AGENT_SUCCEEDED,
                        OrchestratorFixture.START, null)),
                WorkflowContext.empty(),
                null,
                null,
                OrchestratorFixture.START));

        // and one live request
        String active = before.orchestrator.submit(Map.of());

        // when a new orchestrator recovers
        OrchestratorFixture after = new OrchestratorFixture(store, before.policies, before.clock);
        int recovered = after.orchestrator.recover();

        // then only the live request came back
        assertEquals(1, recovered);
        assertTrue(after.live.contains(active));
        assertFalse(after.live.contains(cancelled));
        assertFalse(after.live.contains("REQ-20240301-BADBAD00"));
    }
}
