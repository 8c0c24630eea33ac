package aptvantage.researchflow.engine.persistence;

import aptvantage.researchflow.model.ApprovalKind;
import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.EscalationRecord;
import aptvantage.researchflow.model.ExecutionRecord;
import aptvantage.researchflow.model.WorkflowInstance;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of everything the orchestrator does. All writes are appends or compare-and-set status changes;
 * nothing is ever deleted. Implementations throw {@link PersistenceException} for infrastructure failures.
 */
public interface WorkflowStore {

    void createInstance(WorkflowInstance instance);

    /**
     * Persist the newest history entry of {@code next} together with its context, provided the stored instance is
     * still at {@code expectedVersion}.
     *
     * @throws StaleInstanceException if another writer got there first
     */
    void appendTransition(WorkflowInstance next, int expectedVersion);

    Optional<WorkflowInstance> findInstance(String requestId);

    List<WorkflowInstance> findActiveInstances();

    void appendExecution(ExecutionRecord execution);

    List<ExecutionRecord> findExecutions(String requestId);

    /**
     * @throws DuplicateApprovalException if a pending record of the same kind exists for the request
     */
    void insertApproval(ApprovalRecord approval);

    /**
     * Replace a pending approval with its resolved form.
     *
     * @return false if the record was no longer pending
     */
    boolean resolveApproval(ApprovalRecord resolved);

    Optional<ApprovalRecord> findApproval(String approvalId);

    Optional<ApprovalRecord> findPendingApproval(String requestId, ApprovalKind kind);

    Optional<ApprovalRecord> findLatestApproval(String requestId, ApprovalKind kind);

    /**
     * Pending approvals, newest first, optionally restricted to one kind.
     */
    List<ApprovalRecord> findPendingApprovals(ApprovalKind kind);

    List<ApprovalRecord> findOverdueApprovals(Instant now);

    List<ApprovalRecord> findApprovals(String requestId);

    void insertEscalation(EscalationRecord escalation);

    /**
     * @return false if the escalation was already resolved
     */
    boolean resolveEscalation(EscalationRecord resolved);

    Optional<EscalationRecord> findEscalation(String escalationId);

    List<EscalationRecord> findOpenEscalations();

    List<EscalationRecord> findEscalations(String requestId);
}
