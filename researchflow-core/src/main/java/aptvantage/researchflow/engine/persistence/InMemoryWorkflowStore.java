package aptvantage.researchflow.engine.persistence;

import aptvantage.researchflow.model.ApprovalKind;
import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.EscalationRecord;
import aptvantage.researchflow.model.ExecutionRecord;
import aptvantage.researchflow.model.WorkflowInstance;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Heap-backed store for tests and single-process embedding. State is lost when the process exits.
 */
public class InMemoryWorkflowStore implements WorkflowStore {

    private final Map<String, WorkflowInstance> instances = new LinkedHashMap<>();
    private final List<ExecutionRecord> executions = new ArrayList<>();
    private final Map<String, ApprovalRecord> approvals = new LinkedHashMap<>();
    private final Map<String, EscalationRecord> escalations = new LinkedHashMap<>();

    @Override
    public synchronized void createInstance(WorkflowInstance instance) {
        if (instances.containsKey(instance.requestId())) {
            throw new IllegalStateException("Request [%s] already exists".formatted(instance.requestId()));
        }
        instances.put(instance.requestId(), instance);
    }

    @Override
    public synchronized void appendTransition(WorkflowInstance next, int expectedVersion) {
        WorkflowInstance stored = instances.get(next.requestId());
        if (stored == null || stored.version() != expectedVersion || next.version() != expectedVersion + 1) {
            throw new StaleInstanceException(next.requestId(), expectedVersion);
        }
        instances.put(next.requestId(), next);
    }

    @Override
    public synchronized Optional<WorkflowInstance> findInstance(String requestId) {
        return Optional.ofNullable(instances.get(requestId));
    }

    @Override
    public synchronized List<WorkflowInstance> findActiveInstances() {
        return instances.values().stream()
                .filter(instance -> !instance.isTerminal())
                .toList();
    }

    @Override
    public synchronized void appendExecution(ExecutionRecord execution) {
        executions.add(execution);
    }

    @Override
    public synchronized List<ExecutionRecord> findExecutions(String requestId) {
        return executions.stream()
                .filter(execution -> execution.requestId().equals(requestId))
                .toList();
    }

    @Override
    public synchronized void insertApproval(ApprovalRecord approval) {
        if (findPendingApproval(approval.requestId(), approval.kind()).isPresent()) {
            throw new DuplicateApprovalException(approval.requestId(), approval.kind());
        }
        approvals.put(approval.approvalId(), approval);
    }

    @Override
    public synchronized boolean resolveApproval(ApprovalRecord resolved) {
        ApprovalRecord stored = approvals.get(resolved.approvalId());
        if (stored == null || !stored.isPending()) {
            return false;
        }
        approvals.put(resolved.approvalId(), resolved);
        return true;
    }

    @Override
    public synchronized Optional<ApprovalRecord> findApproval(String approvalId) {
        return Optional.ofNullable(approvals.get(approvalId));
    }

    @Override
    public synchronized Optional<ApprovalRecord> findPendingApproval(String requestId, ApprovalKind kind) {
        return approvals.values().stream()
                .filter(approval -> approval.requestId().equals(requestId))
                .filter(approval -> approval.kind() == kind)
                .filter(ApprovalRecord::isPending)
                .findFirst();
    }

    @Override
    public synchronized Optional<ApprovalRecord> findLatestApproval(String requestId, ApprovalKind kind) {
        ApprovalRecord latest = null;
        for (ApprovalRecord approval : approvals.values()) {
            if (approval.requestId().equals(requestId) && approval.kind() == kind) {
                latest = approval;
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public synchronized List<ApprovalRecord> findPendingApprovals(ApprovalKind kind) {
        List<ApprovalRecord> pending = new ArrayList<>();
        for (ApprovalRecord approval : approvals.values()) {
            if (approval.isPending() && (kind == null || approval.kind() == kind)) {
                pending.add(0, approval);
            }
        }
        pending.sort(Comparator.comparing(ApprovalRecord::submittedAt).reversed());
        return pending;
    }

    @Override
    public synchronized List<ApprovalRecord> findOverdueApprovals(Instant now) {
        return approvals.values().stream()
                .filter(approval -> approval.isOverdue(now))
                .toList();
    }

    @Override
    public synchronized List<ApprovalRecord> findApprovals(String requestId) {
        return approvals.values().stream()
                .filter(approval -> approval.requestId().equals(requestId))
                .toList();
    }

    @Override
    public synchronized void insertEscalation(EscalationRecord escalation) {
        escalations.put(escalation.escalationId(), escalation);
    }

    @Override
    public synchronized boolean resolveEscalation(EscalationRecord resolved) {
        EscalationRecord stored = escalations.get(resolved.escalationId());
        if (stored == null || !stored.isOpen()) {
            return false;
        }
        escalations.put(resolved.escalationId(), resolved);
        return true;
    }

    @Override
    public synchronized Optional<EscalationRecord> findEscalation(String escalationId) {
        return Optional.ofNullable(escalations.get(escalationId));
    }

    @Override
    public synchronized List<EscalationRecord> findOpenEscalations() {
        return escalations.values().stream()
                .filter(EscalationRecord::isOpen)
                .toList();
    }

    @Override
    public synchronized List<EscalationRecord> findEscalations(String requestId) {
        return escalations.values().stream()
                .filter(escalation -> escalation.requestId().equals(requestId))
                .toList();
    }
}
