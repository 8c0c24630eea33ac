package aptvantage.researchflow.engine.persistence;

import aptvantage.researchflow.model.ApprovalKind;
import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.EscalationRecord;
import aptvantage.researchflow.model.ExecutionRecord;
import aptvantage.researchflow.model.WorkflowInstance;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PostgreSQL backed {@link WorkflowStore}. The schema is created by the Flyway migrations on the classpath.
 */
public class JdbiWorkflowStore implements WorkflowStore {

    private static final String UNIQUE_VIOLATION = "23505";

    private final StateReader stateReader;
    private final StateWriter stateWriter;

    public JdbiWorkflowStore(StateReader stateReader, StateWriter stateWriter) {
        this.stateReader = stateReader;
        this.stateWriter = stateWriter;
    }

    private static <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (JdbiException e) {
            throw new PersistenceException("Failed to %s".formatted(operation), e);
        }
    }

    private static void translate(String operation, Runnable call) {
        translate(operation, () -> {
            call.run();
            return null;
        });
    }

    @Override
    public void createInstance(WorkflowInstance instance) {
        translate("create instance", () -> stateWriter.createInstance(instance));
    }

    @Override
    public void appendTransition(WorkflowInstance next, int expectedVersion) {
        translate("append transition", () -> stateWriter.appendTransition(next, expectedVersion));
    }

    @Override
    public Optional<WorkflowInstance> findInstance(String requestId) {
        return translate("find instance", () -> stateReader.findInstance(requestId));
    }

    @Override
    public List<WorkflowInstance> findActiveInstances() {
        return translate("find active instances", stateReader::findActiveInstances);
    }

    @Override
    public void appendExecution(ExecutionRecord execution) {
        translate("append execution", () -> stateWriter.appendExecution(execution));
    }

    @Override
    public List<ExecutionRecord> findExecutions(String requestId) {
        return translate("find executions", () -> stateReader.findExecutions(requestId));
    }

    @Override
    public void insertApproval(ApprovalRecord approval) {
        try {
            stateWriter.insertApproval(approval);
        } catch (UnableToExecuteStatementException e) {
            if (e.getCause() instanceof SQLException sqlException
                    && UNIQUE_VIOLATION.equals(sqlException.getSQLState())) {
                throw new DuplicateApprovalException(approval.requestId(), approval.kind());
            }
            throw new PersistenceException("Failed to insert approval", e);
        } catch (JdbiException e) {
            throw new PersistenceException("Failed to insert approval", e);
        }
    }

    @Override
    public boolean resolveApproval(ApprovalRecord resolved) {
        return translate("resolve approval", () -> stateWriter.resolveApproval(resolved));
    }

    @Override
    public Optional<ApprovalRecord> findApproval(String approvalId) {
        return translate("find approval", () -> stateReader.findApproval(approvalId));
    }

    @Override
    public Optional<ApprovalRecord> findPendingApproval(String requestId, ApprovalKind kind) {
        return translate("find pending approval", () -> stateReader.findPendingApproval(requestId, kind));
    }

    @Override
    public Optional<ApprovalRecord> findLatestApproval(String requestId, ApprovalKind kind) {
        return translate("find latest approval", () -> stateReader.findLatestApproval(requestId, kind));
    }

    @Override
    public List<ApprovalRecord> findPendingApprovals(ApprovalKind kind) {
        return translate("find pending approvals", () -> stateReader.findPendingApprovals(kind));
    }

    @Override
    public List<ApprovalRecord> findOverdueApprovals(Instant now) {
        return translate("find overdue approvals", () -> stateReader.findOverdueApprovals(now));
    }

    @Override
    public List<ApprovalRecord> findApprovals(String requestId) {
        return translate("find approvals", () -> stateReader.findApprovals(requestId));
    }

    @Override
    public void insertEscalation(EscalationRecord escalation) {
        translate("insert escalation", () -> stateWriter.insertEscalation(escalation));
    }

    @Override
    public boolean resolveEscalation(EscalationRecord resolved) {
        return translate("resolve escalation", () -> stateWriter.resolveEscalation(resolved));
    }

    @Override
    public Optional<EscalationRecord> findEscalation(String escalationId) {
        return translate("find escalation", () -> stateReader.findEscalation(escalationId));
    }

    @Override
    public List<EscalationRecord> findOpenEscalations() {
        return translate("find open escalations", stateReader::findOpenEscalations);
    }

    @Override
    public List<EscalationRecord> findEscalations(String requestId) {
        return translate("find escalations", () -> stateReader.findEscalations(requestId));
    }
}
