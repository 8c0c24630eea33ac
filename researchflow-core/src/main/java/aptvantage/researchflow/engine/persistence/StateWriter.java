package aptvantage.researchflow.engine.persistence;

import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.EscalationRecord;
import aptvantage.researchflow.model.ExecutionRecord;
import aptvantage.researchflow.model.HistoryEntry;
import aptvantage.researchflow.model.WorkflowInstance;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import static aptvantage.researchflow.engine.persistence.EnumColumnMapper.name;
import static aptvantage.researchflow.engine.persistence.SerializableColumnMapper.serialize;
import static aptvantage.researchflow.engine.persistence.SerializableColumnMapper.serializeMap;

public class StateWriter {

    private final Jdbi jdbi;

    public StateWriter(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    private static void insertHistoryEntry(Handle handle, String requestId, int sequence, HistoryEntry entry) {
        handle.createUpdate("""
                        INSERT INTO workflow_history (request_id, seq, state, event, timestamp, detail)
                        VALUES (:requestId, :seq, :state, :event, :timestamp, :detail)
                        """)
                .bind("requestId", requestId)
                .bind("seq", sequence)
                .bind("state", name(entry.state()))
                .bind("event", name(entry.event()))
                .bind("timestamp", entry.timestamp())
                .bind("detail", entry.detail())
                .execute();
    }

    public void createInstance(WorkflowInstance instance) {
        jdbi.useTransaction(handle -> {
            handle.createUpdate("""
                            INSERT INTO workflow_instance (request_id, state, context, resume_state, scope_snapshot,
                                                           version, created_at, updated_at)
                            VALUES (:requestId, :state, :context, :resumeState, :scopeSnapshot,
                                    :version, :createdAt, :updatedAt)
                            """)
                    .bind("requestId", instance.requestId())
                    .bind("state", name(instance.state()))
                    .bind("context", serialize(instance.context()))
                    .bind("resumeState", name(instance.resumeState()))
                    .bind("scopeSnapshot", serialize(instance.scopeSnapshot()))
                    .bind("version", instance.version())
                    .bind("createdAt", instance.createdAt())
                    .bind("updatedAt", instance.updatedAt())
                    .execute();
            for (int i = 0; i < instance.history().size(); i++) {
                insertHistoryEntry(handle, instance.requestId(), i + 1, instance.history().get(i));
            }
        });
    }

    public void appendTransition(WorkflowInstance next, int expectedVersion) {
        jdbi.useTransaction(handle -> {
            int updated = handle.createUpdate("""
                            UPDATE workflow_instance
                            SET state = :state,
                                context = :context,
                                resume_state = :resumeState,
                                scope_snapshot = :scopeSnapshot,
                                version = :version,
                                updated_at = :updatedAt
                            WHERE request_id = :requestId AND version = :expectedVersion
                            """)
                    .bind("requestId", next.requestId())
                    .bind("state", name(next.state()))
                    .bind("context", serialize(next.context()))
                    .bind("resumeState", name(next.resumeState()))
                    .bind("scopeSnapshot", serialize(next.scopeSnapshot()))
                    .bind("version", next.version())
                    .bind("updatedAt", next.updatedAt())
                    .bind("expectedVersion", expectedVersion)
                    .execute();
            if (updated != 1 || next.version() != expectedVersion + 1) {
                throw new StaleInstanceException(next.requestId(), expectedVersion);
            }
            insertHistoryEntry(handle, next.requestId(), next.version(),
                    next.history().get(next.history().size() - 1));
        });
    }

    public void appendExecution(ExecutionRecord execution) {
        jdbi.useHandle(handle ->
                handle.createUpdate("""
                                INSERT INTO agent_execution (request_id, agent_id, task, dispatch_id, attempt,
                                                             started_at, finished_at, outcome, result, error)
                                VALUES (:requestId, :agentId, :task, :dispatchId, :attempt,
                                        :startedAt, :finishedAt, :outcome, :result, :error)
                                """)
                        .bind("requestId", execution.requestId())
                        .bind("agentId", execution.agentId())
                        .bind("task", execution.task())
                        .bind("dispatchId", execution.dispatchId())
                        .bind("attempt", execution.attempt())
                        .bind("startedAt", execution.startedAt())
                        .bind("finishedAt", execution.finishedAt())
                        .bind("outcome", name(execution.outcome()))
                        .bind("result", serializeMap(execution.result()))
                        .bind("error", execution.error())
                        .execute());
    }

    public void insertApproval(ApprovalRecord approval) {
        jdbi.useHandle(handle ->
                handle.createUpdate("""
                                INSERT INTO approval (approval_id, request_id, kind, submitted_by, payload, status,
                                                      submitted_at, timeout_at)
                                VALUES (:approvalId, :requestId, :kind, :submittedBy, :payload, :status,
                                        :submittedAt, :timeoutAt)
                                """)
                        .bind("approvalId", approval.approvalId())
                        .bind("requestId", approval.requestId())
                        .bind("kind", name(approval.kind()))
                        .bind("submittedBy", approval.submittedBy())
                        .bind("payload", serializeMap(approval.payload()))
                        .bind("status", name(approval.status()))
                        .bind("submittedAt", approval.submittedAt())
                        .bind("timeoutAt", approval.timeoutAt())
                        .execute());
    }

    public boolean resolveApproval(ApprovalRecord resolved) {
        return jdbi.withHandle(handle ->
                handle.createUpdate("""
                                UPDATE approval
                                SET status = :status,
                                    reviewer = :reviewer,
                                    notes = :notes,
                                    modifications = :modifications,
                                    resolved_at = :resolvedAt
                                WHERE approval_id = :approvalId AND status = 'PENDING'
                                """)
                        .bind("approvalId", resolved.approvalId())
                        .bind("status", name(resolved.status()))
                        .bind("reviewer", resolved.reviewer())
                        .bind("notes", resolved.notes())
                        .bind("modifications", serializeMap(resolved.modifications()))
                        .bind("resolvedAt", resolved.resolvedAt())
                        .execute()) == 1;
    }

    public void insertEscalation(EscalationRecord escalation) {
        jdbi.useHandle(handle ->
                handle.createUpdate("""
                                INSERT INTO escalation (escalation_id, request_id, cause, severity, detail,
                                                        recommended_action, created_at)
                                VALUES (:escalationId, :requestId, :cause, :severity, :detail,
                                        :recommendedAction, :createdAt)
                                """)
                        .bind("escalationId", escalation.escalationId())
                        .bind("requestId", escalation.requestId())
                        .bind("cause", name(escalation.cause()))
                        .bind("severity", name(escalation.severity()))
                        .bind("detail", escalation.detail())
                        .bind("recommendedAction", escalation.recommendedAction())
                        .bind("createdAt", escalation.createdAt())
                        .execute());
    }

    public boolean resolveEscalation(EscalationRecord resolved) {
        return jdbi.withHandle(handle ->
                handle.createUpdate("""
                                UPDATE escalation
                                SET resolved_at = :resolvedAt,
                                    action = :action,
                                    resolved_by = :resolvedBy
                                WHERE escalation_id = :escalationId AND resolved_at IS NULL
                                """)
                        .bind("escalationId", resolved.escalationId())
                        .bind("resolvedAt", resolved.resolvedAt())
                        .bind("action", name(resolved.action()))
                        .bind("resolvedBy", resolved.resolvedBy())
                        .execute()) == 1;
    }
}
