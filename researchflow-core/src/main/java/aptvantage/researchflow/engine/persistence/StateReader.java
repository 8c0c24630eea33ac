package aptvantage.researchflow.engine.persistence;

import aptvantage.researchflow.model.ApprovalKind;
import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.ApprovalStatus;
import aptvantage.researchflow.model.EscalationAction;
import aptvantage.researchflow.model.EscalationCause;
import aptvantage.researchflow.model.EscalationRecord;
import aptvantage.researchflow.model.EventType;
import aptvantage.researchflow.model.ExecutionOutcome;
import aptvantage.researchflow.model.ExecutionRecord;
import aptvantage.researchflow.model.HistoryEntry;
import aptvantage.researchflow.model.Severity;
import aptvantage.researchflow.model.WorkflowContext;
import aptvantage.researchflow.model.WorkflowInstance;
import aptvantage.researchflow.model.WorkflowState;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static aptvantage.researchflow.engine.persistence.EnumColumnMapper.name;

public class StateReader {

    private static final String APPROVAL_COLUMNS = """
            approval_id, request_id, kind, submitted_by, payload, status, submitted_at, timeout_at,
            reviewer, notes, modifications, resolved_at
            """;

    private static final String ESCALATION_COLUMNS = """
            escalation_id, request_id, cause, severity, detail, recommended_action, created_at,
            resolved_at, action, resolved_by
            """;

    private final EnumColumnMapper<WorkflowState> stateMapper = new EnumColumnMapper<>(WorkflowState.class);
    private final EnumColumnMapper<EventType> eventTypeMapper = new EnumColumnMapper<>(EventType.class);
    private final EnumColumnMapper<ExecutionOutcome> outcomeMapper = new EnumColumnMapper<>(ExecutionOutcome.class);
    private final EnumColumnMapper<ApprovalKind> approvalKindMapper = new EnumColumnMapper<>(ApprovalKind.class);
    private final EnumColumnMapper<ApprovalStatus> approvalStatusMapper = new EnumColumnMapper<>(ApprovalStatus.class);
    private final EnumColumnMapper<EscalationCause> causeMapper = new EnumColumnMapper<>(EscalationCause.class);
    private final EnumColumnMapper<Severity> severityMapper = new EnumColumnMapper<>(Severity.class);
    private final EnumColumnMapper<EscalationAction> actionMapper = new EnumColumnMapper<>(EscalationAction.class);
    private final ColumnMapper<Instant> instantColumnMapper = (rs, column, ctx) -> {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp == null ? null : timestamp.toInstant();
    };
    private final SerializableColumnMapper serializableColumnMapper = new SerializableColumnMapper();

    private final Jdbi jdbi;

    public StateReader(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    public Optional<WorkflowInstance> findInstance(String requestId) {
        return jdbi.withHandle(handle -> findInstance(handle, requestId));
    }

    public List<WorkflowInstance> findActiveInstances() {
        return jdbi.withHandle(handle -> {
            List<String> requestIds = handle.createQuery("""
                            SELECT request_id
                            FROM workflow_instance
                            WHERE state NOT IN ('COMPLETED', 'REJECTED', 'FAILED', 'CANCELLED')
                            ORDER BY created_at
                            """)
                    .mapTo(String.class)
                    .list();
            return requestIds.stream()
                    .map(requestId -> findInstance(handle, requestId).orElseThrow())
                    .toList();
        });
    }

    private Optional<WorkflowInstance> findInstance(Handle handle, String requestId) {
        List<HistoryEntry> history = handle.createQuery("""
                        SELECT state, event, timestamp, detail
                        FROM workflow_history
                        WHERE request_id = :requestId
                        ORDER BY seq
                        """)
                .bind("requestId", requestId)
                .map((rs, ctx) -> new HistoryEntry(
                        stateMapper.map(rs, "state", ctx),
                        eventTypeMapper.map(rs, "event", ctx),
                        instantColumnMapper.map(rs, "timestamp", ctx),
                        rs.getString("detail")))
                .list();

        return handle.createQuery("""
                        SELECT request_id, context, resume_state, scope_snapshot, created_at
                        FROM workflow_instance
                        WHERE request_id = :requestId
                        """)
                .bind("requestId", requestId)
                .map((rs, ctx) -> new WorkflowInstance(
                        rs.getString("request_id"),
                        history,
                        (WorkflowContext) serializableColumnMapper.map(rs, "context", ctx),
                        stateMapper.map(rs, "resume_state", ctx),
                        (WorkflowContext) serializableColumnMapper.map(rs, "scope_snapshot", ctx),
                        instantColumnMapper.map(rs, "created_at", ctx)))
                .findOne();
    }

    public List<ExecutionRecord> findExecutions(String requestId) {
        return jdbi.withHandle(handle ->
                handle.createQuery("""
                                SELECT request_id, agent_id, task, dispatch_id, attempt, started_at, finished_at,
                                       outcome, result, error
                                FROM agent_execution
                                WHERE request_id = :requestId
                                ORDER BY id
                                """)
                        .bind("requestId", requestId)
                        .map((rs, ctx) -> new ExecutionRecord(
                                rs.getString("request_id"),
                                rs.getString("agent_id"),
                                rs.getString("task"),
                                rs.getString("dispatch_id"),
                                rs.getInt("attempt"),
                                instantColumnMapper.map(rs, "started_at", ctx),
                                instantColumnMapper.map(rs, "finished_at", ctx),
                                outcomeMapper.map(rs, "outcome", ctx),
                                serializableColumnMapper.mapOf(rs, "result", ctx),
                                rs.getString("error")))
                        .list());
    }

    public Optional<ApprovalRecord> findApproval(String approvalId) {
        return jdbi.withHandle(handle ->
                handle.createQuery("SELECT " + APPROVAL_COLUMNS + " FROM approval WHERE approval_id = :approvalId")
                        .bind("approvalId", approvalId)
                        .map(this::mapApproval)
                        .findOne());
    }

    public Optional<ApprovalRecord> findPendingApproval(String requestId, ApprovalKind kind) {
        return jdbi.withHandle(handle ->
                handle.createQuery("SELECT " + APPROVAL_COLUMNS + """
                                FROM approval
                                WHERE request_id = :requestId AND kind = :kind AND status = 'PENDING'
                                """)
                        .bind("requestId", requestId)
                        .bind("kind", name(kind))
                        .map(this::mapApproval)
                        .findOne());
    }

    public Optional<ApprovalRecord> findLatestApproval(String requestId, ApprovalKind kind) {
        return jdbi.withHandle(handle ->
                handle.createQuery("SELECT " + APPROVAL_COLUMNS + """
                                FROM approval
                                WHERE request_id = :requestId AND kind = :kind
                                ORDER BY submitted_at DESC, id DESC
                                LIMIT 1
                                """)
                        .bind("requestId", requestId)
                        .bind("kind", name(kind))
                        .map(this::mapApproval)
                        .findOne());
    }

    public List<ApprovalRecord> findPendingApprovals(ApprovalKind kind) {
        return jdbi.withHandle(handle ->
                handle.createQuery("SELECT " + APPROVAL_COLUMNS + """
                                FROM approval
                                WHERE status = 'PENDING' AND (CAST(:kind AS VARCHAR) IS NULL OR kind = :kind)
                                ORDER BY submitted_at DESC, id DESC
                                """)
                        .bind("kind", name(kind))
                        .map(this::mapApproval)
                        .list());
    }

    public List<ApprovalRecord> findOverdueApprovals(Instant now) {
        return jdbi.withHandle(handle ->
                handle.createQuery("SELECT " + APPROVAL_COLUMNS + """
                                FROM approval
                                WHERE status = 'PENDING' AND timeout_at <= :now
                                ORDER BY timeout_at
                                """)
                        .bind("now", now)
                        .map(this::mapApproval)
                        .list());
    }

    public List<ApprovalRecord> findApprovals(String requestId) {
        return jdbi.withHandle(handle ->
                handle.createQuery("SELECT " + APPROVAL_COLUMNS + """
                                FROM approval
                                WHERE request_id = :requestId
                                ORDER BY id
                                """)
                        .bind("requestId", requestId)
                        .map(this::mapApproval)
                        .list());
    }

    public Optional<EscalationRecord> findEscalation(String escalationId) {
        return jdbi.withHandle(handle ->
                handle.createQuery("SELECT " + ESCALATION_COLUMNS
                                + " FROM escalation WHERE escalation_id = :escalationId")
                        .bind("escalationId", escalationId)
                        .map(this::mapEscalation)
                        .findOne());
    }

    public List<EscalationRecord> findOpenEscalations() {
        return jdbi.withHandle(handle ->
                handle.createQuery("SELECT " + ESCALATION_COLUMNS + """
                                FROM escalation
                                WHERE resolved_at IS NULL
                                ORDER BY id
                                """)
                        .map(this::mapEscalation)
                        .list());
    }

    public List<EscalationRecord> findEscalations(String requestId) {
        return jdbi.withHandle(handle ->
                handle.createQuery("SELECT " + ESCALATION_COLUMNS + """
                                FROM escalation
                                WHERE request_id = :requestId
                                ORDER BY id
                                """)
                        .bind("requestId", requestId)
                        .map(this::mapEscalation)
                        .list());
    }

    private ApprovalRecord mapApproval(ResultSet rs, StatementContext ctx) throws SQLException {
        return new ApprovalRecord(
                rs.getString("approval_id"),
                rs.getString("request_id"),
                approvalKindMapper.map(rs, "kind", ctx),
                rs.getString("submitted_by"),
                serializableColumnMapper.mapOf(rs, "payload", ctx),
                approvalStatusMapper.map(rs, "status", ctx),
                instantColumnMapper.map(rs, "submitted_at", ctx),
                instantColumnMapper.map(rs, "timeout_at", ctx),
                rs.getString("reviewer"),
                rs.getString("notes"),
                serializableColumnMapper.mapOf(rs, "modifications", ctx),
                instantColumnMapper.map(rs, "resolved_at", ctx));
    }

    private EscalationRecord mapEscalation(ResultSet rs, StatementContext ctx) throws SQLException {
        return new EscalationRecord(
                rs.getString("escalation_id"),
                rs.getString("request_id"),
                causeMapper.map(rs, "cause", ctx),
                severityMapper.map(rs, "severity", ctx),
                rs.getString("detail"),
                rs.getString("recommended_action"),
                instantColumnMapper.map(rs, "created_at", ctx),
                instantColumnMapper.map(rs, "resolved_at", ctx),
                actionMapper.map(rs, "action", ctx),
                rs.getString("resolved_by"));
    }
}
