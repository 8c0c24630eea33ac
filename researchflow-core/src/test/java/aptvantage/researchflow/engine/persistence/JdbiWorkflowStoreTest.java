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
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class JdbiWorkflowStoreTest {

    @Container
    private static final PostgreSQLContainer<?> postgresqlContainer = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test-database")
            .withUsername("test-user")
            .withPassword("test-password");

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    static HikariDataSource dataSource;
    static JdbiWorkflowStore store;

    @BeforeAll
    static void setup() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(postgresqlContainer.getJdbcUrl());
        config.setUsername("test-user");
        config.setPassword("test-password");
        config.setMaximumPoolSize(4);
        dataSource = new HikariDataSource(config);
        Flyway.configure().dataSource(dataSource).load().migrate();
        Jdbi jdbi = Jdbi.create(dataSource);
        store = new JdbiWorkflowStore(new StateReader(jdbi), new StateWriter(jdbi));
    }

    @AfterAll
    static void destroy() {
        dataSource.close();
    }

    private static WorkflowInstance submitted() {
        WorkflowInstance instance = WorkflowInstance.submitted("REQ-" + UUID.randomUUID(),
                WorkflowState.REQUIREMENTS_GATHERING, WorkflowContext.of(Map.of("cohort", "copd", "years", 5)), NOW);
        store.createInstance(instance);
        return instance;
    }

    private static WorkflowInstance next(WorkflowInstance instance, WorkflowState state, EventType event,
                                         WorkflowContext context, WorkflowState resumeState,
                                         WorkflowContext scopeSnapshot) {
        List<HistoryEntry> history = new ArrayList<>(instance.history());
        history.add(new HistoryEntry(state, event, NOW.plusSeconds(history.size()), event.name().toLowerCase(Locale.ROOT)));
        return new WorkflowInstance(instance.requestId(), history, context, resumeState, scopeSnapshot,
                instance.createdAt());
    }

    private static ApprovalRecord pending(String requestId, ApprovalKind kind, Instant submittedAt) {
        return ApprovalRecord.pending(UUID.randomUUID().toString(), requestId, kind, "requirements_agent",
                Map.of("summary", "copd cohort"), submittedAt, submittedAt.plus(Duration.ofHours(24)));
    }

    @Test
    public void instanceRoundTrip() {
        // given a stored instance that moved into scope change review
        WorkflowInstance instance = submitted();
        WorkflowContext merged = instance.context().merge(Map.of("summary", "all copd admissions"));
        WorkflowInstance review = next(instance, WorkflowState.REQUIREMENTS_REVIEW, EventType.AGENT_SUCCEEDED,
                merged, null, null);
        store.appendTransition(review, 1);
        WorkflowInstance scope = next(review, WorkflowState.SCOPE_CHANGE_REVIEW, EventType.SCOPE_CHANGE_REQUESTED,
                merged, WorkflowState.REQUIREMENTS_REVIEW, merged);
        store.appendTransition(scope, 2);

        // when it is read back
        WorkflowInstance found = store.findInstance(instance.requestId()).orElseThrow();

        // then every part survived
        assertEquals(WorkflowState.SCOPE_CHANGE_REVIEW, found.state());
        assertEquals(3, found.version());
        assertEquals(scope.history(), found.history());
        assertArrayEquals(merged.toBytes(), found.context().toBytes());
        assertEquals(WorkflowState.REQUIREMENTS_REVIEW, found.resumeState());
        assertEquals(merged, found.scopeSnapshot());
        assertEquals(NOW, found.createdAt());
    }

    @Test
    public void staleTransitionIsRefused() {
        WorkflowInstance instance = submitted();
        store.appendTransition(next(instance, WorkflowState.REQUIREMENTS_REVIEW, EventType.AGENT_SUCCEEDED,
                instance.context(), null, null), 1);

        assertThrows(StaleInstanceException.class, () -> store.appendTransition(next(instance,
                WorkflowState.CANCELLED, EventType.CANCEL_REQUESTED, instance.context(), null, null), 1));

        WorkflowInstance found = store.findInstance(instance.requestId()).orElseThrow();
        assertEquals(WorkflowState.REQUIREMENTS_REVIEW, found.state());
        assertEquals(2, found.history().size());
    }

    @Test
    public void terminalInstancesAreNotActive() {
        WorkflowInstance active = submitted();
        WorkflowInstance cancelled = submitted();
        store.appendTransition(next(cancelled, WorkflowState.CANCELLED, EventType.CANCEL_REQUESTED,
                cancelled.context(), null, null), 1);

        List<String> activeIds = store.findActiveInstances().stream().map(WorkflowInstance::requestId).toList();

        assertTrue(activeIds.contains(active.requestId()));
        assertFalse(activeIds.contains(cancelled.requestId()));
    }

    @Test
    public void executionsKeepTheirOrder() {
        WorkflowInstance instance = submitted();
        for (int attempt = 1; attempt <= 3; attempt++) {
            ExecutionOutcome outcome = attempt < 3 ? ExecutionOutcome.RETRYING : ExecutionOutcome.SUCCESS;
            Map<String, Serializable> result = attempt < 3 ? null : Map.of("requirements", "done");
            store.appendExecution(new ExecutionRecord(instance.requestId(), "requirements_agent",
                    "gather_requirements", "dispatch-1", attempt, NOW.plusSeconds(attempt),
                    NOW.plusSeconds(attempt), outcome, result, attempt < 3 ? "timeout" : null));
        }

        List<ExecutionRecord> executions = store.findExecutions(instance.requestId());

        assertEquals(List.of(1, 2, 3), executions.stream().map(ExecutionRecord::attempt).toList());
        assertEquals(ExecutionOutcome.SUCCESS, executions.get(2).outcome());
        assertEquals(Map.of("requirements", "done"), executions.get(2).result());
        assertEquals("timeout", executions.get(0).error());
        assertTrue(executions.get(0).result().isEmpty());
    }

    @Test
    public void pendingApprovalIsUniquePerKind() {
        WorkflowInstance instance = submitted();
        store.insertApproval(pending(instance.requestId(), ApprovalKind.REQUIREMENTS_REVIEW, NOW));

        assertThrows(DuplicateApprovalException.class, () ->
                store.insertApproval(pending(instance.requestId(), ApprovalKind.REQUIREMENTS_REVIEW, NOW)));
    }

    @Test
    public void approvalResolutionIsACompareAndSet() {
        // given a pending approval
        WorkflowInstance instance = submitted();
        ApprovalRecord approval = pending(instance.requestId(), ApprovalKind.REQUIREMENTS_REVIEW, NOW);
        store.insertApproval(approval);

        // when it is resolved twice
        Instant resolvedAt = NOW.plus(Duration.ofHours(1));
        boolean first = store.resolveApproval(approval.resolve(ApprovalStatus.MODIFIED, "reviewer", "narrow it",
                Map.of("years", 3), resolvedAt));
        boolean second = store.resolveApproval(approval.resolve(ApprovalStatus.REJECTED, "other", null, null,
                resolvedAt));

        // then the first resolution is the one stored
        assertTrue(first);
        assertFalse(second);
        ApprovalRecord found = store.findApproval(approval.approvalId()).orElseThrow();
        assertEquals(ApprovalStatus.MODIFIED, found.status());
        assertEquals("reviewer", found.reviewer());
        assertEquals(Map.of("years", 3), found.modifications());
        assertEquals(Map.of("summary", "copd cohort"), found.payload());
        assertEquals(resolvedAt, found.resolvedAt());

        // and a new pending approval of the same kind may be opened
        store.insertApproval(pending(instance.requestId(), ApprovalKind.REQUIREMENTS_REVIEW, resolvedAt));
        assertEquals(2, store.findApprovals(instance.requestId()).size());
        assertTrue(store.findLatestApproval(instance.requestId(), ApprovalKind.REQUIREMENTS_REVIEW)
                .orElseThrow().isPending());
    }

    @Test
    public void overdueAndPendingQueries() {
        // given two pending approvals opened an hour apart
        WorkflowInstance instance = submitted();
        ApprovalRecord older = pending(instance.requestId(), ApprovalKind.REQUIREMENTS_REVIEW, NOW);
        ApprovalRecord newer = pending(instance.requestId(), ApprovalKind.SCOPE_CHANGE, NOW.plus(Duration.ofHours(1)));
        store.insertApproval(older);
        store.insertApproval(newer);

        // then pending approvals are listed newest first
        List<String> pendingIds = store.findPendingApprovals(null).stream()
                .filter(approval -> approval.requestId().equals(instance.requestId()))
                .map(ApprovalRecord::approvalId)
                .toList();
        assertEquals(List.of(newer.approvalId(), older.approvalId()), pendingIds);
        assertTrue(store.findPendingApprovals(ApprovalKind.SCOPE_CHANGE).stream()
                .allMatch(approval -> approval.kind() == ApprovalKind.SCOPE_CHANGE));

        // and only the older one is overdue a day later
        List<String> overdue = store.findOverdueApprovals(NOW.plus(Duration.ofHours(24))).stream()
                .filter(approval -> approval.requestId().equals(instance.requestId()))
                .map(ApprovalRecord::approvalId)
                .toList();
        assertEquals(List.of(older.approvalId()), overdue);
        assertEquals(older.approvalId(), store.findPendingApproval(instance.requestId(),
                ApprovalKind.REQUIREMENTS_REVIEW).orElseThrow().approvalId());
    }

    @Test
    public void escalationLifecycle() {
        WorkflowInstance instance = submitted();
        EscalationRecord escalation = EscalationRecord.open(UUID.randomUUID().toString(), instance.requestId(),
                EscalationCause.AGENT_FAILURE, Severity.HIGH, "extraction failed", "retry", NOW);
        store.insertEscalation(escalation);
        assertTrue(store.findOpenEscalations().stream()
                .anyMatch(open -> open.escalationId().equals(escalation.escalationId())));

        Instant resolvedAt = NOW.plus(Duration.ofMinutes(10));
        assertTrue(store.resolveEscalation(escalation.resolve(EscalationAction.RETRY_FROM_STATE, "ops", resolvedAt)));
        assertFalse(store.resolveEscalation(escalation.resolve(EscalationAction.FORCE_FAIL, "ops", resolvedAt)));

        EscalationRecord found = store.findEscalation(escalation.escalationId()).orElseThrow();
        assertEquals(EscalationAction.RETRY_FROM_STATE, found.action());
        assertEquals(resolvedAt, found.resolvedAt());
        assertEquals(1, store.findEscalations(instance.requestId()).size());
        assertEquals("ops", found.resolvedBy());
    }
}
