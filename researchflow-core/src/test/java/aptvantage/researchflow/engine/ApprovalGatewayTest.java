package aptvantage.researchflow.engine;

import aptvantage.researchflow.api.ApprovalPolicies;
import aptvantage.researchflow.api.WorkflowNotifier;
import aptvantage.researchflow.engine.persistence.DuplicateApprovalException;
import aptvantage.researchflow.engine.persistence.DurableWrites;
import aptvantage.researchflow.engine.persistence.InMemoryWorkflowStore;
import aptvantage.researchflow.model.ApprovalDecision;
import aptvantage.researchflow.model.ApprovalKind;
import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.ApprovalStatus;
import aptvantage.researchflow.model.EventType;
import aptvantage.researchflow.model.WorkflowEvent;
import aptvantage.researchflow.support.MutableClock;
import com.google.common.util.concurrent.MoreExecutors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

@Execution(ExecutionMode.CONCURRENT)
class ApprovalGatewayTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryWorkflowStore store = new InMemoryWorkflowStore();
    private final WorkflowNotifier notifier = Mockito.mock(WorkflowNotifier.class);
    private final ApprovalGateway subject = new ApprovalGateway(
            store,
            new DurableWrites(1, Duration.ofMillis(1)),
            ApprovalPolicies.defaults(),
            new NotificationDispatcher(notifier, MoreExecutors.directExecutor()),
            clock);

    @Test
    public void openCreatesOnePendingRecordPerGate() {
        // when a gate is opened
        String approvalId = subject.open("REQ-1", ApprovalKind.QUALITY_REVIEW, Map.of("qa_passed", true), "qa_agent");

        // then the record is pending with the policy timeout
        ApprovalRecord approval = subject.find(approvalId).orElseThrow();
        assertTrue(approval.isPending());
        assertEquals(NOW.plus(Duration.ofHours(24)), approval.timeoutAt());
        assertEquals("qa_agent", approval.submittedBy());
        verify(notifier).gateOpened(any());

        // and a second pending record of the same kind is refused
        assertThrows(DuplicateApprovalException.class,
                () -> subject.open("REQ-1", ApprovalKind.QUALITY_REVIEW, Map.of(), "qa_agent"));
    }

    @Test
    public void resolveProducesTheMatchingEvent() {
        String approvalId = subject.open("REQ-1", ApprovalKind.REQUIREMENTS_REVIEW, Map.of(), "requirements_agent");

        ApprovalGateway.ApprovalResolution resolution = subject.resolve(approvalId, ApprovalDecision.MODIFY,
                "reviewer", "add a site", Map.of("sites", "north,south"));

        assertEquals(ApprovalStatus.MODIFIED, resolution.record().status());
        assertEquals(NOW, resolution.record().resolvedAt());
        WorkflowEvent event = resolution.event();
        assertEquals(EventType.APPROVAL_MODIFIED, event.type());
        assertEquals(ApprovalKind.REQUIREMENTS_REVIEW, event.approvalKind());
        assertEquals(Map.of("sites", "north,south"), event.payload());
    }

    @Test
    public void resolveValidatesItsInput() {
        String approvalId = subject.open("REQ-1", ApprovalKind.REQUIREMENTS_REVIEW, Map.of(), "requirements_agent");

        assertThrows(IllegalArgumentException.class,
                () -> subject.resolve(approvalId, ApprovalDecision.APPROVE, " ", null, null));
        assertThrows(IllegalArgumentException.class,
                () -> subject.resolve(approvalId, ApprovalDecision.MODIFY, "reviewer", null, Map.of()));
        assertThrows(NoSuchElementException.class,
                () -> subject.resolve("missing", ApprovalDecision.APPROVE, "reviewer", null, null));
        assertTrue(subject.find(approvalId).orElseThrow().isPending());
    }

    @Test
    public void concurrentResolutionsHaveOneWinner() throws Exception {
        // given one pending approval
        String approvalId = subject.open("REQ-1", ApprovalKind.CRITICAL_QUERY_REVIEW, Map.of(), "phenotype_agent");

        // when many reviewers resolve it at once
        int reviewers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(reviewers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < reviewers; i++) {
            ApprovalDecision decision = i % 2 == 0 ? ApprovalDecision.APPROVE : ApprovalDecision.REJECT;
            String reviewer = "reviewer-" + i;
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    subject.resolve(approvalId, decision, reviewer, null, null);
                } catch (ApprovalConflictException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // then exactly one resolution won
        assertEquals(reviewers - 1, conflicts.get());
        assertFalse(subject.find(approvalId).orElseThrow().isPending());
    }

    @Test
    public void sweepTimesOutEachOverdueRecordOnce() {
        // given approvals with 12 and 24 hour timeouts
        subject.open("REQ-1", ApprovalKind.ACCESS_AUTHORIZATION, Map.of(), "calendar_agent");
        subject.open("REQ-2", ApprovalKind.QUALITY_REVIEW, Map.of(), "qa_agent");

        // when 12 hours pass
        clock.advance(Duration.ofHours(12));
        List<ApprovalGateway.ApprovalResolution> timedOut = subject.sweepTimeouts(clock.instant());

        // then only the access authorization timed out
        assertEquals(1, timedOut.size());
        assertEquals(ApprovalKind.ACCESS_AUTHORIZATION, timedOut.get(0).record().kind());
        assertEquals(EventType.APPROVAL_TIMED_OUT, timedOut.get(0).event().type());

        // and sweeping again finds nothing new
        assertTrue(subject.sweepTimeouts(clock.instant()).isEmpty());
    }

    @Test
    public void scopeChangeDecisionsBecomeScopeChangeResolutions() {
        String approvalId = subject.open("REQ-1", ApprovalKind.SCOPE_CHANGE, Map.of("years", 10), "orchestrator");

        WorkflowEvent event = subject.resolve(approvalId, ApprovalDecision.APPROVE, "reviewer", null, null).event();

        assertEquals(EventType.SCOPE_CHANGE_RESOLVED, event.type());
        assertTrue(event.accepted());
        assertEquals(Map.of("years", 10), event.payload());
    }

    @Test
    public void timedOutScopeChangeIsDiscarded() {
        subject.open("REQ-1", ApprovalKind.SCOPE_CHANGE, Map.of("years", 10), "orchestrator");
        clock.advance(Duration.ofHours(48));

        WorkflowEvent event = subject.sweepTimeouts(clock.instant()).get(0).event();

        assertEquals(EventType.SCOPE_CHANGE_RESOLVED, event.type());
        assertFalse(event.accepted());
        assertTrue(event.payload().isEmpty());
    }

    @Test
    public void withdrawOnlyTouchesPendingRecords() {
        String resolved = subject.open("REQ-1", ApprovalKind.REQUIREMENTS_REVIEW, Map.of(), "requirements_agent");
        subject.resolve(resolved, ApprovalDecision.APPROVE, "reviewer", null, null);
        String pending = subject.open("REQ-1", ApprovalKind.CRITICAL_QUERY_REVIEW, Map.of(), "phenotype_agent");

        assertEquals(1, subject.withdrawPending("REQ-1", "request cancelled"));

        assertEquals(ApprovalStatus.APPROVED, subject.find(resolved).orElseThrow().status());
        assertEquals(ApprovalStatus.WITHDRAWN, subject.find(pending).orElseThrow().status());
        assertThrows(IllegalArgumentException.class,
                () -> ApprovalGateway.eventFor(subject.find(pending).orElseThrow()));
    }

    @Test
    public void pendingListsNewestFirstAndFiltersByKind() {
        String first = subject.open("REQ-1", ApprovalKind.REQUIREMENTS_REVIEW, Map.of(), "requirements_agent");
        clock.advance(Duration.ofMinutes(5));
        String second = subject.open("REQ-2", ApprovalKind.REQUIREMENTS_REVIEW, Map.of(), "requirements_agent");
        clock.advance(Duration.ofMinutes(5));
        subject.open("REQ-3", ApprovalKind.QUALITY_REVIEW, Map.of(), "qa_agent");

        List<ApprovalRecord> requirements = subject.pending(ApprovalKind.REQUIREMENTS_REVIEW);

        assertEquals(List.of(second, first), requirements.stream().map(ApprovalRecord::approvalId).toList());
        assertEquals(3, subject.pending(null).size());
    }
}
