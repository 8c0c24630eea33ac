package aptvantage.researchflow.engine;

import aptvantage.researchflow.api.WorkflowNotifier;
import aptvantage.researchflow.engine.persistence.DurableWrites;
import aptvantage.researchflow.engine.persistence.InMemoryWorkflowStore;
import aptvantage.researchflow.model.EscalationAction;
import aptvantage.researchflow.model.EscalationCause;
import aptvantage.researchflow.model.EscalationRecord;
import aptvantage.researchflow.model.EventType;
import aptvantage.researchflow.model.Severity;
import aptvantage.researchflow.support.MutableClock;
import com.google.common.util.concurrent.MoreExecutors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@Execution(ExecutionMode.CONCURRENT)
class EscalationManagerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
    private final WorkflowNotifier notifier = Mockito.mock(WorkflowNotifier.class);
    private final EscalationManager subject = new EscalationManager(
            new InMemoryWorkflowStore(),
            new DurableWrites(1, Duration.ofMillis(1)),
            new NotificationDispatcher(notifier, MoreExecutors.directExecutor()),
            clock);

    @Test
    public void raisedEscalationIsOpenUntilResolved() {
        // given a raised escalation
        String escalationId = subject.raise("REQ-1", EscalationCause.AGENT_FAILURE, Severity.HIGH,
                "extraction failed 3 times", "retry from DATA_EXTRACTION");
        assertEquals(1, subject.open().size());
        verify(notifier).escalationRaised(any());

        // when a human resolves it
        clock.advance(Duration.ofMinutes(30));
        EscalationManager.EscalationResolution resolution =
                subject.resolve(escalationId, EscalationAction.FORCE_FAIL, "ops@example.org");

        // then the record is closed and the matching event is returned
        EscalationRecord resolved = resolution.record();
        assertFalse(resolved.isOpen());
        assertEquals("ops@example.org", resolved.resolvedBy());
        assertEquals(clock.instant(), resolved.resolvedAt());
        assertEquals(EventType.ESCALATION_FORCE_FAIL, resolution.event().type());
        assertTrue(subject.open().isEmpty());
        assertEquals(1, subject.forRequest("REQ-1").size());
    }

    @Test
    public void resolvingTwiceConflicts() {
        String escalationId = subject.raise("REQ-1", EscalationCause.APPROVAL_TIMEOUT, Severity.HIGH, "late", "retry");
        subject.resolve(escalationId, EscalationAction.RETRY_FROM_STATE, "ops@example.org");

        assertThrows(EscalationConflictException.class,
                () -> subject.resolve(escalationId, EscalationAction.FORCE_FAIL, "ops@example.org"));
    }

    @Test
    public void invalidResolutionsAreRefused() {
        String escalationId = subject.raise("REQ-1", EscalationCause.AGENT_FAILURE, Severity.CRITICAL, "x", "y");

        assertThrows(IllegalArgumentException.class, () -> subject.resolve(escalationId, null, "ops"));
        assertThrows(IllegalArgumentException.class,
                () -> subject.resolve(escalationId, EscalationAction.FORCE_FAIL, ""));
        assertThrows(NoSuchElementException.class,
                () -> subject.resolve("missing", EscalationAction.FORCE_FAIL, "ops"));
    }

    @Test
    public void failingNotifierDoesNotFailTheEscalation() {
        doThrow(new IllegalStateException("smtp down")).when(notifier).escalationRaised(any());

        String escalationId = subject.raise("REQ-1", EscalationCause.AGENT_FAILURE, Severity.HIGH, "x", "y");

        assertTrue(subject.find(escalationId).orElseThrow().isOpen());
    }
}
