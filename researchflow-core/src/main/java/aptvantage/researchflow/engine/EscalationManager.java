package aptvantage.researchflow.engine;

import aptvantage.researchflow.engine.persistence.DurableWrites;
import aptvantage.researchflow.engine.persistence.WorkflowStore;
import aptvantage.researchflow.model.EscalationAction;
import aptvantage.researchflow.model.EscalationCause;
import aptvantage.researchflow.model.EscalationRecord;
import aptvantage.researchflow.model.Severity;
import aptvantage.researchflow.model.WorkflowEvent;
import com.google.common.flogger.FluentLogger;

import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Records failures that automatic handling could not resolve. The manager never decides what happens to a
 * request; it only turns a human's chosen action into the matching workflow event.
 */
public class EscalationManager {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    public record EscalationResolution(EscalationRecord record, WorkflowEvent event) {
    }

    private final WorkflowStore store;
    private final DurableWrites durableWrites;
    private final NotificationDispatcher notifications;
    private final Clock clock;

    public EscalationManager(WorkflowStore store, DurableWrites durableWrites, NotificationDispatcher notifications,
                             Clock clock) {
        this.store = store;
        this.durableWrites = durableWrites;
        this.notifications = notifications;
        this.clock = clock;
    }

    public String raise(String requestId, EscalationCause cause, Severity severity, String detail,
                        String recommendedAction) {
        EscalationRecord escalation = EscalationRecord.open(UUID.randomUUID().toString(), requestId, cause, severity,
                detail, recommendedAction, clock.instant());
        durableWrites.run("raise escalation", () -> store.insertEscalation(escalation));
        logger.atWarning().log("Raised [%s] escalation [%s] for request [%s] with severity [%s]",
                cause, escalation.escalationId(), requestId, severity);
        notifications.escalationRaised(escalation);
        return escalation.escalationId();
    }

    public EscalationResolution resolve(String escalationId, EscalationAction action, String resolver) {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (resolver == null || resolver.isBlank()) {
            throw new IllegalArgumentException("resolver must not be blank");
        }
        EscalationRecord current = find(escalationId)
                .orElseThrow(() -> new NoSuchElementException(
                        "No escalation found with id [%s]".formatted(escalationId)));
        if (!current.isOpen()) {
            throw new EscalationConflictException(escalationId, current.action());
        }
        EscalationRecord resolved = current.resolve(action, resolver, clock.instant());
        boolean won = durableWrites.call("resolve escalation", () -> store.resolveEscalation(resolved));
        if (!won) {
            EscalationAction winner = find(escalationId).map(EscalationRecord::action).orElse(null);
            throw new EscalationConflictException(escalationId, winner);
        }
        logger.atInfo().log("Escalation [%s] for request [%s] resolved by [%s] with [%s]",
                escalationId, resolved.requestId(), resolver, action);
        return new EscalationResolution(resolved, WorkflowEvent.escalation(action,
                "escalation %s resolved by %s".formatted(escalationId, resolver)));
    }

    public Optional<EscalationRecord> find(String escalationId) {
        return store.findEscalation(escalationId);
    }

    public List<EscalationRecord> open() {
        return store.findOpenEscalations();
    }

    public List<EscalationRecord> forRequest(String requestId) {
        return store.findEscalations(requestId);
    }
}
