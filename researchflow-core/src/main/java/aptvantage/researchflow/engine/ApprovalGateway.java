package aptvantage.researchflow.engine;

import aptvantage.researchflow.api.ApprovalPolicies;
import aptvantage.researchflow.engine.persistence.DurableWrites;
import aptvantage.researchflow.engine.persistence.DuplicateApprovalException;
import aptvantage.researchflow.engine.persistence.WorkflowStore;
import aptvantage.researchflow.model.ApprovalDecision;
import aptvantage.researchflow.model.ApprovalKind;
import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.ApprovalStatus;
import aptvantage.researchflow.model.EventType;
import aptvantage.researchflow.model.WorkflowEvent;
import com.google.common.flogger.FluentLogger;

import java.io.Serializable;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Human review records. A request waiting in a gate state has exactly one pending record; resolving or timing it
 * out is a one-way compare-and-set on the record's status, so each record produces at most one workflow event.
 */
public class ApprovalGateway {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    public record ApprovalResolution(ApprovalRecord record, WorkflowEvent event) {
    }

    private final WorkflowStore store;
    private final DurableWrites durableWrites;
    private final ApprovalPolicies policies;
    private final NotificationDispatcher notifications;
    private final Clock clock;

    public ApprovalGateway(WorkflowStore store, DurableWrites durableWrites, ApprovalPolicies policies,
                           NotificationDispatcher notifications, Clock clock) {
        this.store = store;
        this.durableWrites = durableWrites;
        this.policies = policies;
        this.notifications = notifications;
        this.clock = clock;
    }

    /**
     * @throws DuplicateApprovalException if the request already has a pending record of this kind
     */
    public String open(String requestId, ApprovalKind kind, Map<String, Serializable> payload, String submittedBy) {
        Instant now = clock.instant();
        ApprovalRecord approval = ApprovalRecord.pending(UUID.randomUUID().toString(), requestId, kind, submittedBy,
                payload, now, now.plus(policies.timeout(kind)));
        durableWrites.run("open approval", () -> store.insertApproval(approval));
        logger.atInfo().log("Opened [%s] approval [%s] for request [%s], due by [%s]",
                kind, approval.approvalId(), requestId, approval.timeoutAt());
        notifications.gateOpened(approval);
        return approval.approvalId();
    }

    public ApprovalResolution resolve(String approvalId, ApprovalDecision decision, String reviewer, String notes,
                                      Map<String, Serializable> modifications) {
        if (decision == null) {
            throw new IllegalArgumentException("decision must not be null");
        }
        if (reviewer == null || reviewer.isBlank()) {
            throw new IllegalArgumentException("reviewer must not be blank");
        }
        if (decision == ApprovalDecision.MODIFY && (modifications == null || modifications.isEmpty())) {
            throw new IllegalArgumentException("A modification must carry the modified values");
        }
        ApprovalRecord current = find(approvalId)
                .orElseThrow(() -> new NoSuchElementException("No approval found with id [%s]".formatted(approvalId)));
        if (!current.isPending()) {
            throw new ApprovalConflictException(approvalId, current.status());
        }
        ApprovalRecord resolved = current.resolve(decision.status(), reviewer, notes,
                decision == ApprovalDecision.MODIFY ? modifications : null, clock.instant());
        boolean won = durableWrites.call("resolve approval", () -> store.resolveApproval(resolved));
        if (!won) {
            ApprovalStatus winner = find(approvalId).map(ApprovalRecord::status).orElse(null);
            throw new ApprovalConflictException(approvalId, winner);
        }
        logger.atInfo().log("Approval [%s] for request [%s] resolved as [%s] by [%s]",
                approvalId, resolved.requestId(), resolved.status(), reviewer);
        return new ApprovalResolution(resolved, eventFor(resolved));
    }

    /**
     * Time out every overdue pending record. Only records this call moved out of pending are returned, so
     * overlapping or repeated sweeps never produce an event twice.
     */
    public List<ApprovalResolution> sweepTimeouts(Instant now) {
        List<ApprovalResolution> timedOut = new ArrayList<>();
        for (ApprovalRecord overdue : store.findOverdueApprovals(now)) {
            ApprovalRecord resolved = overdue.timeOut(now);
            if (durableWrites.call("time out approval", () -> store.resolveApproval(resolved))) {
                logger.atInfo().log("Approval [%s] of kind [%s] for request [%s] timed out",
                        overdue.approvalId(), overdue.kind(), overdue.requestId());
                timedOut.add(new ApprovalResolution(resolved, eventFor(resolved)));
            }
        }
        return timedOut;
    }

    /**
     * Withdraw the pending records of a request that left its gate without a decision.
     */
    public int withdrawPending(String requestId, String reason) {
        int withdrawn = 0;
        for (ApprovalRecord approval : store.findApprovals(requestId)) {
            if (approval.isPending()) {
                ApprovalRecord resolved = approval.withdraw(reason, clock.instant());
                if (durableWrites.call("withdraw approval", () -> store.resolveApproval(resolved))) {
                    logger.atInfo().log("Withdrew approval [%s] for request [%s]: %s",
                            approval.approvalId(), requestId, reason);
                    withdrawn++;
                }
            }
        }
        return withdrawn;
    }

    /**
     * The workflow event a resolved record stands for.
     */
    public static WorkflowEvent eventFor(ApprovalRecord resolved) {
        EventType type = switch (resolved.status()) {
            case APPROVED -> EventType.APPROVAL_APPROVED;
            case MODIFIED -> EventType.APPROVAL_MODIFIED;
            case REJECTED -> EventType.APPROVAL_REJECTED;
            case TIMED_OUT -> EventType.APPROVAL_TIMED_OUT;
            case PENDING, WITHDRAWN -> throw new IllegalArgumentException(
                    "Approval [%s] in status [%s] has no workflow event"
                            .formatted(resolved.approvalId(), resolved.status()));
        };
        if (resolved.kind() == ApprovalKind.SCOPE_CHANGE) {
            boolean accepted = type == EventType.APPROVAL_APPROVED || type == EventType.APPROVAL_MODIFIED;
            Map<String, Serializable> delta = type == EventType.APPROVAL_MODIFIED
                    ? resolved.modifications()
                    : resolved.payload();
            return WorkflowEvent.scopeChangeResolved(accepted, accepted ? delta : null,
                    "scope change %s".formatted(resolved.status().name().toLowerCase(Locale.ROOT)));
        }
        return WorkflowEvent.approval(type, resolved.kind(), resolved.modifications(), resolved.notes());
    }

    public Optional<ApprovalRecord> find(String approvalId) {
        return store.findApproval(approvalId);
    }

    public Optional<ApprovalRecord> pendingFor(String requestId, ApprovalKind kind) {
        return store.findPendingApproval(requestId, kind);
    }

    public Optional<ApprovalRecord> latest(String requestId, ApprovalKind kind) {
        return store.findLatestApproval(requestId, kind);
    }

    /**
     * Pending records, newest first. A null kind returns every pending record.
     */
    public List<ApprovalRecord> pending(ApprovalKind kind) {
        return store.findPendingApprovals(kind);
    }

    public List<ApprovalRecord> forRequest(String requestId) {
        return store.findApprovals(requestId);
    }
}
