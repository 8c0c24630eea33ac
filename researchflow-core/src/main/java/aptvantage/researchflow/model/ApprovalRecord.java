package aptvantage.researchflow.model;

import com.google.common.collect.ImmutableMap;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

public record ApprovalRecord(
        String approvalId,
        String requestId,
        ApprovalKind kind,
        String submittedBy,
        Map<String, Serializable> payload,
        ApprovalStatus status,
        Instant submittedAt,
        Instant timeoutAt,
        String reviewer,
        String notes,
        Map<String, Serializable> modifications,
        Instant resolvedAt
) {

    public ApprovalRecord {
        payload = payload == null ? ImmutableMap.of() : ImmutableMap.copyOf(payload);
        modifications = modifications == null ? ImmutableMap.of() : ImmutableMap.copyOf(modifications);
    }

    public static ApprovalRecord pending(String approvalId, String requestId, ApprovalKind kind, String submittedBy,
                                         Map<String, Serializable> payload, Instant submittedAt, Instant timeoutAt) {
        return new ApprovalRecord(approvalId, requestId, kind, submittedBy, payload, ApprovalStatus.PENDING,
                submittedAt, timeoutAt, null, null, null, null);
    }

    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    public boolean isOverdue(Instant now) {
        return isPending() && !timeoutAt.isAfter(now);
    }

    public ApprovalRecord resolve(ApprovalStatus newStatus, String reviewer, String notes,
                                  Map<String, Serializable> modifications, Instant resolvedAt) {
        return new ApprovalRecord(approvalId, requestId, kind, submittedBy, payload, newStatus, submittedAt,
                timeoutAt, reviewer, notes, modifications, resolvedAt);
    }

    public ApprovalRecord timeOut(Instant now) {
        return resolve(ApprovalStatus.TIMED_OUT, null, "timed out", null, now);
    }

    public ApprovalRecord withdraw(String reason, Instant now) {
        return resolve(ApprovalStatus.WITHDRAWN, null, reason, null, now);
    }
}
