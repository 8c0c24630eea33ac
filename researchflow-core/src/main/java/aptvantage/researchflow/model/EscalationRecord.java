package aptvantage.researchflow.model;

import java.time.Instant;

public record EscalationRecord(
        String escalationId,
        String requestId,
        EscalationCause cause,
        Severity severity,
        String detail,
        String recommendedAction,
        Instant createdAt,
        Instant resolvedAt,
        EscalationAction action,
        String resolvedBy
) {

    public static EscalationRecord open(String escalationId, String requestId, EscalationCause cause,
                                        Severity severity, String detail, String recommendedAction,
                                        Instant createdAt) {
        return new EscalationRecord(escalationId, requestId, cause, severity, detail, recommendedAction, createdAt,
                null, null, null);
    }

    public boolean isOpen() {
        return resolvedAt == null;
    }

    public EscalationRecord resolve(EscalationAction action, String resolvedBy, Instant now) {
        return new EscalationRecord(escalationId, requestId, cause, severity, detail, recommendedAction, createdAt,
                now, action, resolvedBy);
    }
}
