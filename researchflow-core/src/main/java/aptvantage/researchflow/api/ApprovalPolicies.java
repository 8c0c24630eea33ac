package aptvantage.researchflow.api;

import aptvantage.researchflow.model.ApprovalKind;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per approval kind: how long a gate may wait for a reviewer, and where the request goes when it waits too long.
 */
public class ApprovalPolicies {

    public enum TimeoutRouting {
        /** the request is rejected */
        AUTO_REJECT,
        /** the request is parked in human review until an escalation is resolved */
        HOLD_FOR_OVERRIDE
    }

    private final Map<ApprovalKind, Duration> timeouts = new EnumMap<>(ApprovalKind.class);
    private final Map<ApprovalKind, TimeoutRouting> routings = new EnumMap<>(ApprovalKind.class);

    public ApprovalPolicies() {
        timeouts.put(ApprovalKind.REQUIREMENTS_REVIEW, Duration.of(24, ChronoUnit.HOURS));
        timeouts.put(ApprovalKind.CRITICAL_QUERY_REVIEW, Duration.of(24, ChronoUnit.HOURS));
        timeouts.put(ApprovalKind.ACCESS_AUTHORIZATION, Duration.of(12, ChronoUnit.HOURS));
        timeouts.put(ApprovalKind.QUALITY_REVIEW, Duration.of(24, ChronoUnit.HOURS));
        timeouts.put(ApprovalKind.SCOPE_CHANGE, Duration.of(48, ChronoUnit.HOURS));
        for (ApprovalKind kind : ApprovalKind.values()) {
            routings.put(kind, TimeoutRouting.HOLD_FOR_OVERRIDE);
        }
        routings.put(ApprovalKind.ACCESS_AUTHORIZATION, TimeoutRouting.AUTO_REJECT);
    }

    public static ApprovalPolicies defaults() {
        return new ApprovalPolicies();
    }

    public ApprovalPolicies timeout(ApprovalKind kind, Duration timeout) {
        checkNull(kind, "kind");
        checkNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive but was [%s]".formatted(timeout));
        }
        timeouts.put(kind, timeout);
        return this;
    }

    public ApprovalPolicies onTimeout(ApprovalKind kind, TimeoutRouting routing) {
        checkNull(kind, "kind");
        checkNull(routing, "routing");
        routings.put(kind, routing);
        return this;
    }

    public Duration timeout(ApprovalKind kind) {
        return timeouts.get(kind);
    }

    public TimeoutRouting onTimeout(ApprovalKind kind) {
        return routings.get(kind);
    }

    private static void checkNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException("%s must not be null".formatted(name));
        }
    }
}
