package aptvantage.researchflow.engine;

import aptvantage.researchflow.api.AgentResult;
import aptvantage.researchflow.model.Severity;

import java.time.Instant;

public record AttemptOutcome(
        Kind kind,
        AgentResult result,
        Instant retryAt,
        String error,
        Severity severity
) {

    public enum Kind {
        SUCCEEDED, RETRY_SCHEDULED, FAILED_TERMINALLY
    }

    static AttemptOutcome succeeded(AgentResult result) {
        return new AttemptOutcome(Kind.SUCCEEDED, result, null, null, null);
    }

    static AttemptOutcome retryAt(Instant retryAt, String error) {
        return new AttemptOutcome(Kind.RETRY_SCHEDULED, null, retryAt, error, null);
    }

    static AttemptOutcome failedTerminally(String error, Severity severity) {
        return new AttemptOutcome(Kind.FAILED_TERMINALLY, null, null, error, severity);
    }
}
