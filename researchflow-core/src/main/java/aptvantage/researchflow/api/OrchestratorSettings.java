package aptvantage.researchflow.api;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

public class OrchestratorSettings {

    private int workerThreads = 4;
    private Duration dispatchInterval = Duration.of(1, ChronoUnit.SECONDS);
    private Duration sweepInterval = Duration.of(1, ChronoUnit.MINUTES);
    private int persistenceAttempts = 3;
    private Duration persistenceRetryWait = Duration.of(200, ChronoUnit.MILLIS);

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings();
    }

    public OrchestratorSettings workerThreads(int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1 but was [%s]".formatted(workerThreads));
        }
        this.workerThreads = workerThreads;
        return this;
    }

    public OrchestratorSettings dispatchInterval(Duration dispatchInterval) {
        checkPositive(dispatchInterval, "dispatchInterval");
        this.dispatchInterval = dispatchInterval;
        return this;
    }

    public OrchestratorSettings sweepInterval(Duration sweepInterval) {
        checkPositive(sweepInterval, "sweepInterval");
        this.sweepInterval = sweepInterval;
        return this;
    }

    public OrchestratorSettings persistenceAttempts(int persistenceAttempts) {
        if (persistenceAttempts < 1) {
            throw new IllegalArgumentException(
                    "persistenceAttempts must be at least 1 but was [%s]".formatted(persistenceAttempts));
        }
        this.persistenceAttempts = persistenceAttempts;
        return this;
    }

    public OrchestratorSettings persistenceRetryWait(Duration persistenceRetryWait) {
        checkPositive(persistenceRetryWait, "persistenceRetryWait");
        this.persistenceRetryWait = persistenceRetryWait;
        return this;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public Duration dispatchInterval() {
        return dispatchInterval;
    }

    public Duration sweepInterval() {
        return sweepInterval;
    }

    public int persistenceAttempts() {
        return persistenceAttempts;
    }

    public Duration persistenceRetryWait() {
        return persistenceRetryWait;
    }

    private static void checkPositive(Duration value, String name) {
        if (value == null) {
            throw new IllegalArgumentException("%s must not be null".formatted(name));
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException("%s must be positive but was [%s]".formatted(name, value));
        }
    }
}
