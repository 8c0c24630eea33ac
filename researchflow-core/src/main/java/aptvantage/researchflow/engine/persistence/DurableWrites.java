package aptvantage.researchflow.engine.persistence;

import com.google.common.flogger.FluentLogger;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries store operations that fail with a {@link PersistenceException}. Logical failures such as
 * {@link StaleInstanceException} or {@link DuplicateApprovalException} are not retried.
 */
public class DurableWrites {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final Retry retry;

    public DurableWrites(int maxAttempts, Duration waitDuration) {
        this.retry = Retry.of("workflow-store",
                RetryConfig.custom()
                        .maxAttempts(maxAttempts)
                        .waitDuration(waitDuration)
                        .retryExceptions(PersistenceException.class)
                        .build());
        this.retry.getEventPublisher().onRetry(event ->
                logger.atWarning().withCause(event.getLastThrowable()).log(
                        "Workflow store write failed, attempt [%s] of [%s]",
                        event.getNumberOfRetryAttempts(), maxAttempts));
    }

    public void run(String operation, Runnable write) {
        call(operation, () -> {
            write.run();
            return null;
        });
    }

    public <T> T call(String operation, Supplier<T> write) {
        try {
            return Retry.decorateSupplier(retry, write).get();
        } catch (PersistenceException e) {
            throw new PersistenceUnavailableException(operation, e);
        }
    }
}
