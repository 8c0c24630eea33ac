package aptvantage.researchflow.engine;

import aptvantage.researchflow.api.WorkflowNotifier;
import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.EscalationRecord;
import aptvantage.researchflow.model.WorkflowInstance;
import com.google.common.flogger.FluentLogger;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands notifications to the {@link WorkflowNotifier} on a separate executor. Notifier failures are logged and
 * never reach the caller.
 */
public class NotificationDispatcher {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final WorkflowNotifier notifier;
    private final Executor executor;

    public NotificationDispatcher(WorkflowNotifier notifier, Executor executor) {
        this.notifier = notifier;
        this.executor = executor;
    }

    void gateOpened(ApprovalRecord approval) {
        submit("gate opened", approval.requestId(), () -> notifier.gateOpened(approval));
    }

    void escalationRaised(EscalationRecord escalation) {
        submit("escalation raised", escalation.requestId(), () -> notifier.escalationRaised(escalation));
    }

    void terminalStateReached(WorkflowInstance instance) {
        submit("terminal state reached", instance.requestId(), () -> notifier.terminalStateReached(instance));
    }

    private void submit(String notification, String requestId, Runnable call) {
        try {
            executor.execute(() -> {
                try {
                    call.run();
                } catch (RuntimeException e) {
                    logger.atWarning().withCause(e).log("Notifier failed on [%s] for request [%s]",
                            notification, requestId);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.atWarning().withCause(e).log("Dropped [%s] notification for request [%s]",
                    notification, requestId);
        }
    }
}
