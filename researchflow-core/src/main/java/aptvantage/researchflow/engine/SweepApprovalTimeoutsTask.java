package aptvantage.researchflow.engine;

import com.github.kagkarlsson.scheduler.task.ExecutionContext;
import com.github.kagkarlsson.scheduler.task.TaskInstance;
import com.github.kagkarlsson.scheduler.task.helper.RecurringTask;
import com.github.kagkarlsson.scheduler.task.schedule.FixedDelay;
import com.google.common.flogger.FluentLogger;

import java.time.Duration;

public class SweepApprovalTimeoutsTask extends RecurringTask<Void> {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final Orchestrator orchestrator;

    public SweepApprovalTimeoutsTask(Orchestrator orchestrator, Duration interval) {
        super(SweepApprovalTimeoutsTask.class.getSimpleName(), FixedDelay.of(interval), Void.class);
        this.orchestrator = orchestrator;
    }

    @Override
    public void executeRecurringly(TaskInstance<Void> taskInstance, ExecutionContext executionContext) {
        int timedOut = orchestrator.sweepTimeouts();
        if (timedOut > 0) {
            logger.atInfo().log("Timed out [%s] approval(s)", timedOut);
        }
    }
}
