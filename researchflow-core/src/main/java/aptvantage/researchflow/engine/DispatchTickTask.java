package aptvantage.researchflow.engine;

import com.github.kagkarlsson.scheduler.task.ExecutionContext;
import com.github.kagkarlsson.scheduler.task.TaskInstance;
import com.github.kagkarlsson.scheduler.task.helper.RecurringTask;
import com.github.kagkarlsson.scheduler.task.schedule.FixedDelay;

import java.time.Duration;

public class DispatchTickTask extends RecurringTask<Void> {

    private final Orchestrator orchestrator;

    public DispatchTickTask(Orchestrator orchestrator, Duration interval) {
        super(DispatchTickTask.class.getSimpleName(), FixedDelay.of(interval), Void.class);
        this.orchestrator = orchestrator;
    }

    @Override
    public void executeRecurringly(TaskInstance<Void> taskInstance, ExecutionContext executionContext) {
        orchestrator.tick();
    }
}
