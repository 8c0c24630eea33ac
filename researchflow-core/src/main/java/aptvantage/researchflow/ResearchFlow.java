package aptvantage.researchflow;

import aptvantage.researchflow.api.Agent;
import aptvantage.researchflow.api.ApprovalPolicies;
import aptvantage.researchflow.api.LoggingWorkflowNotifier;
import aptvantage.researchflow.api.OrchestratorSettings;
import aptvantage.researchflow.api.RetryPolicy;
import aptvantage.researchflow.api.WorkflowNotifier;
import aptvantage.researchflow.engine.AgentRegistry;
import aptvantage.researchflow.engine.ApprovalGateway;
import aptvantage.researchflow.engine.DispatchQueue;
import aptvantage.researchflow.engine.DispatchTickTask;
import aptvantage.researchflow.engine.EscalationManager;
import aptvantage.researchflow.engine.LiveInstances;
import aptvantage.researchflow.engine.NotificationDispatcher;
import aptvantage.researchflow.engine.Orchestrator;
import aptvantage.researchflow.engine.RetrySupervisor;
import aptvantage.researchflow.engine.SweepApprovalTimeoutsTask;
import aptvantage.researchflow.engine.WorkflowEngine;
import aptvantage.researchflow.engine.persistence.DurableWrites;
import aptvantage.researchflow.engine.persistence.JdbiWorkflowStore;
import aptvantage.researchflow.engine.persistence.StateReader;
import aptvantage.researchflow.engine.persistence.StateWriter;
import aptvantage.researchflow.engine.persistence.WorkflowStore;
import aptvantage.researchflow.model.AgentRunState;
import aptvantage.researchflow.model.ApprovalDecision;
import aptvantage.researchflow.model.ApprovalKind;
import aptvantage.researchflow.model.ApprovalRecord;
import aptvantage.researchflow.model.EscalationAction;
import aptvantage.researchflow.model.EscalationRecord;
import aptvantage.researchflow.model.ExecutionRecord;
import aptvantage.researchflow.model.RequestStatus;
import com.github.kagkarlsson.scheduler.Scheduler;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.jdbi.v3.core.Jdbi;

import javax.sql.DataSource;
import java.io.Serializable;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for embedding the research request workflow. Build one with {@link #builder()}, register the agents
 * that do the work and call {@link ResearchFlowBuilder#start()}.
 */
public class ResearchFlow {

    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final Orchestrator orchestrator;
    private final Scheduler scheduler;
    private final ExecutorService workers;
    private final ExecutorService notificationExecutor;
    private final ResearchFlowBuilder builder;

    private ResearchFlow(Orchestrator orchestrator,
                         Scheduler scheduler,
                         ExecutorService workers,
                         ExecutorService notificationExecutor,
                         ResearchFlowBuilder builder) {
        this.orchestrator = orchestrator;
        this.scheduler = scheduler;
        this.workers = workers;
        this.notificationExecutor = notificationExecutor;
        this.builder = builder;
    }

    public static ResearchFlowBuilder builder() {
        return new ResearchFlowBuilder();
    }

    public String submit(Map<String, ? extends Serializable> initialContext) {
        return orchestrator.submit(initialContext);
    }

    public RequestStatus status(String requestId) {
        return orchestrator.status(requestId);
    }

    public RequestStatus resolveApproval(String approvalId, ApprovalDecision decision, String reviewer,
                                         String notes) {
        return orchestrator.resolveApproval(approvalId, decision, reviewer, notes, null);
    }

    public RequestStatus resolveApproval(String approvalId, ApprovalDecision decision, String reviewer,
                                         String notes, Map<String, ? extends Serializable> modifications) {
        return orchestrator.resolveApproval(approvalId, decision, reviewer, notes, modifications);
    }

    public RequestStatus requestScopeChange(String requestId, Map<String, ? extends Serializable> delta,
                                            String reason) {
        return orchestrator.requestScopeChange(requestId, delta, reason);
    }

    public RequestStatus resolveEscalation(String escalationId, EscalationAction action, String resolver) {
        return orchestrator.resolveEscalation(escalationId, action, resolver);
    }

    public RequestStatus cancel(String requestId, String reason) {
        return orchestrator.cancel(requestId, reason);
    }

    public List<ApprovalRecord> pendingApprovals() {
        return orchestrator.pendingApprovals(null);
    }

    public List<ApprovalRecord> pendingApprovals(ApprovalKind kind) {
        return orchestrator.pendingApprovals(kind);
    }

    public List<ApprovalRecord> approvals(String requestId) {
        return orchestrator.approvals(requestId);
    }

    public List<ExecutionRecord> executions(String requestId) {
        return orchestrator.executions(requestId);
    }

    public List<EscalationRecord> openEscalations() {
        return orchestrator.openEscalations();
    }

    public List<EscalationRecord> escalations(String requestId) {
        return orchestrator.escalations(requestId);
    }

    public Map<String, Map<String, AgentRunState>> agentRunStates() {
        return orchestrator.agentRunStates();
    }

    public void stop() {
        this.scheduler.stop();
        MoreExecutors.shutdownAndAwaitTermination(workers, 30, TimeUnit.SECONDS);
        MoreExecutors.shutdownAndAwaitTermination(notificationExecutor, 5, TimeUnit.SECONDS);
        this.builder.stop();
        logger.atInfo().log("ResearchFlow stopped");
    }

    public static class ResearchFlowBuilder {

        private final List<Agent> agents = new ArrayList<>();
        private DataSource dataSource;
        private boolean managedDataSource = false;
        private WorkflowNotifier notifier = new LoggingWorkflowNotifier();
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private ApprovalPolicies approvalPolicies = ApprovalPolicies.defaults();
        private OrchestratorSettings settings = OrchestratorSettings.defaults();
        private Clock clock = Clock.systemUTC();

        private ResearchFlowBuilder() {
        }

        private static void runDatabaseMigration(DataSource dataSource) {
            Flyway.configure()
                    .baselineVersion("0")
                    .baselineOnMigrate(true)
                    .dataSource(dataSource)
                    .load()
                    .migrate();
        }

        private static HikariDataSource initializeDataSource(String username, String password, String url) {
            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(url);
            config.setUsername(username);
            config.setPassword(password);
            config.setDriverClassName("org.postgresql.Driver");
            config.setMaximumPoolSize(10);

            // setting min idle prevents the datasource from eagerly creating max pool size
            config.setMinimumIdle(2);
            config.setTransactionIsolation("TRANSACTION_READ_COMMITTED");
            return new HikariDataSource(config);
        }

        public ResearchFlowBuilder dataSource(String username, String password, String url) {
            this.dataSource = initializeDataSource(username, password, url);
            this.managedDataSource = true;
            return this;
        }

        public ResearchFlowBuilder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public ResearchFlowBuilder registerAgents(Agent... agents) {
            this.agents.addAll(Arrays.asList(agents));
            return this;
        }

        public ResearchFlowBuilder notifier(WorkflowNotifier notifier) {
            checkNull(notifier, "notifier");
            this.notifier = notifier;
            return this;
        }

        public ResearchFlowBuilder retryPolicy(RetryPolicy retryPolicy) {
            checkNull(retryPolicy, "retryPolicy");
            this.retryPolicy = retryPolicy;
            return this;
        }

        public ResearchFlowBuilder approvalPolicies(ApprovalPolicies approvalPolicies) {
            checkNull(approvalPolicies, "approvalPolicies");
            this.approvalPolicies = approvalPolicies;
            return this;
        }

        public ResearchFlowBuilder settings(OrchestratorSettings settings) {
            checkNull(settings, "settings");
            this.settings = settings;
            return this;
        }

        public ResearchFlowBuilder clock(Clock clock) {
            checkNull(clock, "clock");
            this.clock = clock;
            return this;
        }

        public ResearchFlow start() {
            checkNull(this.dataSource, "dataSource");
            runDatabaseMigration(this.dataSource);
            Jdbi jdbi = Jdbi.create(this.dataSource);
            WorkflowStore store = new JdbiWorkflowStore(new StateReader(jdbi), new StateWriter(jdbi));

            ExecutorService workers = Executors.newFixedThreadPool(settings.workerThreads(),
                    new ThreadFactoryBuilder().setNameFormat("researchflow-agent-%d").setDaemon(true).build());
            ExecutorService notificationExecutor = Executors.newSingleThreadExecutor(
                    new ThreadFactoryBuilder().setNameFormat("researchflow-notify-%d").setDaemon(true).build());

            DurableWrites durableWrites = new DurableWrites(settings.persistenceAttempts(),
                    settings.persistenceRetryWait());
            NotificationDispatcher notifications = new NotificationDispatcher(notifier, notificationExecutor);
            EscalationManager escalations = new EscalationManager(store, durableWrites, notifications, clock);
            ApprovalGateway approvals = new ApprovalGateway(store, durableWrites, approvalPolicies, notifications,
                    clock);
            RetrySupervisor supervisor = new RetrySupervisor(new AgentRegistry().registerAll(agents), retryPolicy,
                    store, durableWrites, escalations, clock);
            Orchestrator orchestrator = new Orchestrator(
                    new WorkflowEngine(approvalPolicies, clock),
                    store,
                    durableWrites,
                    supervisor,
                    approvals,
                    escalations,
                    notifications,
                    new LiveInstances(),
                    new DispatchQueue(),
                    workers,
                    approvalPolicies,
                    settings,
                    clock);
            orchestrator.recover();

            // start this (last) after the rest of the app is completely initialized
            Scheduler scheduler = Scheduler
                    .create(this.dataSource)
                    .startTasks(
                            new DispatchTickTask(orchestrator, settings.dispatchInterval()),
                            new SweepApprovalTimeoutsTask(orchestrator, settings.sweepInterval()))
                    .pollingInterval(settings.dispatchInterval())
                    .build();
            scheduler.start();
            logger.atInfo().log("ResearchFlow started with [%s] agent(s)", agents.size());
            return new ResearchFlow(orchestrator, scheduler, workers, notificationExecutor, this);
        }

        public void stop() {
            if (managedDataSource) {
                ((HikariDataSource) this.dataSource).close();
            }
        }

        private static void checkNull(Object value, String name) {
            if (value == null) {
                throw new IllegalArgumentException("%s must not be null".formatted(name));
            }
        }
    }
}
