package com.jobsched.scheduler;

import com.jobsched.adapter.cron.CronUtilsScheduleCalculator;
import com.jobsched.adapter.executor.InMemoryBatchProcessor;
import com.jobsched.adapter.executor.InMemoryJobExecutor;
import com.jobsched.adapter.store.InMemoryKeyValueStore;
import com.jobsched.adapter.system.OperatingSystemLoadProvider;
import com.jobsched.adapter.timer.ScheduledExecutorTaskTimer;
import com.jobsched.condition.ConditionEvaluator;
import com.jobsched.condition.DefaultConditionEvaluator;
import com.jobsched.condition.JobConditionEvaluator;
import com.jobsched.config.QueueConfigRegistry;
import com.jobsched.config.SchedulerConfig;
import com.jobsched.fairness.FairnessController;
import com.jobsched.fairness.RateLimiter;
import com.jobsched.fairness.StarvationTracker;
import com.jobsched.priority.PriorityCalculator;
import com.jobsched.registry.DefaultJobRegistry;
import com.jobsched.registry.JobConfigCodec;
import com.jobsched.registry.JobValidator;
import com.jobsched.spi.BatchProcessor;
import com.jobsched.spi.JobExecutor;
import com.jobsched.spi.KeyValueStore;
import com.jobsched.spi.QueueHealthProvider;
import com.jobsched.spi.ScheduleCalculator;
import com.jobsched.spi.SystemLoadProvider;
import com.jobsched.spi.TaskTimer;
import com.jobsched.stats.ExecutionResultTracker;
import com.jobsched.stats.StatsCollector;
import com.jobsched.strategy.BatchStrategyHandler;
import com.jobsched.strategy.ConditionalStrategyHandler;
import com.jobsched.strategy.DelayedStrategyHandler;
import com.jobsched.strategy.DependencyIndex;
import com.jobsched.strategy.ImmediateStrategyHandler;
import com.jobsched.strategy.JobDispatcher;
import com.jobsched.strategy.RecurringStrategyHandler;
import com.jobsched.strategy.ScheduledTaskRegistry;
import com.jobsched.strategy.StrategyDispatcher;
import com.jobsched.variable.DefaultVariableResolver;
import com.jobsched.variable.EvaluationContextFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires a {@link DefaultJobScheduler}. Collaborators that are not supplied fall back to the
 * in-process adapters; an executor that also implements {@link QueueHealthProvider} doubles as one.
 */
public class JobSchedulerBuilder {

    private final SchedulerConfig config;
    private Clock clock = Clock.systemDefaultZone();
    private JobExecutor executor;
    private QueueHealthProvider queueHealthProvider;
    private KeyValueStore store;
    private BatchProcessor batchProcessor;
    private ScheduleCalculator scheduleCalculator;
    private SystemLoadProvider systemLoadProvider;
    private TaskTimer timer;

    public JobSchedulerBuilder(SchedulerConfig config) {
        this.config = config;
    }

    public JobSchedulerBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public JobSchedulerBuilder executor(JobExecutor executor) {
        this.executor = executor;
        return this;
    }

    public JobSchedulerBuilder queueHealthProvider(QueueHealthProvider queueHealthProvider) {
        this.queueHealthProvider = queueHealthProvider;
        return this;
    }

    public JobSchedulerBuilder store(KeyValueStore store) {
        this.store = store;
        return this;
    }

    public JobSchedulerBuilder batchProcessor(BatchProcessor batchProcessor) {
        this.batchProcessor = batchProcessor;
        return this;
    }

    public JobSchedulerBuilder scheduleCalculator(ScheduleCalculator scheduleCalculator) {
        this.scheduleCalculator = scheduleCalculator;
        return this;
    }

    public JobSchedulerBuilder systemLoadProvider(SystemLoadProvider systemLoadProvider) {
        this.systemLoadProvider = systemLoadProvider;
        return this;
    }

    public JobSchedulerBuilder timer(TaskTimer timer) {
        this.timer = timer;
        return this;
    }

    public DefaultJobScheduler build() {
        QueueConfigRegistry queueConfigs = new QueueConfigRegistry(config.queues());
        List<String> queueNames = queueConfigs.queueNames();

        JobExecutor jobExecutor = executor != null ? executor : new InMemoryJobExecutor(queueNames, clock);
        QueueHealthProvider health = queueHealthProvider;
        if (health == null) {
            if (!(jobExecutor instanceof QueueHealthProvider provider)) {
                throw new IllegalStateException("A QueueHealthProvider is required for executor "
                        + jobExecutor.getClass().getName());
            }
            health = provider;
        }
        KeyValueStore kvStore = store != null ? store : new InMemoryKeyValueStore(clock);
        BatchProcessor batches = batchProcessor != null ? batchProcessor : new InMemoryBatchProcessor();
        ScheduleCalculator cron = scheduleCalculator != null
                ? scheduleCalculator
                : new CronUtilsScheduleCalculator(clock.getZone());
        SystemLoadProvider load = systemLoadProvider != null ? systemLoadProvider : new OperatingSystemLoadProvider();
        TaskTimer taskTimer = timer != null ? timer : new ScheduledExecutorTaskTimer(config.name());

        ConditionEvaluator conditionEvaluator = new DefaultConditionEvaluator(new DefaultVariableResolver());
        StatsCollector stats = new StatsCollector(queueNames, clock);
        ExecutionResultTracker results = new ExecutionResultTracker();

        JobValidator validator = new JobValidator(config.queueNames(), cron, conditionEvaluator);
        DefaultJobRegistry registry = new DefaultJobRegistry(kvStore, validator, new JobConfigCodec(),
                config.jobTtlSeconds(), clock);

        FairnessController fairness = new FairnessController(new StarvationTracker(clock.instant()),
                new RateLimiter(clock));
        PriorityCalculator priorities = new PriorityCalculator(fairness);
        JobDispatcher dispatcher = new JobDispatcher(queueConfigs, health, priorities, fairness,
                jobExecutor, results, stats, config, clock);

        JobConditionEvaluator conditions = new JobConditionEvaluator(results, health, load, conditionEvaluator,
                new EvaluationContextFactory(clock), stats, clock);
        ScheduledTaskRegistry tasks = new ScheduledTaskRegistry();
        DependencyIndex dependencies = new DependencyIndex();

        StrategyDispatcher strategies = new StrategyDispatcher(List.of(
                new ImmediateStrategyHandler(dispatcher),
                new DelayedStrategyHandler(dispatcher, registry, taskTimer, tasks, clock),
                new RecurringStrategyHandler(dispatcher, registry, cron, results, taskTimer, tasks, clock),
                new ConditionalStrategyHandler(dispatcher, registry, conditions, dependencies, taskTimer, tasks,
                        Duration.ofMillis(config.conditionCheckIntervalMs())),
                new BatchStrategyHandler(batches, dispatcher, registry, clock)
        ), tasks, dependencies);

        return new DefaultJobScheduler(config, registry, strategies, queueConfigs, results, stats, taskTimer, clock);
    }
}
