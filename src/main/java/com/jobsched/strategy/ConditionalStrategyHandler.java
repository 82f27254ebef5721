package com.jobsched.strategy;

import com.jobsched.condition.JobConditionEvaluator;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;
import com.jobsched.exception.DispatchException;
import com.jobsched.registry.JobRegistry;
import com.jobsched.spi.TaskTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Re-checks a conditional job periodically and releases it to the immediate path once
 * its condition holds. A job is released at most once.
 */
public class ConditionalStrategyHandler implements StrategyHandler {

    private static final Logger log = LoggerFactory.getLogger(ConditionalStrategyHandler.class);

    /**
     * Metadata flag set when the job is released, so a restart does not release it again.
     */
    public static final String RELEASED_KEY = "conditionReleased";

    private final JobDispatcher dispatcher;
    private final JobRegistry registry;
    private final JobConditionEvaluator conditionEvaluator;
    private final DependencyIndex dependencies;
    private final TaskTimer timer;
    private final ScheduledTaskRegistry tasks;
    private final Duration checkInterval;

    public ConditionalStrategyHandler(JobDispatcher dispatcher, JobRegistry registry,
                                      JobConditionEvaluator conditionEvaluator, DependencyIndex dependencies,
                                      TaskTimer timer, ScheduledTaskRegistry tasks, Duration checkInterval) {
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.conditionEvaluator = conditionEvaluator;
        this.dependencies = dependencies;
        this.timer = timer;
        this.tasks = tasks;
        this.checkInterval = checkInterval;
    }

    @Override
    public SchedulingStrategy strategy() {
        return SchedulingStrategy.CONDITIONAL;
    }

    @Override
    public void schedule(ScheduledJobConfig job) {
        String jobId = job.id();
        dependencies.register(jobId, job.condition().dependencies());
        tasks.register(TaskKind.CONDITIONAL, jobId, timer.scheduleAtFixedRate(() -> check(jobId), checkInterval));
        log.debug("Conditional job {} armed, checking every {}ms", jobId, checkInterval.toMillis());
    }

    @Override
    public void restore(ScheduledJobConfig job) {
        if (isReleased(job)) {
            log.debug("Conditional job {} was already released, not re-arming", job.id());
            return;
        }
        schedule(job);
    }

    public static boolean isReleased(ScheduledJobConfig job) {
        return Boolean.TRUE.equals(job.metadata().get(RELEASED_KEY));
    }

    void check(String jobId) {
        Optional<ScheduledJobConfig> current = registry.get(jobId);
        if (current.isEmpty()) {
            tasks.cancel(TaskKind.CONDITIONAL, jobId);
            dependencies.remove(jobId);
            return;
        }
        if (!conditionEvaluator.checkJobCondition(current.get())) {
            return;
        }
        // only the caller that removes the periodic check releases the job
        if (!tasks.cancel(TaskKind.CONDITIONAL, jobId)) {
            return;
        }
        dependencies.remove(jobId);
        ScheduledJobConfig released = registry.updateMetadata(jobId, RELEASED_KEY, true).orElse(current.get());
        log.info("Conditional job {} released", jobId);
        try {
            dispatcher.dispatch(released);
        } catch (DispatchException e) {
            log.debug("Conditional job {} released with a failed dispatch", jobId);
        }
    }
}
