package com.jobsched.strategy;

import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;
import com.jobsched.exception.DispatchException;
import com.jobsched.registry.JobRegistry;
import com.jobsched.spi.TaskTimer;
import com.jobsched.spi.TimerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Arms a one-shot timer that enters the immediate path at the job's fire time.
 */
public class DelayedStrategyHandler implements StrategyHandler {

    private static final Logger log = LoggerFactory.getLogger(DelayedStrategyHandler.class);

    private final JobDispatcher dispatcher;
    private final JobRegistry registry;
    private final TaskTimer timer;
    private final ScheduledTaskRegistry tasks;
    private final Clock clock;
    private final Object armLock = new Object();

    public DelayedStrategyHandler(JobDispatcher dispatcher, JobRegistry registry, TaskTimer timer,
                                  ScheduledTaskRegistry tasks, Clock clock) {
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.timer = timer;
        this.tasks = tasks;
        this.clock = clock;
    }

    @Override
    public SchedulingStrategy strategy() {
        return SchedulingStrategy.DELAYED;
    }

    @Override
    public void schedule(ScheduledJobConfig job) {
        Instant executeAt = job.resolveExecuteAt();
        Duration delay = Duration.between(clock.instant(), executeAt);
        arm(job.id(), delay.isNegative() ? Duration.ZERO : delay);
        log.debug("Delayed job {} armed for {}", job.id(), executeAt);
    }

    @Override
    public void restore(ScheduledJobConfig job) {
        Instant executeAt = job.resolveExecuteAt();
        if (!executeAt.isAfter(clock.instant())) {
            log.warn("Delayed job {} missed its fire time {} while the scheduler was down", job.id(), executeAt);
            return;
        }
        schedule(job);
    }

    private void arm(String jobId, Duration delay) {
        AtomicReference<TimerHandle> self = new AtomicReference<>();
        synchronized (armLock) {
            self.set(timer.schedule(() -> {
                synchronized (armLock) {
                    tasks.release(TaskKind.SCHEDULED, jobId, self.get());
                }
                fire(jobId);
            }, delay));
            tasks.register(TaskKind.SCHEDULED, jobId, self.get());
        }
    }

    private void fire(String jobId) {
        registry.get(jobId).ifPresentOrElse(job -> {
            try {
                dispatcher.dispatch(job);
            } catch (DispatchException e) {
                // recorded by the dispatcher, nobody to rethrow to
                log.debug("Delayed job {} fired with a failed dispatch", jobId);
            }
        }, () -> log.debug("Delayed job {} fired after removal, skipping", jobId));
    }
}
