package com.jobsched.strategy;

import com.jobsched.core.RepeatConfig;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;
import com.jobsched.exception.DispatchException;
import com.jobsched.registry.JobRegistry;
import com.jobsched.spi.ScheduleCalculator;
import com.jobsched.spi.TaskTimer;
import com.jobsched.spi.TimerHandle;
import com.jobsched.stats.ExecutionResultTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fires a job at each cron fire time and re-arms itself until the repeat limit or end date.
 * The fire count is kept in the job's metadata, so it survives a restart.
 */
public class RecurringStrategyHandler implements StrategyHandler {

    private static final Logger log = LoggerFactory.getLogger(RecurringStrategyHandler.class);

    public static final String FIRE_COUNT_KEY = "recurringFires";

    private final JobDispatcher dispatcher;
    private final JobRegistry registry;
    private final ScheduleCalculator scheduleCalculator;
    private final ExecutionResultTracker resultTracker;
    private final TaskTimer timer;
    private final ScheduledTaskRegistry tasks;
    private final Clock clock;
    private final Object armLock = new Object();

    public RecurringStrategyHandler(JobDispatcher dispatcher, JobRegistry registry,
                                    ScheduleCalculator scheduleCalculator, ExecutionResultTracker resultTracker,
                                    TaskTimer timer, ScheduledTaskRegistry tasks, Clock clock) {
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.scheduleCalculator = scheduleCalculator;
        this.resultTracker = resultTracker;
        this.timer = timer;
        this.tasks = tasks;
        this.clock = clock;
    }

    @Override
    public SchedulingStrategy strategy() {
        return SchedulingStrategy.RECURRING;
    }

    @Override
    public void schedule(ScheduledJobConfig job) {
        armNext(job, clock.instant());
    }

    @Override
    public void restore(ScheduledJobConfig job) {
        schedule(job);
    }

    /**
     * Fires recorded for a job.
     */
    public static long fireCount(ScheduledJobConfig job) {
        Object value = job.metadata().get(FIRE_COUNT_KEY);
        return value instanceof Number n ? n.longValue() : 0;
    }

    private void armNext(ScheduledJobConfig job, Instant after) {
        RepeatConfig repeat = job.repeat();
        if (terminated(job, after)) {
            return;
        }
        Optional<Instant> next = scheduleCalculator.nextFireTime(repeat.pattern(), repeat.timezone(), after);
        if (next.isEmpty() || repeat.hasEnded(next.get())) {
            log.info("Recurring job {} terminated: no fire time left before end date", job.id());
            return;
        }
        resultTracker.recordNextExecution(job.id(), next.get());

        String jobId = job.id();
        Instant fireTime = next.get();
        Duration delay = Duration.between(clock.instant(), fireTime);
        AtomicReference<TimerHandle> self = new AtomicReference<>();
        synchronized (armLock) {
            self.set(timer.schedule(() -> {
                synchronized (armLock) {
                    tasks.release(TaskKind.RECURRING, jobId, self.get());
                }
                fire(jobId, fireTime);
            }, delay.isNegative() ? Duration.ZERO : delay));
            tasks.register(TaskKind.RECURRING, jobId, self.get());
        }
        log.debug("Recurring job {} armed for {}", jobId, fireTime);
    }

    private void fire(String jobId, Instant fireTime) {
        Optional<ScheduledJobConfig> current = registry.get(jobId);
        if (current.isEmpty()) {
            log.debug("Recurring job {} fired after removal, skipping", jobId);
            return;
        }
        ScheduledJobConfig job = current.get();
        Instant now = clock.instant();
        if (terminated(job, now)) {
            return;
        }
        try {
            dispatcher.dispatch(job);
        } catch (DispatchException e) {
            // recorded by the dispatcher, the schedule continues
            log.debug("Recurring job {} fired with a failed dispatch", jobId);
        }
        ScheduledJobConfig counted = registry.updateMetadata(jobId, FIRE_COUNT_KEY, fireCount(job) + 1)
                .orElse(null);
        if (counted != null) {
            // a timer running early must not fire the same slot twice
            armNext(counted, now.isAfter(fireTime) ? now : fireTime);
        }
    }

    private boolean terminated(ScheduledJobConfig job, Instant now) {
        RepeatConfig repeat = job.repeat();
        if (repeat.hasEnded(now)) {
            log.info("Recurring job {} terminated: end date {} has passed", job.id(), repeat.endDate());
            return true;
        }
        if (repeat.limitReached(fireCount(job))) {
            log.info("Recurring job {} terminated: repeat limit {} reached", job.id(), repeat.limit());
            return true;
        }
        return false;
    }
}
