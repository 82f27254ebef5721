package com.jobsched.stats;

import com.jobsched.core.ExecutionStatus;
import com.jobsched.core.JobPriority;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sole writer of {@link SchedulingStats}.
 * Every mutation happens under the collector's monitor, so a snapshot never shows a
 * half-applied transition.
 */
public class StatsCollector {

    private static final Logger log = LoggerFactory.getLogger(StatsCollector.class);

    /**
     * Trend dead band, as a fraction of outcomes.
     */
    static final double TREND_THRESHOLD = 0.05;

    private final Clock clock;

    private long totalScheduled;
    private long totalExecuted;
    private long totalFailed;
    private final RunningAverage executionTime = new RunningAverage();

    private final Map<JobPriority, TierCounters> byPriority = new EnumMap<>(JobPriority.class);
    private final Map<SchedulingStrategy, StrategyCounters> byStrategy = new EnumMap<>(SchedulingStrategy.class);
    private final Map<String, QueueCounters> queues = new LinkedHashMap<>();

    private Instant lastSweep;

    public StatsCollector(Collection<String> queueNames, Clock clock) {
        this.clock = clock;
        for (JobPriority priority : JobPriority.values()) {
            byPriority.put(priority, new TierCounters());
        }
        for (SchedulingStrategy strategy : SchedulingStrategy.values()) {
            byStrategy.put(strategy, new StrategyCounters());
        }
        for (String queue : queueNames) {
            queues.put(queue, new QueueCounters());
        }
        this.lastSweep = clock.instant();
    }

    public synchronized void recordScheduled(ScheduledJobConfig job) {
        totalScheduled++;
        byPriority.get(job.priority()).scheduled++;
        byStrategy.get(job.strategy()).scheduled++;
    }

    /**
     * Count a successful handoff to the executor.
     *
     * @param waitMs Time between job creation and this dispatch
     */
    public synchronized void recordExecuted(ScheduledJobConfig job, long waitMs) {
        totalExecuted++;
        TierCounters tier = byPriority.get(job.priority());
        tier.executed++;
        tier.waitTime.add(Math.max(0, waitMs));
        byStrategy.get(job.strategy()).executed++;
        QueueCounters queue = queue(job.queueName());
        queue.succeeded++;
        queue.awaitingOutcome++;
        queue.dispatched++;
    }

    /**
     * Count a dispatch attempt that the executor or batch collaborator rejected.
     */
    public synchronized void recordFailed(ScheduledJobConfig job) {
        totalFailed++;
        byPriority.get(job.priority()).failed++;
        byStrategy.get(job.strategy()).failed++;
        queue(job.queueName()).unsuccessful++;
    }

    /**
     * Fold a worker-reported outcome into the running averages and the queue error rate.
     * The outcome takes the place of a handoff success counted in the same interval.
     * Cancelled outcomes carry no quality signal and only contribute their duration.
     */
    public synchronized void recordOutcome(ScheduledJobConfig job, ExecutionStatus status, Long durationMs) {
        QueueCounters queue = queue(job.queueName());
        if (durationMs != null && durationMs >= 0) {
            executionTime.add(durationMs);
            byPriority.get(job.priority()).executionTime.add(durationMs);
            queue.processingTime.add(durationMs);
        }
        if (status != ExecutionStatus.CANCELLED && queue.awaitingOutcome > 0) {
            queue.awaitingOutcome--;
            queue.succeeded--;
        }
        switch (status) {
            case COMPLETED -> queue.succeeded++;
            case FAILED, TIMEOUT -> queue.unsuccessful++;
            case CANCELLED -> {
            }
        }
    }

    public synchronized void recordBacklog(String queueName, long backlog) {
        queue(queueName).backlog = Math.max(0, backlog);
    }

    /**
     * Recompute throughput, error rate and trend of every queue from the outcomes seen since the
     * previous sweep, then start a new interval.
     */
    public synchronized void sweepQueueHealth() {
        Instant now = clock.instant();
        long elapsedMs = Math.max(1, Duration.between(lastSweep, now).toMillis());
        for (Map.Entry<String, QueueCounters> entry : queues.entrySet()) {
            QueueCounters queue = entry.getValue();
            long outcomes = queue.succeeded + queue.unsuccessful;

            queue.throughput = queue.dispatched * 60_000.0 / elapsedMs;
            if (outcomes > 0) {
                double fraction = (double) queue.succeeded / outcomes;
                queue.errorRate = 1 - fraction;
                queue.trend = trend(queue.baseline, fraction);
                queue.baseline = fraction;
            } else {
                queue.errorRate = 0;
                queue.trend = QueueTrend.STABLE;
            }
            log.debug("Queue health swept: queue={}, throughput={}/min, errorRate={}, trend={}",
                    entry.getKey(), queue.throughput, queue.errorRate, queue.trend);

            queue.succeeded = 0;
            queue.awaitingOutcome = 0;
            queue.unsuccessful = 0;
            queue.dispatched = 0;
        }
        lastSweep = now;
    }

    static QueueTrend trend(Double baseline, double fraction) {
        if (baseline == null) {
            return QueueTrend.STABLE;
        }
        double change = fraction - baseline;
        if (change > TREND_THRESHOLD) {
            return QueueTrend.IMPROVING;
        }
        if (change < -TREND_THRESHOLD) {
            return QueueTrend.DECLINING;
        }
        return QueueTrend.STABLE;
    }

    public synchronized SchedulingStats snapshot() {
        Map<JobPriority, PriorityStats> priorities = new EnumMap<>(JobPriority.class);
        byPriority.forEach((priority, c) -> priorities.put(priority, new PriorityStats(
                c.scheduled, c.executed, c.failed, c.waitTime.value(), c.executionTime.value())));

        Map<SchedulingStrategy, StrategyStats> strategies = new EnumMap<>(SchedulingStrategy.class);
        byStrategy.forEach((strategy, c) -> strategies.put(strategy,
                new StrategyStats(c.scheduled, c.executed, c.failed)));

        Map<String, QueueHealth> health = new LinkedHashMap<>();
        queues.forEach((name, q) -> health.put(name, new QueueHealth(
                q.backlog, q.processingTime.value(), q.errorRate, q.throughput, q.trend)));

        return new SchedulingStats(totalScheduled, totalExecuted, totalFailed, executionTime.value(),
                priorities, strategies, health);
    }

    private QueueCounters queue(String queueName) {
        return queues.computeIfAbsent(queueName, name -> new QueueCounters());
    }

    private static final class RunningAverage {
        private long count;
        private double mean;

        void add(double sample) {
            count++;
            mean += (sample - mean) / count;
        }

        double value() {
            return mean;
        }
    }

    private static final class TierCounters {
        long scheduled;
        long executed;
        long failed;
        final RunningAverage waitTime = new RunningAverage();
        final RunningAverage executionTime = new RunningAverage();
    }

    private static final class StrategyCounters {
        long scheduled;
        long executed;
        long failed;
    }

    private static final class QueueCounters {
        long backlog;
        final RunningAverage processingTime = new RunningAverage();

        // current interval
        long dispatched;
        long succeeded;
        long awaitingOutcome;
        long unsuccessful;

        // last sweep
        double throughput;
        double errorRate;
        QueueTrend trend = QueueTrend.STABLE;
        Double baseline;
    }
}
