package com.jobsched.adapter.executor;

import com.jobsched.spi.JobExecutor;
import com.jobsched.spi.QueueHealthProvider;
import com.jobsched.spi.QueueSnapshot;
import com.jobsched.spi.SubmitOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local execution queues.
 * Submissions wait until a worker calls {@link #take(String)}; a delayed submission becomes
 * available once its delay has passed. Workers then report back through {@link #complete(String, boolean)}.
 */
public class InMemoryJobExecutor implements JobExecutor, QueueHealthProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobExecutor.class);

    private final Clock clock;
    private final Map<String, QueueState> queues = new LinkedHashMap<>();
    private final Map<String, Submission> active = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryJobExecutor(Collection<String> queueNames, Clock clock) {
        this.clock = clock;
        for (String name : queueNames) {
            queues.put(name, new QueueState());
        }
    }

    @Override
    public synchronized String submit(String queueName, Map<String, Object> payload, SubmitOptions options) {
        QueueState queue = queues.get(queueName);
        if (queue == null) {
            throw new IllegalArgumentException("Unknown queue: " + queueName);
        }
        String executorJobId = queueName + "-" + sequence.incrementAndGet();
        Instant availableAt = clock.instant().plusMillis(Math.max(0, options.delayMs()));
        Submission submission = new Submission(executorJobId, queueName, payload, options, availableAt);
        queue.pending.add(submission);
        queue.submitted.add(submission);
        log.debug("Accepted {} on queue {} (priority={}, delay={}ms)",
                executorJobId, queueName, options.priority(), options.delayMs());
        return executorJobId;
    }

    /**
     * Hand the most urgent available submission of a queue to a worker.
     */
    public synchronized Optional<Submission> take(String queueName) {
        QueueState queue = queues.get(queueName);
        if (queue == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Optional<Submission> next = queue.pending.stream()
                .filter(s -> !s.availableAt().isAfter(now))
                .min(Comparator.comparingInt((Submission s) -> s.options().priority())
                        .thenComparing(Submission::availableAt));
        next.ifPresent(s -> {
            queue.pending.remove(s);
            active.put(s.executorJobId(), s);
        });
        return next;
    }

    public synchronized void complete(String executorJobId, boolean success) {
        Submission submission = active.remove(executorJobId);
        if (submission == null) {
            throw new IllegalArgumentException("No active job " + executorJobId);
        }
        QueueState queue = queues.get(submission.queueName());
        if (success) {
            queue.completed++;
        } else {
            queue.failed++;
        }
    }

    @Override
    public synchronized QueueSnapshot getQueueStats(String queueName) {
        QueueState queue = queues.get(queueName);
        if (queue == null) {
            throw new IllegalArgumentException("Unknown queue: " + queueName);
        }
        Instant now = clock.instant();
        long delayed = queue.pending.stream().filter(s -> s.availableAt().isAfter(now)).count();
        long activeCount = active.values().stream().filter(s -> s.queueName().equals(queueName)).count();
        return new QueueSnapshot(queue.pending.size() - delayed, activeCount, delayed,
                queue.completed, queue.failed);
    }

    /**
     * Every submission ever accepted by a queue, in order.
     */
    public synchronized List<Submission> submissions(String queueName) {
        QueueState queue = queues.get(queueName);
        return queue == null ? List.of() : List.copyOf(queue.submitted);
    }

    public record Submission(
            String executorJobId,
            String queueName,
            Map<String, Object> payload,
            SubmitOptions options,
            Instant availableAt
    ) {
    }

    private static final class QueueState {
        final List<Submission> pending = new ArrayList<>();
        final List<Submission> submitted = new ArrayList<>();
        long completed;
        long failed;
    }
}
