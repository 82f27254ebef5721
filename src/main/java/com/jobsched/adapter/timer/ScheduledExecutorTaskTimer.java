package com.jobsched.adapter.timer;

import com.jobsched.spi.TaskTimer;
import com.jobsched.spi.TimerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * {@link TaskTimer} backed by a single-threaded {@link ScheduledExecutorService}.
 * A task that throws is logged; a periodic task keeps its schedule.
 */
public class ScheduledExecutorTaskTimer implements TaskTimer {

    private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorTaskTimer.class);

    private final ScheduledExecutorService executor;
    private final Set<FutureHandle> armed = ConcurrentHashMap.newKeySet();

    public ScheduledExecutorTaskTimer(String name) {
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, name + "-timer-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public TimerHandle schedule(Runnable task, Duration delay) {
        FutureHandle handle = new FutureHandle();
        arm(handle, () -> executor.schedule(() -> {
            armed.remove(handle);
            runSafely(task);
        }, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS));
        return handle;
    }

    @Override
    public TimerHandle scheduleAtFixedRate(Runnable task, Duration period) {
        long periodMs = Math.max(1, period.toMillis());
        FutureHandle handle = new FutureHandle();
        arm(handle, () -> executor.scheduleAtFixedRate(() -> runSafely(task),
                periodMs, periodMs, TimeUnit.MILLISECONDS));
        return handle;
    }

    @Override
    public void shutdown() {
        armed.forEach(FutureHandle::cancel);
        armed.clear();
        executor.shutdownNow();
    }

    /**
     * Number of tasks still armed.
     */
    int armedCount() {
        return armed.size();
    }

    private void arm(FutureHandle handle, Supplier<ScheduledFuture<?>> scheduling) {
        armed.add(handle);
        try {
            handle.attach(scheduling.get());
        } catch (RejectedExecutionException e) {
            armed.remove(handle);
            throw new IllegalStateException("Timer has been shut down", e);
        }
    }

    private static void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Timer task failed", e);
        }
    }

    private final class FutureHandle implements TimerHandle {
        private ScheduledFuture<?> future;
        private boolean cancelled;

        synchronized void attach(ScheduledFuture<?> scheduled) {
            this.future = scheduled;
            if (cancelled) {
                scheduled.cancel(false);
            }
        }

        @Override
        public synchronized void cancel() {
            cancelled = true;
            armed.remove(this);
            if (future != null) {
                future.cancel(false);
            }
        }

        @Override
        public synchronized boolean isCancelled() {
            return cancelled;
        }
    }
}
