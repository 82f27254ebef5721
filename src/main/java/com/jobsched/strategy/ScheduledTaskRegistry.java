package com.jobsched.strategy;

import com.jobsched.spi.TimerHandle;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Outstanding timer handles keyed by {@link TaskKind#key(String)}.
 */
public class ScheduledTaskRegistry {

    private final ConcurrentMap<String, TimerHandle> handles = new ConcurrentHashMap<>();

    /**
     * Store a handle, cancelling any handle previously stored under the same key.
     */
    public void register(TaskKind kind, String jobId, TimerHandle handle) {
        TimerHandle previous = handles.put(kind.key(jobId), handle);
        if (previous != null && previous != handle) {
            previous.cancel();
        }
    }

    /**
     * Cancel and forget the task. Only the first caller for a given handle gets true.
     */
    public boolean cancel(TaskKind kind, String jobId) {
        TimerHandle handle = handles.remove(kind.key(jobId));
        if (handle == null) {
            return false;
        }
        handle.cancel();
        return true;
    }

    /**
     * Forget a one-shot task that has fired, unless a newer handle replaced it.
     */
    public void release(TaskKind kind, String jobId, TimerHandle handle) {
        handles.remove(kind.key(jobId), handle);
    }

    /**
     * @return true if any task of the job was cancelled
     */
    public boolean cancelAll(String jobId) {
        boolean cancelled = false;
        for (TaskKind kind : TaskKind.values()) {
            cancelled |= cancel(kind, jobId);
        }
        return cancelled;
    }

    public boolean isArmed(TaskKind kind, String jobId) {
        return handles.containsKey(kind.key(jobId));
    }

    public void cancelEverything() {
        handles.values().forEach(TimerHandle::cancel);
        handles.clear();
    }

    Set<String> keys() {
        return Set.copyOf(handles.keySet());
    }

    public int size() {
        return handles.size();
    }
}
