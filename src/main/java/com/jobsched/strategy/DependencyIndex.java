package com.jobsched.strategy;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Reverse lookup from a job to the conditional jobs waiting on it.
 */
public class DependencyIndex {

    private final ConcurrentMap<String, Set<String>> dependents = new ConcurrentHashMap<>();

    public void register(String dependentJobId, Collection<String> dependencies) {
        for (String dependency : dependencies) {
            dependents.computeIfAbsent(dependency, d -> ConcurrentHashMap.newKeySet()).add(dependentJobId);
        }
    }

    public Set<String> dependentsOf(String jobId) {
        Set<String> ids = dependents.get(jobId);
        return ids == null ? Set.of() : Set.copyOf(ids);
    }

    /**
     * Drop every edge of a dependent job.
     */
    public void remove(String dependentJobId) {
        dependents.forEach((dependency, ids) -> {
            ids.remove(dependentJobId);
            dependents.computeIfPresent(dependency, (d, current) -> current.isEmpty() ? null : current);
        });
    }
}
