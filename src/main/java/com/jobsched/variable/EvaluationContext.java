package com.jobsched.variable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flattened, read-only snapshot that condition expressions are evaluated against.
 * Holds plain values only; nothing in it can reach back into the scheduler.
 */
public final class EvaluationContext {

    private final Map<String, Object> jobVariables;
    private final Map<String, Object> statsVariables;
    private final Map<String, Object> systemVariables;

    public EvaluationContext(Map<String, Object> jobVariables,
                             Map<String, Object> statsVariables,
                             Map<String, Object> systemVariables) {
        this.jobVariables = Collections.unmodifiableMap(new HashMap<>(jobVariables));
        this.statsVariables = Collections.unmodifiableMap(new HashMap<>(statsVariables));
        this.systemVariables = Collections.unmodifiableMap(new HashMap<>(systemVariables));
    }

    public Optional<Object> get(VariableSource source, String name) {
        Map<String, Object> variables = switch (source) {
            case JOB -> jobVariables;
            case STATS -> statsVariables;
            case SYSTEM -> systemVariables;
        };
        return Optional.ofNullable(variables.get(name));
    }

    public Map<String, Object> getJobVariables() {
        return jobVariables;
    }

    public Map<String, Object> getStatsVariables() {
        return statsVariables;
    }

    public Map<String, Object> getSystemVariables() {
        return systemVariables;
    }

    @Override
    public String toString() {
        return "EvaluationContext{" +
                "job=" + jobVariables.keySet() +
                ", stats=" + statsVariables.size() + " values" +
                ", system=" + systemVariables +
                '}';
    }
}
