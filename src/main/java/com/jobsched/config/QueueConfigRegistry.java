package com.jobsched.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live queue configurations. The set of queues is fixed at construction;
 * individual configurations can be replaced through {@link #update(String, PriorityQueueConfigPatch)}.
 */
public class QueueConfigRegistry {

    private static final Logger log = LoggerFactory.getLogger(QueueConfigRegistry.class);

    private final Map<String, PriorityQueueConfig> configs = new ConcurrentHashMap<>();
    private final List<String> queueNames;

    public QueueConfigRegistry(List<PriorityQueueConfig> queues) {
        for (PriorityQueueConfig queue : queues) {
            configs.put(queue.queueName(), queue);
        }
        this.queueNames = queues.stream().map(PriorityQueueConfig::queueName).toList();
    }

    public Optional<PriorityQueueConfig> get(String queueName) {
        return queueName == null ? Optional.empty() : Optional.ofNullable(configs.get(queueName));
    }

    /**
     * Queue names in configuration order.
     */
    public List<String> queueNames() {
        return queueNames;
    }

    /**
     * Apply a partial update to a known queue. Unknown queues are ignored.
     *
     * @return The new configuration, or empty if the queue is unknown
     * @throws ConfigurationException if the patched configuration is invalid; the old one stays in place
     */
    public Optional<PriorityQueueConfig> update(String queueName, PriorityQueueConfigPatch patch) {
        if (queueName == null || !configs.containsKey(queueName)) {
            log.warn("Ignoring configuration update for unknown queue: {}", queueName);
            return Optional.empty();
        }
        PriorityQueueConfig updated = configs.computeIfPresent(queueName, (name, current) -> current.apply(patch));
        log.info("Updated queue configuration: {}", updated);
        return Optional.ofNullable(updated);
    }
}
