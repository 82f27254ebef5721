package com.jobsched.config;

import com.jobsched.core.JobPriority;
import com.jobsched.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Loads scheduler configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static SchedulerConfig load(String path) {
        log.info("Loading scheduler configuration from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            return new ClassPathResource(path.substring("classpath:".length()));
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from a YAML stream.
     */
    @SuppressWarnings("unchecked")
    public static SchedulerConfig parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The scheduler section can be at root or under 'scheduler'
        Map<String, Object> section = root.containsKey("scheduler")
                ? (Map<String, Object>) root.get("scheduler")
                : root;

        String name = getString(section, "name", "job-scheduler");
        List<PriorityQueueConfig> queues = parseQueues((List<Map<String, Object>>) section.get("queues"));
        if (queues.isEmpty()) {
            log.warn("No queues configured, using defaults: {}", SchedulerConfig.DEFAULT_QUEUES);
        }

        SchedulerConfig config = new SchedulerConfig(
                name,
                queues,
                getLong(section, "condition-check-interval-ms", SchedulerConfig.DEFAULT_CONDITION_CHECK_INTERVAL_MS),
                getLong(section, "health-sweep-interval-ms", SchedulerConfig.DEFAULT_HEALTH_SWEEP_INTERVAL_MS),
                getLong(section, "job-ttl-seconds", SchedulerConfig.DEFAULT_JOB_TTL_SECONDS),
                getLong(section, "default-timeout-ms", SchedulerConfig.DEFAULT_TIMEOUT_MS),
                getInt(section, "default-retries", SchedulerConfig.DEFAULT_RETRIES)
        );

        log.info("Loaded scheduler configuration '{}' with {} queues, condition checks every {}ms",
                config.name(), config.queues().size(), config.conditionCheckIntervalMs());
        return config;
    }

    @SuppressWarnings("unchecked")
    private static List<PriorityQueueConfig> parseQueues(List<Map<String, Object>> queuesList) {
        if (queuesList == null || queuesList.isEmpty()) {
            return List.of();
        }

        List<PriorityQueueConfig> queues = new ArrayList<>();
        for (int i = 0; i < queuesList.size(); i++) {
            Map<String, Object> queueMap = queuesList.get(i);
            String queueName = getString(queueMap, "name", null);
            if (queueName == null || queueName.isBlank()) {
                throw new ConfigurationException("Queue at position " + i + " has no name");
            }

            Map<JobPriority, PriorityLevelConfig> levels =
                    parseLevels(queueName, (Map<String, Object>) queueMap.get("priority-levels"));
            RateLimitConfig rateLimiting = parseRateLimit((Map<String, Object>) queueMap.get("rate-limiting"));

            queues.add(new PriorityQueueConfig(
                    queueName,
                    levels,
                    getDouble(queueMap, "fairness-ratio", 0.3),
                    getBoolean(queueMap, "starvation-prevention", true),
                    getInt(queueMap, "max-queue-size", 10_000),
                    rateLimiting
            ));
            log.debug("Parsed queue: name={}, levels={}, rateLimiting={}", queueName, levels.size(), rateLimiting);
        }
        return queues;
    }

    @SuppressWarnings("unchecked")
    private static Map<JobPriority, PriorityLevelConfig> parseLevels(String queueName, Map<String, Object> map) {
        Map<JobPriority, PriorityLevelConfig> levels = new EnumMap<>(JobPriority.class);
        if (map == null) {
            return levels;
        }
        Map<JobPriority, PriorityLevelConfig> defaults = PriorityQueueConfig.defaultLevels();
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            JobPriority priority;
            try {
                priority = JobPriority.fromString(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Queue '" + queueName
                        + "' declares unknown priority level '" + entry.getKey() + "'", e);
            }
            Map<String, Object> levelMap = (Map<String, Object>) entry.getValue();
            PriorityLevelConfig fallback = defaults.get(priority);
            if (levelMap == null) {
                levels.put(priority, fallback);
                continue;
            }
            levels.put(priority, new PriorityLevelConfig(
                    getInt(levelMap, "weight", fallback.weight()),
                    getInt(levelMap, "max-concurrency", fallback.maxConcurrency())
            ));
        }
        return levels;
    }

    private static RateLimitConfig parseRateLimit(Map<String, Object> map) {
        if (map == null) {
            return null;
        }
        return new RateLimitConfig(
                getLong(map, "window-ms", 60_000),
                getInt(map, "max-jobs", 1000)
        );
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.parseLong(value.toString());
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        return Double.parseDouble(value.toString());
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
