package com.jobsched.registry;

import com.jobsched.adapter.cron.CronUtilsScheduleCalculator;
import com.jobsched.adapter.store.InMemoryKeyValueStore;
import com.jobsched.condition.DefaultConditionEvaluator;
import com.jobsched.core.JobPriority;
import com.jobsched.core.RepeatConfig;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;
import com.jobsched.exception.ValidationException;
import com.jobsched.spi.KeyValueStore;
import com.jobsched.support.MutableClock;
import com.jobsched.support.TestJobs;
import com.jobsched.variable.DefaultVariableResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultJobRegistry.
 */
class DefaultJobRegistryTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private JobValidator validator;
    private DefaultJobRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        store = new InMemoryKeyValueStore(clock);
        validator = new JobValidator(Set.of("email", "media"),
                new CronUtilsScheduleCalculator(ZoneOffset.UTC),
                new DefaultConditionEvaluator(new DefaultVariableResolver()));
        registry = new DefaultJobRegistry(store, validator, new JobConfigCodec(), 3600, clock);
    }

    @Test
    @DisplayName("Should assign identity and persist the job")
    void shouldRegisterAndPersist() {
        ScheduledJobConfig job = registry.register(TestJobs.immediate("email", JobPriority.HIGH));

        assertNotNull(job.id());
        assertEquals(clock.instant(), job.createdAt());
        assertEquals(clock.instant(), job.lastModified());
        assertEquals(Optional.of(job), registry.get(job.id()));
        assertTrue(store.get(DefaultJobRegistry.KEY_PREFIX + job.id()).isPresent());
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("Should assign distinct ids")
    void shouldAssignDistinctIds() {
        String first = registry.register(TestJobs.immediate("email", JobPriority.HIGH)).id();
        String second = registry.register(TestJobs.immediate("email", JobPriority.HIGH)).id();
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("A recurring job without a pattern is rejected before anything is written")
    void invalidJobIsNotPersisted() {
        ScheduledJobConfig request = TestJobs.recurring("email", new RepeatConfig(null, null, null, null));

        assertThrows(ValidationException.class, () -> registry.register(request));
        assertEquals(0, registry.size());
        assertTrue(store.listKeysByPrefix(DefaultJobRegistry.KEY_PREFIX).isEmpty());
    }

    @Test
    @DisplayName("Persisted records expire with the configured TTL")
    void persistedRecordsExpire() {
        ScheduledJobConfig job = registry.register(TestJobs.immediate("email", JobPriority.LOW));

        clock.advance(Duration.ofSeconds(3600));

        assertTrue(store.get(DefaultJobRegistry.KEY_PREFIX + job.id()).isEmpty());
        assertTrue(registry.get(job.id()).isPresent());
    }

    @Test
    @DisplayName("Should filter by queue, priority, strategy and tags")
    void shouldFilter() {
        ScheduledJobConfig a = registry.register(TestJobs.request("email").priority(JobPriority.HIGH).tag("vip").build());
        clock.advance(Duration.ofSeconds(1));
        ScheduledJobConfig b = registry.register(TestJobs.delayed("media", 1000));
        clock.advance(Duration.ofSeconds(1));
        ScheduledJobConfig c = registry.register(TestJobs.request("email").tag("bulk").build());

        assertEquals(List.of(a, b, c), registry.list(JobFilter.all()));
        assertEquals(List.of(a, b, c), registry.list(null));
        assertEquals(List.of(a, c), registry.list(JobFilter.byQueue("email")));
        assertEquals(List.of(b), registry.list(JobFilter.byStrategy(SchedulingStrategy.DELAYED)));
        assertEquals(List.of(a), registry.list(new JobFilter(null, JobPriority.HIGH, null, null)));
        assertEquals(List.of(a, c), registry.list(new JobFilter(null, null, null, List.of("vip", "bulk"))));
        assertEquals(List.of(), registry.list(new JobFilter("media", null, SchedulingStrategy.IMMEDIATE, null)));
    }

    @Test
    @DisplayName("Should update metadata and write it through")
    void shouldUpdateMetadata() {
        ScheduledJobConfig job = registry.register(TestJobs.immediate("email", JobPriority.NORMAL));
        clock.advance(Duration.ofMinutes(1));

        ScheduledJobConfig updated = registry.updateMetadata(job.id(), "batchId", "batch_7").orElseThrow();

        assertEquals("batch_7", updated.metadata().get("batchId"));
        assertEquals(clock.instant(), updated.lastModified());
        assertEquals(job.createdAt(), updated.createdAt());
        String json = store.get(DefaultJobRegistry.KEY_PREFIX + job.id()).orElseThrow();
        assertTrue(json.contains("batch_7"));
        assertTrue(registry.updateMetadata("unknown", "k", "v").isEmpty());
    }

    @Test
    @DisplayName("Should remove the job and its record")
    void shouldRemove() {
        ScheduledJobConfig job = registry.register(TestJobs.immediate("email", JobPriority.NORMAL));

        assertTrue(registry.remove(job.id()));
        assertFalse(registry.remove(job.id()));
        assertTrue(registry.get(job.id()).isEmpty());
        assertTrue(store.get(DefaultJobRegistry.KEY_PREFIX + job.id()).isEmpty());
    }

    @Test
    @DisplayName("A store failure does not fail registration")
    void storeFailureIsAbsorbed() {
        KeyValueStore broken = new KeyValueStore() {
            @Override
            public Optional<String> get(String key) {
                throw new IllegalStateException("store down");
            }

            @Override
            public void set(String key, String value, long ttlSeconds) {
                throw new IllegalStateException("store down");
            }

            @Override
            public boolean delete(String key) {
                throw new IllegalStateException("store down");
            }

            @Override
            public List<String> listKeysByPrefix(String prefix) {
                throw new IllegalStateException("store down");
            }
        };
        DefaultJobRegistry fragile = new DefaultJobRegistry(broken, validator, new JobConfigCodec(), 3600, clock);

        ScheduledJobConfig job = fragile.register(TestJobs.immediate("email", JobPriority.NORMAL));

        assertTrue(fragile.get(job.id()).isPresent());
        assertTrue(fragile.remove(job.id()));
    }

    @Test
    @DisplayName("Should reload persisted jobs and skip malformed records")
    void shouldLoadPersisted() {
        ScheduledJobConfig recurring = registry.register(TestJobs.recurring("email", RepeatConfig.of("0 * * * *")));
        registry.updateMetadata(recurring.id(), "recurringFires", 4L);
        store.set(DefaultJobRegistry.KEY_PREFIX + "garbage", "{not json", 0);
        store.set(DefaultJobRegistry.KEY_PREFIX + "other-id", new JobConfigCodec().encode(recurring), 0);
        store.set("unrelated:key", "x", 0);

        DefaultJobRegistry restarted = new DefaultJobRegistry(store, validator, new JobConfigCodec(), 3600, clock);
        List<ScheduledJobConfig> restored = restarted.loadPersisted();

        assertEquals(1, restored.size());
        ScheduledJobConfig job = restarted.get(recurring.id()).orElseThrow();
        assertEquals(SchedulingStrategy.RECURRING, job.strategy());
        assertEquals("0 * * * *", job.repeat().pattern());
        assertEquals(4L, ((Number) job.metadata().get("recurringFires")).longValue());
        assertEquals(recurring.createdAt(), job.createdAt());
    }
}
