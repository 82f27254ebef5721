package com.jobsched.adapter.spring;

import com.jobsched.config.ConfigLoader;
import com.jobsched.config.SchedulerConfig;
import com.jobsched.scheduler.JobScheduler;
import com.jobsched.scheduler.JobSchedulerBuilder;
import com.jobsched.spi.BatchProcessor;
import com.jobsched.spi.JobExecutor;
import com.jobsched.spi.KeyValueStore;
import com.jobsched.spi.QueueHealthProvider;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the job scheduler.
 * Executor, store and batch processor beans declared by the application replace the in-memory adapters.
 */
@Configuration
@ConditionalOnProperty(prefix = "jobsched", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SchedulerAutoConfiguration.class);

    private JobScheduler jobScheduler;

    @Bean
    @ConditionalOnMissingBean
    public SchedulerConfig schedulerConfig(SchedulerProperties properties) {
        log.info("Loading scheduler configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(SchedulerConfig config,
                                     SchedulerProperties properties,
                                     ObjectProvider<JobExecutor> executor,
                                     ObjectProvider<QueueHealthProvider> queueHealthProvider,
                                     ObjectProvider<KeyValueStore> store,
                                     ObjectProvider<BatchProcessor> batchProcessor) {
        log.info("Creating JobScheduler: {}", config.name());
        JobSchedulerBuilder builder = new JobSchedulerBuilder(config);
        executor.ifAvailable(builder::executor);
        queueHealthProvider.ifAvailable(builder::queueHealthProvider);
        store.ifAvailable(builder::store);
        batchProcessor.ifAvailable(builder::batchProcessor);
        this.jobScheduler = builder.build();
        if (properties.isAutoStart()) {
            jobScheduler.start();
        }
        return jobScheduler;
    }

    @PreDestroy
    public void shutdown() {
        if (jobScheduler != null && !jobScheduler.isShutdown()) {
            log.info("Shutting down JobScheduler");
            jobScheduler.shutdown();
        }
    }
}
