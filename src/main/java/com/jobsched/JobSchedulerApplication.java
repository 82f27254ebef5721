package com.jobsched;

import com.jobsched.adapter.executor.InMemoryJobExecutor;
import com.jobsched.config.SchedulerConfig;
import com.jobsched.core.ExecutionStatus;
import com.jobsched.core.JobCondition;
import com.jobsched.core.JobPriority;
import com.jobsched.core.ScheduledJobConfig;
import com.jobsched.core.SchedulingStrategy;
import com.jobsched.scheduler.HealthReport;
import com.jobsched.scheduler.JobScheduler;
import com.jobsched.spring.EnableJobScheduler;
import com.jobsched.stats.SchedulingStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.Optional;

/**
 * Example Spring Boot application demonstrating the job scheduler.
 */
@SpringBootApplication
@EnableJobScheduler
public class JobSchedulerApplication {

    private static final Logger log = LoggerFactory.getLogger(JobSchedulerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(JobSchedulerApplication.class, args);
    }

    @Bean
    public InMemoryJobExecutor jobExecutor(SchedulerConfig config) {
        return new InMemoryJobExecutor(config.queueNames(), Clock.systemDefaultZone());
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobsched.demo", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CommandLineRunner demo(JobScheduler scheduler, InMemoryJobExecutor executor) {
        return args -> {
            log.info("=== Job Scheduler Demo Started ===");

            String welcome = scheduler.scheduleJob(ScheduledJobConfig.builder()
                    .name("welcome-email")
                    .queueName("email")
                    .jobType("send-email")
                    .data("to", "demo@example.com")
                    .priority(JobPriority.HIGH)
                    .tag("onboarding")
                    .createdBy("demo")
                    .build());

            // Released only once the welcome email has completed
            String followUp = scheduler.scheduleJob(ScheduledJobConfig.builder()
                    .name("follow-up-notification")
                    .queueName("notifications")
                    .jobType("push")
                    .strategy(SchedulingStrategy.CONDITIONAL)
                    .condition(JobCondition.dependsOn(welcome))
                    .createdBy("demo")
                    .build());

            scheduler.scheduleJob(ScheduledJobConfig.builder()
                    .name("thumbnail-refresh")
                    .queueName("media")
                    .jobType("thumbnail")
                    .strategy(SchedulingStrategy.DELAYED)
                    .delayMs(2_000L)
                    .priority(JobPriority.LOW)
                    .createdBy("demo")
                    .build());

            Optional<InMemoryJobExecutor.Submission> taken = executor.take("email");
            taken.ifPresent(submission -> {
                log.info("Worker picked {} with payload {}", submission.executorJobId(), submission.payload());
                executor.complete(submission.executorJobId(), true);
                scheduler.recordExecutionOutcome(welcome, ExecutionStatus.COMPLETED, 120L, null);
            });
            log.info("Jobs depending on {}: {}", welcome, scheduler.getDependentJobs(welcome));
            log.info("Follow-up {} result so far: {}", followUp, scheduler.getJobExecutionResult(followUp));

            SchedulingStats stats = scheduler.getSchedulingStats();
            log.info("Scheduled={}, executed={}, failed={}",
                    stats.totalJobsScheduled(), stats.totalJobsExecuted(), stats.totalJobsFailed());

            HealthReport health = scheduler.healthCheck();
            log.info("Health: {} (pending timers={}, issues={})",
                    health.status(), health.pendingJobs(), health.issues());
            log.info("=== Job Scheduler Demo Finished ===");
        };
    }
}
