package com.sunny.conduit.job.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.job.core.spi.ConditionStateProvider;
import com.sunny.conduit.job.core.spi.ExecutionListener;
import com.sunny.conduit.job.core.spi.JobRunner;
import com.sunny.conduit.job.core.strategy.retry.BackoffStrategy;
import com.sunny.conduit.job.core.strategy.retry.RetryPolicy;
import com.sunny.conduit.job.scheduler.SchedulerProperties;
import com.sunny.conduit.job.scheduler.TriggerScheduler;
import com.sunny.conduit.job.scheduler.store.MybatisExecutionStore;
import com.sunny.conduit.job.scheduler.store.mapper.TriggerExecutionMapper;
import com.sunny.conduit.job.scheduler.store.mapper.TriggerMapper;
import com.sunny.conduit.job.server.condition.JdbcConditionStateProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 调度器配置
 * <p>
 * 读取 conduit.scheduler.* 组装 SchedulerProperties，创建执行存储与调度器。
 * 调度器的启停由 SchedulerLifecycleService 负责
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
@Configuration
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Value("${conduit.scheduler.poll-interval-ms:10000}")
    private long pollIntervalMs;

    @Value("${conduit.scheduler.max-workers:10}")
    private int maxWorkers;

    @Value("${conduit.scheduler.batch-size:200}")
    private int batchSize;

    @Value("${conduit.scheduler.job-timeout-ms:300000}")
    private long jobTimeoutMs;

    @Value("${conduit.scheduler.shutdown-grace-ms:30000}")
    private long shutdownGraceMs;

    @Value("${conduit.scheduler.condition-recheck-ms:60000}")
    private long conditionRecheckMs;

    @Value("${conduit.scheduler.zone:Asia/Shanghai}")
    private String zone;

    @Value("${conduit.scheduler.retry.max-attempts:3}")
    private int retryMaxAttempts;

    @Value("${conduit.scheduler.retry.backoff-base-ms:10000}")
    private long retryBackoffBaseMs;

    @Value("${conduit.scheduler.retry.max-backoff-ms:600000}")
    private long retryMaxBackoffMs;

    @Value("${conduit.scheduler.retry.strategy:exponential}")
    private String retryStrategy;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SchedulerProperties schedulerProperties() {
        RetryPolicy retryPolicy = new RetryPolicy(retryMaxAttempts, retryBackoffBaseMs, retryMaxBackoffMs,
                BackoffStrategy.of(retryStrategy));
        SchedulerProperties properties = new SchedulerProperties(pollIntervalMs, maxWorkers, batchSize,
                jobTimeoutMs, shutdownGraceMs, conditionRecheckMs, ZoneId.of(zone), retryPolicy);
        log.info("调度器配置: pollIntervalMs={}, maxWorkers={}, batchSize={}, jobTimeoutMs={}, zone={}, "
                        + "retryMaxAttempts={}, retryStrategy={}",
                properties.pollIntervalMs(), properties.maxWorkers(), properties.batchSize(),
                properties.jobTimeoutMs(), properties.zone(), retryPolicy.maxAttempts(), retryStrategy);
        return properties;
    }

    /**
     * 条件触发器的观测源为同库中的观测表
     */
    @Bean
    public ConditionStateProvider conditionStateProvider(JdbcTemplate jdbcTemplate) {
        return new JdbcConditionStateProvider(jdbcTemplate);
    }

    @Bean
    public MybatisExecutionStore executionStore(TriggerMapper triggerMapper,
                                                TriggerExecutionMapper executionMapper,
                                                ObjectMapper objectMapper,
                                                Clock clock) {
        return new MybatisExecutionStore(triggerMapper, executionMapper, objectMapper, clock);
    }

    @Bean
    public TriggerScheduler triggerScheduler(MybatisExecutionStore executionStore,
                                             JobRunner jobRunner,
                                             SchedulerProperties schedulerProperties,
                                             ConditionStateProvider conditionStateProvider,
                                             ExecutionListener executionListener,
                                             ObjectMapper objectMapper,
                                             Clock clock) {
        return new TriggerScheduler(executionStore, jobRunner, schedulerProperties, conditionStateProvider,
                executionListener, objectMapper, clock);
    }
}
