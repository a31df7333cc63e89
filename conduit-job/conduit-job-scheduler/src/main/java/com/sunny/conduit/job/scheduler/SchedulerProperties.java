package com.sunny.conduit.job.scheduler;

import com.sunny.conduit.job.core.common.Constants;
import com.sunny.conduit.job.core.schedule.ScheduleUtils;
import com.sunny.conduit.job.core.strategy.retry.BackoffStrategy;
import com.sunny.conduit.job.core.strategy.retry.RetryPolicy;

import java.time.ZoneId;

/**
 * 调度器配置
 *
 * @param pollIntervalMs  轮询间隔（毫秒）
 * @param maxWorkers      最大并发执行数
 * @param batchSize       单轮最多处理的到期触发器数
 * @param jobTimeoutMs    默认任务超时（毫秒）
 * @param shutdownGraceMs 停止时等待在途执行的宽限期（毫秒）
 * @param errorRecheckMs  规则求值失败后的复查间隔（毫秒）
 * @param zone            Cron 计算时区
 * @param retryPolicy     默认重试策略，触发器可覆盖次数与基础间隔
 * @author SunnyX6
 * @date 2026-03-05
 */
public record SchedulerProperties(
        long pollIntervalMs,
        int maxWorkers,
        int batchSize,
        long jobTimeoutMs,
        long shutdownGraceMs,
        long errorRecheckMs,
        ZoneId zone,
        RetryPolicy retryPolicy
) {

    public SchedulerProperties {
        pollIntervalMs = pollIntervalMs > 0 ? pollIntervalMs : Constants.DEFAULT_POLL_INTERVAL_MS;
        maxWorkers = maxWorkers > 0 ? maxWorkers : Constants.DEFAULT_MAX_WORKERS;
        batchSize = batchSize > 0 ? batchSize : Constants.DEFAULT_POLL_BATCH_SIZE;
        jobTimeoutMs = jobTimeoutMs > 0 ? jobTimeoutMs : Constants.DEFAULT_JOB_TIMEOUT_MS;
        shutdownGraceMs = Math.max(0, shutdownGraceMs);
        errorRecheckMs = errorRecheckMs > 0 ? errorRecheckMs : Constants.DEFAULT_ERROR_RECHECK_MS;
        zone = zone == null ? ScheduleUtils.DEFAULT_ZONE : zone;
        retryPolicy = retryPolicy == null
                ? new RetryPolicy(Constants.DEFAULT_MAX_ATTEMPTS, Constants.DEFAULT_BACKOFF_BASE_MS,
                Constants.DEFAULT_MAX_BACKOFF_MS, BackoffStrategy.EXPONENTIAL)
                : retryPolicy;
    }

    public static SchedulerProperties defaults() {
        return new SchedulerProperties(0, 0, 0, 0, Constants.DEFAULT_SHUTDOWN_GRACE_MS, 0, null, null);
    }
}
