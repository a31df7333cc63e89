package com.sunny.conduit.job.core.strategy.retry;

import com.sunny.conduit.job.core.common.Constants;

/**
 * 重试策略
 * <p>
 * maxAttempts 为总尝试次数（含首次执行），attempt 从 1 开始计数
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
public record RetryPolicy(
        int maxAttempts,
        long backoffBaseMs,
        long maxBackoffMs,
        BackoffStrategy backoffStrategy
) {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        backoffBaseMs = Math.max(0, backoffBaseMs);
        maxBackoffMs = maxBackoffMs <= 0 ? Constants.DEFAULT_MAX_BACKOFF_MS : maxBackoffMs;
        backoffStrategy = backoffStrategy == null ? BackoffStrategy.EXPONENTIAL : backoffStrategy;
    }

    /**
     * 指数退避
     */
    public static RetryPolicy exponential(int maxAttempts, long backoffBaseMs) {
        return new RetryPolicy(maxAttempts, backoffBaseMs, Constants.DEFAULT_MAX_BACKOFF_MS, BackoffStrategy.EXPONENTIAL);
    }

    /**
     * 不重试
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0, Constants.DEFAULT_MAX_BACKOFF_MS, BackoffStrategy.FIXED);
    }

    /**
     * 使用触发器自身的次数与基础间隔，沿用本策略的退避算法与上限
     */
    public RetryPolicy withAttempts(int attempts, long baseMs) {
        return new RetryPolicy(attempts, baseMs, maxBackoffMs, backoffStrategy);
    }

    /**
     * 第 attempt 次尝试失败后是否还能重试
     */
    public boolean canRetry(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * 第 attempt 次尝试失败后的等待时长
     *
     * @return 延迟（毫秒），不可重试时返回 -1
     */
    public long nextDelay(int attempt) {
        if (!canRetry(attempt)) {
            return -1;
        }
        long delay = backoffStrategy.calculateDelay(attempt, backoffBaseMs);
        return Math.min(delay, maxBackoffMs);
    }
}
