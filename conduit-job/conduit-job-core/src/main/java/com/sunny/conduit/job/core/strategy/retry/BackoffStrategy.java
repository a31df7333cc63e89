package com.sunny.conduit.job.core.strategy.retry;

import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 重试退避策略
 * <p>
 * 退避时长只依赖尝试序号与基础间隔，调用方负责上限与次数控制
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
@FunctionalInterface
public interface BackoffStrategy {

    /**
     * 计算第 attempt 次失败后的等待时长
     *
     * @param attempt      失败的尝试序号（从 1 开始）
     * @param baseInterval 基础间隔（毫秒）
     * @return 延迟时间（毫秒）
     */
    long calculateDelay(int attempt, long baseInterval);

    /**
     * 固定间隔
     */
    BackoffStrategy FIXED = (attempt, baseInterval) -> baseInterval;

    /**
     * 线性增长：baseInterval * attempt
     */
    BackoffStrategy LINEAR = (attempt, baseInterval) -> baseInterval * Math.max(1, attempt);

    /**
     * 指数退避：baseInterval * 2^(attempt-1)
     */
    BackoffStrategy EXPONENTIAL = (attempt, baseInterval) -> {
        if (baseInterval <= 0) {
            return 0;
        }
        int shift = Math.min(Math.max(0, attempt - 1), 62);
        long delay = baseInterval << shift;
        // 溢出
        if (delay <= 0 || (delay >> shift) != baseInterval) {
            return Long.MAX_VALUE;
        }
        return delay;
    };

    /**
     * 带抖动的指数退避：指数间隔 * (0.5 ~ 1.5)
     */
    BackoffStrategy EXPONENTIAL_JITTER = (attempt, baseInterval) -> {
        long baseDelay = EXPONENTIAL.calculateDelay(attempt, baseInterval);
        if (baseDelay == Long.MAX_VALUE) {
            return baseDelay;
        }
        double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
        return (long) (baseDelay * jitter);
    };

    /**
     * 按名称解析策略，用于配置项 fixed / linear / exponential / exponential_jitter
     */
    static BackoffStrategy of(String name) {
        if (name == null || name.isBlank()) {
            return EXPONENTIAL;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "fixed" -> FIXED;
            case "linear" -> LINEAR;
            case "exponential" -> EXPONENTIAL;
            case "exponential_jitter", "exponential-jitter" -> EXPONENTIAL_JITTER;
            default -> throw new IllegalArgumentException("未知的退避策略: " + name);
        };
    }
}
