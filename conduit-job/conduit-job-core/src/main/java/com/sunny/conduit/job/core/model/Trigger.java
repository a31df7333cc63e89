package com.sunny.conduit.job.core.model;

import com.sunny.conduit.job.core.enums.TriggerKind;
import com.sunny.conduit.job.core.enums.TriggerStatus;

/**
 * 触发器
 * <p>
 * 由任务配置创建，nextRunAt、failedAttempts、lastError、watermark 只由调度器修改
 *
 * @param id             触发器 ID
 * @param tenantId       租户 ID
 * @param name           名称
 * @param kind           触发器类型
 * @param status         状态
 * @param nextRunAt      下次可运行时间（毫秒）
 * @param rule           触发规则
 * @param job            关联任务
 * @param maxAttempts    最大尝试次数（含首次）
 * @param backoffBaseMs  退避基础间隔（毫秒）
 * @param timeoutMs      执行超时（毫秒），小于等于 0 时使用全局配置
 * @param failedAttempts 当前这一轮已连续失败的次数
 * @param lastError      最近一次错误
 * @param watermark      条件触发器已消费的观测水位，只有更新的观测才参与求值
 * @author SunnyX6
 * @date 2026-03-03
 */
public record Trigger(
        long id,
        String tenantId,
        String name,
        TriggerKind kind,
        TriggerStatus status,
        long nextRunAt,
        TriggerRule rule,
        TriggerJob job,
        int maxAttempts,
        long backoffBaseMs,
        long timeoutMs,
        int failedAttempts,
        String lastError,
        long watermark
) {

    public long jobId() {
        return job.jobId();
    }

    /**
     * 本次分发的尝试序号
     */
    public int nextAttempt() {
        return failedAttempts + 1;
    }

    public Trigger withNextRunAt(long nextRunAt) {
        return new Trigger(id, tenantId, name, kind, status, nextRunAt, rule, job,
                maxAttempts, backoffBaseMs, timeoutMs, failedAttempts, lastError, watermark);
    }
}
