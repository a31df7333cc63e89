package com.sunny.conduit.job.core.model;

import com.sunny.conduit.job.core.enums.ExecutionStatus;

/**
 * 触发执行记录，每次分发尝试一条
 *
 * @param id          执行 ID
 * @param triggerId   触发器 ID
 * @param jobId       任务 ID
 * @param tenantId    租户 ID
 * @param status      执行状态
 * @param attempt     尝试序号（从 1 开始）
 * @param startedAt   开始时间（毫秒）
 * @param finishedAt  结束时间（毫秒），未结束为 null
 * @param error       错误信息
 * @param eventSample 触发时的观测数据样本（JSON）
 * @author SunnyX6
 * @date 2026-03-03
 */
public record TriggerExecution(
        long id,
        long triggerId,
        long jobId,
        String tenantId,
        ExecutionStatus status,
        int attempt,
        long startedAt,
        Long finishedAt,
        String error,
        String eventSample
) {

    public TriggerExecution finish(ExecutionStatus status, String error, long finishedAt) {
        return new TriggerExecution(id, triggerId, jobId, tenantId, status, attempt, startedAt,
                finishedAt, error, eventSample);
    }
}
