package com.sunny.conduit.job.core.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sunny.conduit.job.core.model.TriggerExecution;

/**
 * 任务/执行状态变更事件
 * <p>
 * 同一结构既是 Broker 消息体，也是推送给实时客户端的出站消息，Bridge 只做传输层解码
 *
 * @param type        事件类型
 * @param jobId       任务 ID
 * @param executionId 执行 ID
 * @param triggerId   触发器 ID
 * @param status      执行状态编码
 * @param attempt     尝试序号
 * @param error       错误信息
 * @param timestamp   事件时间（毫秒）
 * @author SunnyX6
 * @date 2026-03-04
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobEvent(
        String type,
        Long jobId,
        Long executionId,
        Long triggerId,
        String status,
        Integer attempt,
        String error,
        long timestamp
) {

    public static final String TYPE_EXECUTION_STARTED = "execution_started";
    public static final String TYPE_EXECUTION_FINISHED = "execution_finished";

    /**
     * 由执行记录生成事件，RUNNING 为 started，终态为 finished
     */
    public static JobEvent of(TriggerExecution execution, long timestamp) {
        String type = execution.status().isTerminal() ? TYPE_EXECUTION_FINISHED : TYPE_EXECUTION_STARTED;
        return new JobEvent(
                type,
                execution.jobId(),
                execution.id(),
                execution.triggerId(),
                execution.status().getCode(),
                execution.attempt(),
                execution.error(),
                timestamp
        );
    }
}
