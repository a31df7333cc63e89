package com.sunny.conduit.job.core.spi;

import com.sunny.conduit.job.core.enums.ExecutionStatus;
import com.sunny.conduit.job.core.model.Trigger;
import com.sunny.conduit.job.core.model.TriggerExecution;

import java.util.List;
import java.util.Optional;

/**
 * 执行存储
 * <p>
 * 触发器与执行历史的唯一数据源。调度器依赖 claimTrigger 的比较更新语义
 * 保证同一到期时刻不会被两次分发
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
public interface ExecutionStore {

    /**
     * 查询到期触发器
     * <p>
     * 仅返回 ENABLED 且 nextRunAt &lt;= now 的触发器，按 nextRunAt、id 升序
     *
     * @param now   本轮轮询的当前时间（毫秒）
     * @param limit 最大返回条数
     */
    List<Trigger> listDueTriggers(long now, int limit);

    Optional<Trigger> findTrigger(long triggerId);

    /**
     * 查询触发器正在运行的执行记录，同一触发器最多一条
     */
    Optional<TriggerExecution> getRunningExecution(long triggerId);

    /**
     * 创建 RUNNING 状态的执行记录
     *
     * @param trigger     触发器
     * @param attempt     尝试序号
     * @param startedAt   开始时间（毫秒）
     * @param eventSample 观测数据样本，可为 null
     */
    TriggerExecution createExecution(Trigger trigger, int attempt, long startedAt, String eventSample);

    void updateExecution(long executionId, ExecutionStatus status, String error, Long finishedAt);

    /**
     * 把仍处于 RUNNING 的执行置为 FAILED
     * <p>
     * 用于回收进程退出或崩溃后遗留的执行记录，执行已是终态时不做修改
     *
     * @return 执行仍为 RUNNING 且更新成功时返回 true
     */
    boolean abandonExecution(long executionId, String error, long finishedAt);

    /**
     * 无条件更新下次运行时间
     */
    void updateTriggerNextRun(long triggerId, long nextRunAt);

    /**
     * 比较更新下次运行时间
     *
     * @return 当前值等于 expectedNextRunAt 且更新成功时返回 true
     */
    boolean claimTrigger(long triggerId, long expectedNextRunAt, long nextRunAt);

    /**
     * 更新重试状态
     *
     * @param failedAttempts 连续失败次数
     * @param nextRunAt      下次运行时间，为 null 时保持不变
     * @param lastError      最近错误，为 null 时清空
     */
    void updateTriggerRetryState(long triggerId, int failedAttempts, Long nextRunAt, String lastError);

    /**
     * 推进条件观测水位，只会向前推进
     */
    void advanceWatermark(long triggerId, long watermark);

    /**
     * 记录规则求值错误，触发器保持启用
     */
    void recordEvaluationError(long triggerId, long nextRunAt, String lastError);

    Optional<TriggerExecution> findExecution(long executionId);

    /**
     * 按开始时间倒序查询任务最近的执行记录
     */
    List<TriggerExecution> listRecentExecutions(long jobId, String tenantId, int limit);
}
