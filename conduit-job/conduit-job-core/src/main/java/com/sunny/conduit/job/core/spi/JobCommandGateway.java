package com.sunny.conduit.job.core.spi;

import com.sunny.conduit.job.core.model.TriggerExecution;

/**
 * 手动操作入口
 * <p>
 * 实时通道收到的客户端指令经由此接口进入调度器，租户不匹配按不存在处理
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public interface JobCommandGateway {

    /**
     * 立即执行一次触发器关联的任务
     *
     * @param triggerId 触发器 ID
     * @param tenantId  调用方租户
     * @return 已创建的 RUNNING 执行记录
     */
    TriggerExecution fireNow(long triggerId, String tenantId);

    /**
     * 取消正在运行的执行
     *
     * @param executionId 执行 ID
     * @param tenantId    调用方租户
     */
    void cancel(long executionId, String tenantId);
}
