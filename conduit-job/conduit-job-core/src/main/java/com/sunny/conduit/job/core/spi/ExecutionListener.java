package com.sunny.conduit.job.core.spi;

import com.sunny.conduit.job.core.model.TriggerExecution;

/**
 * 执行状态变更监听
 * <p>
 * 在调度线程或工作线程中同步回调，实现方不应阻塞
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
@FunctionalInterface
public interface ExecutionListener {

    ExecutionListener NOOP = execution -> {
    };

    void onExecutionChanged(TriggerExecution execution);
}
