package com.sunny.conduit.job.realtime.hub;

import com.sunny.conduit.job.core.message.JobEvent;
import com.sunny.conduit.job.core.model.TriggerExecution;
import com.sunny.conduit.job.core.spi.ExecutionListener;

import java.time.Clock;

/**
 * 执行状态直接推送到本进程 Hub
 * <p>
 * 未启用 Broker 时使用，只能送达连在本实例上的客户端
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public class HubExecutionListener implements ExecutionListener {

    private final EventHub eventHub;
    private final Clock clock;

    public HubExecutionListener(EventHub eventHub, Clock clock) {
        this.eventHub = eventHub;
        this.clock = clock;
    }

    @Override
    public void onExecutionChanged(TriggerExecution execution) {
        eventHub.broadcast(execution.tenantId(), JobEvent.of(execution, clock.millis()));
    }
}
