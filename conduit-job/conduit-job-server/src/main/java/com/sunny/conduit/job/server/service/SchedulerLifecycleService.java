package com.sunny.conduit.job.server.service;

import com.sunny.conduit.job.scheduler.TriggerScheduler;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * 调度器生命周期服务
 * <p>
 * 应用启动后开始轮询，关闭时先停调度再释放其依赖
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
@Service
public class SchedulerLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLifecycleService.class);

    private final TriggerScheduler triggerScheduler;

    @Value("${conduit.scheduler.enabled:true}")
    private boolean enabled;

    public SchedulerLifecycleService(TriggerScheduler triggerScheduler) {
        this.triggerScheduler = triggerScheduler;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("调度器已禁用，只提供实时推送");
            return;
        }
        triggerScheduler.start();
    }

    @PreDestroy
    public void stop() {
        log.info("停止调度器: running={}", triggerScheduler.runningCount());
        triggerScheduler.stop();
    }
}
