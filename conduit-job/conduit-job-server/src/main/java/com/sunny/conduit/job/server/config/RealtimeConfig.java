package com.sunny.conduit.job.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.common.utils.JwtUtil;
import com.sunny.conduit.job.core.spi.ExecutionStore;
import com.sunny.conduit.job.core.spi.JobCommandGateway;
import com.sunny.conduit.job.realtime.auth.RealtimeHandshake;
import com.sunny.conduit.job.realtime.hub.EventHub;
import com.sunny.conduit.job.realtime.hub.HubExecutionListener;
import com.sunny.conduit.job.realtime.hub.TenantLifecycleListener;
import com.sunny.conduit.job.realtime.processor.MessageProcessor;
import org.apache.pekko.actor.typed.ActorSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * 实时推送配置
 * <p>
 * EventHub、指令处理与握手认证。Broker 关闭时执行事件直接交给本地 Hub 广播
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
@Configuration
public class RealtimeConfig {

    private static final Logger log = LoggerFactory.getLogger(RealtimeConfig.class);

    @Value("${conduit.realtime.buffer-capacity:256}")
    private int bufferCapacity;

    @Value("${conduit.realtime.delivery-threads:8}")
    private int deliveryThreads;

    @Value("${conduit.realtime.snapshot-limit:20}")
    private int snapshotLimit;

    @Value("${conduit.security.jwt-secret}")
    private String jwtSecret;

    @Value("${conduit.security.jwt-issuer:}")
    private String jwtIssuer;

    @Bean
    public ThreadPoolTaskExecutor realtimeDeliveryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(deliveryThreads);
        executor.setMaxPoolSize(deliveryThreads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("conduit-delivery-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public EventHub eventHub(ActorSystem<Void> actorSystem,
                             ObjectMapper objectMapper,
                             ThreadPoolTaskExecutor realtimeDeliveryExecutor,
                             ObjectProvider<TenantLifecycleListener> subscriptionRegistry) {
        TenantLifecycleListener lifecycleListener = subscriptionRegistry.getIfAvailable(() -> TenantLifecycleListener.NOOP);
        log.info("初始化 EventHub: bufferCapacity={}, brokerSubscription={}",
                bufferCapacity, lifecycleListener != TenantLifecycleListener.NOOP);
        return new EventHub(actorSystem, objectMapper, realtimeDeliveryExecutor, bufferCapacity, lifecycleListener);
    }

    @Bean
    @ConditionalOnProperty(name = "conduit.broker.enabled", havingValue = "false")
    public HubExecutionListener hubExecutionListener(EventHub eventHub, Clock clock) {
        log.info("Broker 未启用，执行事件由本地 Hub 直接广播");
        return new HubExecutionListener(eventHub, clock);
    }

    @Bean
    public MessageProcessor messageProcessor(EventHub eventHub,
                                             JobCommandGateway commandGateway,
                                             ExecutionStore executionStore,
                                             ObjectMapper objectMapper,
                                             Clock clock) {
        return new MessageProcessor(eventHub, commandGateway, executionStore, objectMapper, clock, snapshotLimit);
    }

    @Bean
    public JwtUtil jwtUtil() {
        return new JwtUtil(jwtSecret, jwtIssuer);
    }

    @Bean
    public RealtimeHandshake realtimeHandshake(JwtUtil jwtUtil) {
        return new RealtimeHandshake(jwtUtil);
    }
}
