package com.sunny.conduit.job.server.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import jakarta.annotation.PreDestroy;
import org.apache.pekko.actor.typed.ActorSystem;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Pekko ActorSystem 配置
 * <p>
 * 单机 ActorSystem，只承载 EventHub 的协调 Actor，基础配置来自 application.conf
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
@Configuration
public class PekkoConfig {

    private static final Logger log = LoggerFactory.getLogger(PekkoConfig.class);

    @Value("${conduit.realtime.actor-system-name:conduit-realtime}")
    private String systemName;

    @Value("${conduit.realtime.pekko.log-level:INFO}")
    private String logLevel;

    private ActorSystem<Void> actorSystem;

    @Bean
    public ActorSystem<Void> actorSystem() {
        log.info("初始化 Pekko ActorSystem: name={}", systemName);

        Config overrides = ConfigFactory.parseMap(Map.of("pekko.loglevel", logLevel));
        Config config = overrides.withFallback(ConfigFactory.load());
        actorSystem = ActorSystem.create(Behaviors.empty(), systemName, config);

        log.info("Pekko ActorSystem 启动成功: {}", actorSystem.name());
        return actorSystem;
    }

    @PreDestroy
    public void shutdown() {
        if (actorSystem != null) {
            log.info("关闭 Pekko ActorSystem...");
            actorSystem.terminate();
            try {
                actorSystem.getWhenTerminated().toCompletableFuture().get();
                log.info("Pekko ActorSystem 已关闭");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("等待 ActorSystem 关闭时被中断");
            } catch (Exception e) {
                log.error("等待 ActorSystem 关闭时出错", e);
            }
        }
    }
}
