package com.sunny.conduit.job.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.job.core.strategy.retry.BackoffStrategy;
import com.sunny.conduit.job.realtime.broker.BrokerBridge;
import com.sunny.conduit.job.realtime.broker.TenantSubscriptionRegistry;
import com.sunny.conduit.job.realtime.hub.EventHub;
import com.sunny.conduit.job.server.publish.KafkaExecutionEventPublisher;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Kafka 配置
 * <p>
 * 执行事件发布到租户 Topic，实时端按租户订阅。
 * 每个进程使用独立的消费组，从最新位置开始消费，断线期间的消息不补发
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
@Configuration
@ConditionalOnProperty(name = "conduit.broker.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    private static final Logger log = LoggerFactory.getLogger(KafkaConfig.class);

    @Value("${conduit.broker.bootstrap-servers:127.0.0.1:9092}")
    private String bootstrapServers;

    @Value("${conduit.broker.group-prefix:conduit-realtime}")
    private String groupPrefix;

    @Value("${conduit.broker.poll-timeout-ms:1000}")
    private long pollTimeoutMs;

    @Value("${conduit.broker.reconnect-backoff-base-ms:1000}")
    private long reconnectBackoffBaseMs;

    @Value("${conduit.broker.reconnect-backoff-max-ms:30000}")
    private long reconnectBackoffMaxMs;

    private final String instanceId = UUID.randomUUID().toString();

    @Bean(destroyMethod = "close")
    public Producer<String, String> executionEventProducer() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "1");
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
        log.info("初始化 Kafka Producer: bootstrapServers={}", bootstrapServers);
        return new KafkaProducer<>(props);
    }

    @Bean
    public KafkaExecutionEventPublisher executionEventPublisher(Producer<String, String> executionEventProducer,
                                                                ObjectMapper objectMapper,
                                                                Clock clock) {
        return new KafkaExecutionEventPublisher(executionEventProducer, objectMapper, clock);
    }

    /**
     * 桥接在租户第一个连接注册时才创建，EventHub 延迟获取
     */
    @Bean(destroyMethod = "closeAll")
    public TenantSubscriptionRegistry tenantSubscriptionRegistry(ObjectProvider<EventHub> eventHubProvider,
                                                                 ObjectMapper objectMapper) {
        Supplier<Consumer<String, String>> consumerFactory = this::createConsumer;
        BackoffStrategy backoff = BackoffStrategy.EXPONENTIAL;
        Duration pollTimeout = Duration.ofMillis(pollTimeoutMs);
        return new TenantSubscriptionRegistry(tenantId -> new BrokerBridge(tenantId, consumerFactory,
                eventHubProvider.getObject(), objectMapper, pollTimeout, backoff,
                reconnectBackoffBaseMs, reconnectBackoffMaxMs));
    }

    private Consumer<String, String> createConsumer() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupPrefix + "-" + instanceId);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, true);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        return new KafkaConsumer<>(props);
    }
}
