package com.sunny.conduit.job.server.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.job.core.message.JobEvent;
import com.sunny.conduit.job.core.model.TriggerExecution;
import com.sunny.conduit.job.core.spi.ExecutionListener;
import com.sunny.conduit.job.realtime.broker.TenantTopics;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 把执行状态变更发布到租户 Topic
 * <p>
 * 以 jobId 作为消息 key，同一任务的事件落在同一分区内保持顺序。
 * 发送是异步的，失败只记录日志
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
public class KafkaExecutionEventPublisher implements ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(KafkaExecutionEventPublisher.class);

    private final Producer<String, String> producer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public KafkaExecutionEventPublisher(Producer<String, String> producer, ObjectMapper objectMapper, Clock clock) {
        this.producer = producer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void onExecutionChanged(TriggerExecution execution) {
        String topic;
        try {
            topic = TenantTopics.topicOf(execution.tenantId());
        } catch (IllegalArgumentException e) {
            log.warn("租户 ID 不能映射为 Topic，跳过发布: executionId={}, tenantId={}",
                    execution.id(), execution.tenantId());
            return;
        }

        JobEvent event = JobEvent.of(execution, clock.millis());
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("执行事件序列化失败: executionId={}", execution.id(), e);
            return;
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, String.valueOf(execution.jobId()), payload);
        try {
            producer.send(record, (metadata, exception) -> {
                if (exception != null) {
                    log.warn("执行事件发布失败: topic={}, executionId={}, status={}, error={}",
                            topic, execution.id(), event.status(), exception.getMessage());
                } else {
                    log.debug("执行事件已发布: topic={}, partition={}, offset={}, executionId={}",
                            topic, metadata.partition(), metadata.offset(), execution.id());
                }
            });
        } catch (KafkaException e) {
            log.warn("执行事件发布失败: topic={}, executionId={}, error={}", topic, execution.id(), e.getMessage());
        }
    }
}
