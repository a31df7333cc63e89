package com.sunny.conduit.job.realtime.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.job.core.message.JobEvent;
import com.sunny.conduit.job.core.strategy.retry.BackoffStrategy;
import com.sunny.conduit.job.realtime.hub.EventHub;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 单租户 Broker 桥接
 * <p>
 * 独立线程消费租户 Topic，把解码后的 JobEvent 交给 EventHub 广播。
 * 消费异常时关闭当前 Consumer，按退避等待后重建并重新订阅；
 * 断线期间的消息不补发（最多一次）
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public class BrokerBridge {

    private static final Logger log = LoggerFactory.getLogger(BrokerBridge.class);

    private final String tenantId;
    private final String topic;
    private final Supplier<Consumer<String, String>> consumerFactory;
    private final EventHub eventHub;
    private final ObjectMapper objectMapper;
    private final Duration pollTimeout;
    private final BackoffStrategy reconnectBackoff;
    private final long reconnectBaseMs;
    private final long reconnectMaxMs;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch closeSignal = new CountDownLatch(1);
    private volatile boolean running = false;
    private volatile Consumer<String, String> consumer;
    private Thread pollThread;

    public BrokerBridge(String tenantId,
                        Supplier<Consumer<String, String>> consumerFactory,
                        EventHub eventHub,
                        ObjectMapper objectMapper,
                        Duration pollTimeout,
                        BackoffStrategy reconnectBackoff,
                        long reconnectBaseMs,
                        long reconnectMaxMs) {
        this.tenantId = tenantId;
        this.topic = TenantTopics.topicOf(tenantId);
        this.consumerFactory = consumerFactory;
        this.eventHub = eventHub;
        this.objectMapper = objectMapper;
        this.pollTimeout = pollTimeout;
        this.reconnectBackoff = reconnectBackoff == null ? BackoffStrategy.EXPONENTIAL : reconnectBackoff;
        this.reconnectBaseMs = Math.max(1, reconnectBaseMs);
        this.reconnectMaxMs = Math.max(this.reconnectBaseMs, reconnectMaxMs);
    }

    /**
     * 开始消费，重复调用无效果
     */
    public void subscribe() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        running = true;
        pollThread = new Thread(this::pollLoop, "conduit-bridge-" + tenantId);
        pollThread.setDaemon(true);
        pollThread.start();
        log.info("Broker 桥接启动: tenantId={}, topic={}", tenantId, topic);
    }

    /**
     * 停止消费，立即返回，可重复调用
     */
    public void close() {
        if (!running && closeSignal.getCount() == 0) {
            return;
        }
        running = false;
        closeSignal.countDown();
        Consumer<String, String> current = consumer;
        if (current != null) {
            current.wakeup();
        }
        log.info("Broker 桥接关闭: tenantId={}", tenantId);
    }

    public boolean isRunning() {
        return running;
    }

    public String topic() {
        return topic;
    }

    private void pollLoop() {
        int failures = 0;
        while (running) {
            Consumer<String, String> current = null;
            try {
                current = consumerFactory.get();
                consumer = current;
                if (!running) {
                    break;
                }
                current.subscribe(List.of(topic));
                log.info("已订阅租户 Topic: tenantId={}, topic={}", tenantId, topic);
                while (running) {
                    ConsumerRecords<String, String> records = current.poll(pollTimeout);
                    failures = 0;
                    for (ConsumerRecord<String, String> record : records) {
                        if (!running) {
                            break;
                        }
                        forward(record);
                    }
                }
            } catch (WakeupException e) {
                log.debug("Broker 桥接被唤醒: tenantId={}", tenantId);
            } catch (KafkaException e) {
                failures++;
                long delay = reconnectDelay(failures);
                log.warn("Broker 连接异常，{}ms 后重连: tenantId={}, attempt={}, error={}",
                        delay, tenantId, failures, e.getMessage());
                closeConsumer(current);
                current = null;
                awaitReconnect(delay);
            } catch (RuntimeException e) {
                failures++;
                long delay = reconnectDelay(failures);
                log.error("Broker 桥接异常，{}ms 后重建 Consumer: tenantId={}, attempt={}",
                        delay, tenantId, failures, e);
                closeConsumer(current);
                current = null;
                awaitReconnect(delay);
            } finally {
                consumer = null;
                closeConsumer(current);
            }
        }
        log.info("Broker 桥接线程退出: tenantId={}", tenantId);
    }

    private void forward(ConsumerRecord<String, String> record) {
        if (record.value() == null) {
            return;
        }
        JobEvent event;
        try {
            event = objectMapper.readValue(record.value(), JobEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Broker 消息解码失败，丢弃: tenantId={}, offset={}, error={}",
                    tenantId, record.offset(), e.getOriginalMessage());
            return;
        }
        eventHub.broadcast(tenantId, event);
    }

    private long reconnectDelay(int failures) {
        return Math.min(reconnectBackoff.calculateDelay(failures, reconnectBaseMs), reconnectMaxMs);
    }

    private void awaitReconnect(long delayMs) {
        try {
            closeSignal.await(delayMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    private void closeConsumer(Consumer<String, String> target) {
        if (target == null) {
            return;
        }
        try {
            target.close();
        } catch (RuntimeException e) {
            log.debug("关闭 Consumer 异常: tenantId={}", tenantId, e);
        }
    }
}
