package com.sunny.conduit.job.realtime.broker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.job.core.message.JobEvent;
import com.sunny.conduit.job.core.strategy.retry.BackoffStrategy;
import com.sunny.conduit.job.realtime.hub.EventHub;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * BrokerBridge 测试，使用 MockConsumer 模拟 Kafka
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
class BrokerBridgeTest {

    private static final String TENANT = "t1";
    private static final String TOPIC = "conduit.tenant.t1.events";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EventHub eventHub = mock(EventHub.class);

    private BrokerBridge bridge;

    @AfterEach
    void tearDown() {
        if (bridge != null) {
            bridge.close();
        }
    }

    @Test
    void subscribe_shouldForwardDecodedEventsAndDropMalformedOnes() throws Exception {
        MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        String payload = objectMapper.writeValueAsString(event(7L));
        consumer.schedulePollTask(() -> {
            consumer.rebalance(List.of(PARTITION));
            consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
            consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, null, "{not json"));
            consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, null, payload));
        });

        bridge = newBridge(() -> consumer);
        bridge.subscribe();

        verify(eventHub, timeout(3000)).broadcast(eq(TENANT),
                argThat(event -> event != null && Long.valueOf(7L).equals(event.executionId())));
        verify(eventHub, after(200).times(1)).broadcast(any(), any());
        assertEquals(TOPIC, bridge.topic());
        assertTrue(consumer.subscription().contains(TOPIC));
    }

    @Test
    void pollFailure_shouldRecreateConsumerAndResubscribe() throws Exception {
        MockConsumer<String, String> broken = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        broken.setPollException(new KafkaException("broker down"));

        MockConsumer<String, String> healthy = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        String payload = objectMapper.writeValueAsString(event(9L));
        healthy.schedulePollTask(() -> {
            healthy.rebalance(List.of(PARTITION));
            healthy.updateBeginningOffsets(Map.of(PARTITION, 0L));
            healthy.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, null, payload));
        });

        Deque<MockConsumer<String, String>> consumers = new ArrayDeque<>(List.of(broken, healthy));
        bridge = newBridge(() -> consumers.size() > 1 ? consumers.poll() : consumers.peek());
        bridge.subscribe();

        verify(eventHub, timeout(3000)).broadcast(eq(TENANT),
                argThat(event -> event != null && Long.valueOf(9L).equals(event.executionId())));
        assertTrue(broken.closed());
        assertTrue(healthy.subscription().contains(TOPIC));
    }

    @Test
    void close_shouldStopForwardingRestOfCurrentBatch() throws Exception {
        MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        List<String> payloads = List.of(
                objectMapper.writeValueAsString(event(1L)),
                objectMapper.writeValueAsString(event(2L)),
                objectMapper.writeValueAsString(event(3L)));
        consumer.schedulePollTask(() -> {
            consumer.rebalance(List.of(PARTITION));
            consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
            for (int i = 0; i < payloads.size(); i++) {
                consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, i, null, payloads.get(i)));
            }
        });
        doAnswer(invocation -> {
            bridge.close();
            return null;
        }).when(eventHub).broadcast(any(), any());

        bridge = newBridge(() -> consumer);
        bridge.subscribe();

        verify(eventHub, timeout(3000)).broadcast(eq(TENANT), any());
        verify(eventHub, after(300).times(1)).broadcast(any(), any());
        awaitCondition(consumer::closed);
    }

    @Test
    void unexpectedFailure_shouldBackOffAndRecreateConsumer() throws Exception {
        MockConsumer<String, String> healthy = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        String payload = objectMapper.writeValueAsString(event(11L));
        healthy.schedulePollTask(() -> {
            healthy.rebalance(List.of(PARTITION));
            healthy.updateBeginningOffsets(Map.of(PARTITION, 0L));
            healthy.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, null, payload));
        });
        AtomicInteger factoryCalls = new AtomicInteger();

        bridge = newBridge(() -> {
            if (factoryCalls.incrementAndGet() == 1) {
                throw new IllegalStateException("consumer config missing");
            }
            return healthy;
        });
        bridge.subscribe();

        verify(eventHub, timeout(3000)).broadcast(eq(TENANT),
                argThat(event -> event != null && Long.valueOf(11L).equals(event.executionId())));
        assertEquals(2, factoryCalls.get());
        assertTrue(bridge.isRunning());
    }

    @Test
    void close_shouldStopPollingAndCloseConsumer() throws Exception {
        MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        bridge = newBridge(() -> consumer);
        bridge.subscribe();
        bridge.subscribe();
        assertTrue(bridge.isRunning());

        awaitCondition(() -> !consumer.subscription().isEmpty());
        bridge.close();
        bridge.close();

        assertFalse(bridge.isRunning());
        awaitCondition(consumer::closed);
        verify(eventHub, never()).broadcast(any(), any());
    }

    @Test
    void topicOf_shouldRejectUnsafeTenantIds() {
        assertEquals("conduit.tenant.acme-01.events", TenantTopics.topicOf("acme-01"));
        assertThrows(IllegalArgumentException.class, () -> TenantTopics.topicOf("acme.prod"));
        assertThrows(IllegalArgumentException.class, () -> TenantTopics.topicOf(" "));
    }

    private BrokerBridge newBridge(Supplier<Consumer<String, String>> factory) {
        return new BrokerBridge(TENANT, factory, eventHub, objectMapper, Duration.ofMillis(20),
                BackoffStrategy.FIXED, 10, 50);
    }

    private static JobEvent event(long executionId) {
        return new JobEvent(JobEvent.TYPE_EXECUTION_FINISHED, 3L, executionId, 5L, "succeeded", 1, null,
                1_700_000_000_000L);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("等待条件超时");
            }
            Thread.sleep(10);
        }
    }
}
