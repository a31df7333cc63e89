package com.sunny.conduit.job.realtime.hub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.job.core.message.JobEvent;
import org.apache.pekko.actor.testkit.typed.javadsl.ActorTestKit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * EventHub 测试
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
class EventHubTest {

    private static final ActorTestKit testKit = ActorTestKit.create();

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TenantLifecycleListener lifecycleListener = mock(TenantLifecycleListener.class);
    private final CountDownLatch slowGate = new CountDownLatch(1);

    private ExecutorService deliveryExecutor;

    @BeforeEach
    void setUp() {
        deliveryExecutor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        slowGate.countDown();
        deliveryExecutor.shutdownNow();
    }

    @AfterAll
    static void cleanup() {
        testKit.shutdownTestKit();
    }

    @Test
    void broadcast_shouldOnlyReachConnectionsOfSameTenant() throws Exception {
        EventHub hub = newHub(16);
        RecordingConnection a1 = new RecordingConnection("a1");
        RecordingConnection a2 = new RecordingConnection("a2");
        RecordingConnection b1 = new RecordingConnection("b1");
        hub.register(a1, "tenant-a");
        hub.register(a2, "tenant-a");
        hub.register(b1, "tenant-b");

        hub.broadcast("tenant-a", event(1));
        hub.broadcast("tenant-b", event(2));

        awaitCondition(() -> a1.received().size() == 1 && a2.received().size() == 1 && b1.received().size() == 1);
        assertEquals(1L, executionIdOf(a1.received().get(0)));
        assertEquals(1L, executionIdOf(a2.received().get(0)));
        assertEquals(2L, executionIdOf(b1.received().get(0)));
        assertEquals(2, hub.connectionCount("tenant-a").toCompletableFuture().get(3, TimeUnit.SECONDS));
        assertEquals(1, hub.connectionCount("tenant-b").toCompletableFuture().get(3, TimeUnit.SECONDS));
    }

    @Test
    void broadcast_shouldCloseSlowConsumerWithoutDelayingOthers() throws Exception {
        EventHub hub = newHub(2);
        RecordingConnection slow = new RecordingConnection("slow", slowGate, false);
        RecordingConnection fast = new RecordingConnection("fast");
        hub.register(slow, "tenant-a");
        hub.register(fast, "tenant-a");

        for (long i = 1; i <= 5; i++) {
            int expected = (int) i;
            hub.broadcast("tenant-a", event(i));
            awaitCondition(() -> fast.received().size() == expected);
        }

        awaitCondition(() -> fast.received().size() == 5);
        List<Long> order = fast.received().stream().map(this::executionIdOf).toList();
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), order);
        awaitCondition(() -> slow.closeReason() != null);
        assertEquals(HubCoordinator.REASON_SLOW_CONSUMER, slow.closeReason());
        assertEquals(1, hub.connectionCount("tenant-a").toCompletableFuture().get(3, TimeUnit.SECONDS));
    }

    @Test
    void unregister_shouldBeIdempotentAndNotifyTenantLifecycle() throws Exception {
        EventHub hub = newHub(16);
        ConnectionHandle first = hub.register(new RecordingConnection("c1"), "tenant-a");
        ConnectionHandle second = hub.register(new RecordingConnection("c2"), "tenant-a");

        verify(lifecycleListener, timeout(3000).times(1)).onTenantActive("tenant-a");

        hub.unregister(first);
        hub.unregister(first);
        assertEquals(1, hub.connectionCount("tenant-a").toCompletableFuture().get(3, TimeUnit.SECONDS));

        hub.unregister(second);
        verify(lifecycleListener, timeout(3000).times(1)).onTenantIdle("tenant-a");
        assertEquals(0, hub.connectionCount("tenant-a").toCompletableFuture().get(3, TimeUnit.SECONDS));

        hub.unregister(second);
        verify(lifecycleListener, times(1)).onTenantIdle("tenant-a");
    }

    @Test
    void sendTo_shouldReachOnlyTargetConnection() {
        EventHub hub = newHub(16);
        RecordingConnection target = new RecordingConnection("target");
        RecordingConnection other = new RecordingConnection("other");
        ConnectionHandle handle = hub.register(target, "tenant-a");
        hub.register(other, "tenant-a");

        hub.sendTo(handle, event(42));
        hub.broadcast("tenant-a", event(43));

        awaitCondition(() -> target.received().size() == 2 && other.received().size() == 1);
        assertEquals(42L, executionIdOf(target.received().get(0)));
        assertEquals(43L, executionIdOf(other.received().get(0)));
    }

    @Test
    void failedSend_shouldUnregisterConnection() throws Exception {
        EventHub hub = newHub(16);
        RecordingConnection broken = new RecordingConnection("broken", null, true);
        hub.register(broken, "tenant-a");

        hub.broadcast("tenant-a", event(1));

        verify(lifecycleListener, timeout(3000)).onTenantIdle("tenant-a");
        assertEquals(0, hub.connectionCount("tenant-a").toCompletableFuture().get(3, TimeUnit.SECONDS));
    }

    private EventHub newHub(int capacity) {
        return new EventHub(testKit.system(), objectMapper, deliveryExecutor, capacity, lifecycleListener);
    }

    private static JobEvent event(long executionId) {
        return new JobEvent(JobEvent.TYPE_EXECUTION_STARTED, 10L, executionId, 20L, "running", 1, null,
                System.currentTimeMillis());
    }

    private long executionIdOf(String json) {
        try {
            return objectMapper.readTree(json).get("executionId").asLong();
        } catch (Exception e) {
            throw new AssertionError("非法的推送消息: " + json, e);
        }
    }

    private static void awaitCondition(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("等待条件超时");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("等待被中断");
            }
        }
    }
}
