package com.sunny.conduit.job.realtime.hub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单个连接的出站队列
 * <p>
 * 有界队列加单个排空任务：同一连接的消息按入队顺序发送，同一时刻最多一个线程在发送。
 * 队列满时 offer 返回 false，由 Hub 关闭该连接
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public class ClientSession {

    private static final Logger log = LoggerFactory.getLogger(ClientSession.class);

    private final ConnectionHandle handle;
    private final ClientConnection connection;
    private final BlockingQueue<String> outbound;
    private final Executor deliveryExecutor;
    private final Runnable onBroken;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param onBroken 发送失败时回调，通常用于通知 Hub 注销
     */
    public ClientSession(ConnectionHandle handle, ClientConnection connection, int capacity,
                         Executor deliveryExecutor, Runnable onBroken) {
        this.handle = handle;
        this.connection = connection;
        this.outbound = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.deliveryExecutor = deliveryExecutor;
        this.onBroken = onBroken;
    }

    public ConnectionHandle handle() {
        return handle;
    }

    /**
     * 入队，不阻塞
     *
     * @return 队列已满或连接已关闭时返回 false
     */
    public boolean offer(String message) {
        if (closed.get() || !outbound.offer(message)) {
            return false;
        }
        scheduleDrain();
        return true;
    }

    /**
     * 关闭连接并丢弃未发送的消息，可重复调用
     */
    public void close(String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        outbound.clear();
        try {
            deliveryExecutor.execute(() -> closeQuietly(reason));
        } catch (RejectedExecutionException e) {
            closeQuietly(reason);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            deliveryExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("推送线程池已关闭，连接无法发送: connectionId={}", handle.connectionId());
        }
    }

    private void drain() {
        try {
            String message;
            while (!closed.get() && (message = outbound.poll()) != null) {
                connection.send(message);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("推送失败，关闭连接: connectionId={}, tenantId={}, error={}",
                    handle.connectionId(), handle.tenantId(), e.getMessage());
            close("发送失败");
            onBroken.run();
        } finally {
            draining.set(false);
        }
        if (!closed.get() && !outbound.isEmpty()) {
            scheduleDrain();
        }
    }

    private void closeQuietly(String reason) {
        try {
            if (connection.isOpen()) {
                connection.close(reason);
            }
        } catch (RuntimeException e) {
            log.debug("关闭连接异常: connectionId={}", handle.connectionId(), e);
        }
    }
}
