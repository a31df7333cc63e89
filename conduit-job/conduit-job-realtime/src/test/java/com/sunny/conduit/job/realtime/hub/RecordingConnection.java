package com.sunny.conduit.job.realtime.hub;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 测试用连接，记录收到的消息，可选阻塞发送或发送失败
 */
class RecordingConnection implements ClientConnection {

    private final String id;
    private final CountDownLatch sendGate;
    private final boolean failOnSend;
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final AtomicReference<String> closeReason = new AtomicReference<>();

    RecordingConnection(String id) {
        this(id, null, false);
    }

    RecordingConnection(String id, CountDownLatch sendGate, boolean failOnSend) {
        this.id = id;
        this.sendGate = sendGate;
        this.failOnSend = failOnSend;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String text) throws IOException {
        if (failOnSend) {
            throw new IOException("broken pipe");
        }
        if (sendGate != null) {
            try {
                sendGate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
        }
        received.add(text);
    }

    @Override
    public void close(String reason) {
        closeReason.compareAndSet(null, reason);
    }

    @Override
    public boolean isOpen() {
        return closeReason.get() == null;
    }

    List<String> received() {
        return received;
    }

    String closeReason() {
        return closeReason.get();
    }
}
