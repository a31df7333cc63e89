package com.sunny.conduit.job.realtime.hub;

import java.io.IOException;

/**
 * 实时客户端连接
 * <p>
 * 由传输层（WebSocket）实现，Hub 只通过该接口发送文本与关闭连接
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public interface ClientConnection {

    /**
     * 连接 ID，进程内唯一
     */
    String id();

    /**
     * 发送一条文本消息，同一连接不会被并发调用
     */
    void send(String text) throws IOException;

    /**
     * 关闭连接
     *
     * @param reason 关闭原因
     */
    void close(String reason);

    boolean isOpen();
}
