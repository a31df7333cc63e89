package com.sunny.conduit.job.realtime.hub;

import org.apache.pekko.actor.typed.ActorRef;

/**
 * Hub 协调 Actor 的消息协议
 * <p>
 * 连接表只在 HubCoordinator 内部访问，外部一律通过消息修改或读取
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public sealed interface HubMessage {

    /**
     * 注册连接
     */
    record Register(ClientSession session) implements HubMessage {}

    /**
     * 注销连接，未注册或已注销时忽略
     */
    record Unregister(ConnectionHandle handle, String reason) implements HubMessage {}

    /**
     * 租户内广播，payload 为已序列化的 JSON
     */
    record Broadcast(String tenantId, String payload) implements HubMessage {}

    /**
     * 单播给一个连接
     */
    record SendTo(ConnectionHandle handle, String payload) implements HubMessage {}

    /**
     * 查询租户当前连接数
     */
    record CountConnections(String tenantId, ActorRef<Integer> replyTo) implements HubMessage {}
}
