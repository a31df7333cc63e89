package com.sunny.conduit.job.realtime.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.job.core.message.JobEvent;
import com.sunny.conduit.job.realtime.hub.HubMessage.Broadcast;
import com.sunny.conduit.job.realtime.hub.HubMessage.CountConnections;
import com.sunny.conduit.job.realtime.hub.HubMessage.Register;
import com.sunny.conduit.job.realtime.hub.HubMessage.SendTo;
import com.sunny.conduit.job.realtime.hub.HubMessage.Unregister;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.ActorSystem;
import org.apache.pekko.actor.typed.Props;
import org.apache.pekko.actor.typed.javadsl.AskPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * 实时事件中心
 * <p>
 * 对外的线程安全入口：消息先在调用线程序列化，再投递给 HubCoordinator，
 * 调用方从不直接接触连接表
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public class EventHub {

    private static final Logger log = LoggerFactory.getLogger(EventHub.class);

    private static final Duration ASK_TIMEOUT = Duration.ofSeconds(3);

    private final ActorSystem<?> system;
    private final ActorRef<HubMessage> coordinator;
    private final ObjectMapper objectMapper;
    private final Executor deliveryExecutor;
    private final int bufferCapacity;

    public EventHub(ActorSystem<?> system,
                    ObjectMapper objectMapper,
                    Executor deliveryExecutor,
                    int bufferCapacity,
                    TenantLifecycleListener lifecycleListener) {
        this.system = system;
        this.objectMapper = objectMapper;
        this.deliveryExecutor = deliveryExecutor;
        this.bufferCapacity = bufferCapacity;
        this.coordinator = system.systemActorOf(
                HubCoordinator.create(lifecycleListener),
                "event-hub-" + UUID.randomUUID(),
                Props.empty()
        );
        log.info("EventHub 初始化完成: bufferCapacity={}", bufferCapacity);
    }

    /**
     * 注册连接
     *
     * @param connection 已通过握手的连接
     * @param tenantId   连接所属租户
     * @return 注销与单播时使用的句柄
     */
    public ConnectionHandle register(ClientConnection connection, String tenantId) {
        ConnectionHandle handle = new ConnectionHandle(connection.id(), tenantId);
        ClientSession session = new ClientSession(handle, connection, bufferCapacity, deliveryExecutor,
                () -> coordinator.tell(new Unregister(handle, "发送失败")));
        coordinator.tell(new Register(session));
        return handle;
    }

    /**
     * 注销连接，可重复调用
     */
    public void unregister(ConnectionHandle handle) {
        if (handle != null) {
            coordinator.tell(new Unregister(handle, "client closed"));
        }
    }

    /**
     * 向租户的所有连接广播事件
     */
    public void broadcast(String tenantId, JobEvent event) {
        String payload = serialize(event);
        if (payload != null) {
            coordinator.tell(new Broadcast(tenantId, payload));
        }
    }

    /**
     * 向单个连接发送消息
     */
    public void sendTo(ConnectionHandle handle, Object message) {
        String payload = serialize(message);
        if (payload != null) {
            coordinator.tell(new SendTo(handle, payload));
        }
    }

    /**
     * 查询租户在线连接数
     */
    public CompletionStage<Integer> connectionCount(String tenantId) {
        return AskPattern.ask(
                coordinator,
                replyTo -> new CountConnections(tenantId, replyTo),
                ASK_TIMEOUT,
                system.scheduler());
    }

    private String serialize(Object message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("推送消息序列化失败: type={}", message.getClass().getSimpleName(), e);
            return null;
        }
    }
}
