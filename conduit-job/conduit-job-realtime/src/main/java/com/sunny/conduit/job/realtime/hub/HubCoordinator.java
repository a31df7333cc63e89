package com.sunny.conduit.job.realtime.hub;

import com.sunny.conduit.job.realtime.hub.HubMessage.Broadcast;
import com.sunny.conduit.job.realtime.hub.HubMessage.CountConnections;
import com.sunny.conduit.job.realtime.hub.HubMessage.Register;
import com.sunny.conduit.job.realtime.hub.HubMessage.SendTo;
import com.sunny.conduit.job.realtime.hub.HubMessage.Unregister;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hub 协调 Actor
 * <p>
 * 独占 tenantId → 连接 的注册表，所有注册、注销、广播都在 Actor 线程中串行处理。
 * 广播只做非阻塞入队，队列满的连接当场关闭并移除，不影响同租户其他连接
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public class HubCoordinator extends AbstractBehavior<HubMessage> {

    private static final Logger log = LoggerFactory.getLogger(HubCoordinator.class);

    static final String REASON_SLOW_CONSUMER = "slow consumer";

    private final TenantLifecycleListener lifecycleListener;

    /**
     * tenantId → (connectionId → session)
     */
    private final Map<String, Map<String, ClientSession>> tenants = new HashMap<>();

    public static Behavior<HubMessage> create(TenantLifecycleListener lifecycleListener) {
        return Behaviors.setup(context -> new HubCoordinator(context, lifecycleListener));
    }

    private HubCoordinator(ActorContext<HubMessage> context, TenantLifecycleListener lifecycleListener) {
        super(context);
        this.lifecycleListener = lifecycleListener == null ? TenantLifecycleListener.NOOP : lifecycleListener;
    }

    @Override
    public Receive<HubMessage> createReceive() {
        return newReceiveBuilder()
                .onMessage(Register.class, this::onRegister)
                .onMessage(Unregister.class, this::onUnregister)
                .onMessage(Broadcast.class, this::onBroadcast)
                .onMessage(SendTo.class, this::onSendTo)
                .onMessage(CountConnections.class, this::onCountConnections)
                .onSignal(PostStop.class, this::onPostStop)
                .build();
    }

    private Behavior<HubMessage> onRegister(Register msg) {
        ConnectionHandle handle = msg.session().handle();
        Map<String, ClientSession> sessions = tenants.get(handle.tenantId());
        boolean firstOfTenant = sessions == null;
        if (firstOfTenant) {
            sessions = new LinkedHashMap<>();
            tenants.put(handle.tenantId(), sessions);
        }
        sessions.put(handle.connectionId(), msg.session());
        log.info("连接已注册: tenantId={}, connectionId={}, 租户连接数={}",
                handle.tenantId(), handle.connectionId(), sessions.size());

        if (firstOfTenant) {
            notifyActive(handle.tenantId());
        }
        return this;
    }

    private Behavior<HubMessage> onUnregister(Unregister msg) {
        remove(msg.handle(), msg.reason());
        return this;
    }

    private Behavior<HubMessage> onBroadcast(Broadcast msg) {
        Map<String, ClientSession> sessions = tenants.get(msg.tenantId());
        if (sessions == null) {
            log.debug("租户没有在线连接，丢弃广播: tenantId={}", msg.tenantId());
            return this;
        }
        List<ConnectionHandle> overflowed = new ArrayList<>();
        for (ClientSession session : sessions.values()) {
            if (!session.offer(msg.payload())) {
                overflowed.add(session.handle());
            }
        }
        for (ConnectionHandle handle : overflowed) {
            log.warn("出站队列已满，关闭慢连接: tenantId={}, connectionId={}",
                    handle.tenantId(), handle.connectionId());
            remove(handle, REASON_SLOW_CONSUMER);
        }
        return this;
    }

    private Behavior<HubMessage> onSendTo(SendTo msg) {
        Map<String, ClientSession> sessions = tenants.get(msg.handle().tenantId());
        ClientSession session = sessions == null ? null : sessions.get(msg.handle().connectionId());
        if (session == null) {
            log.debug("单播目标已离线: connectionId={}", msg.handle().connectionId());
            return this;
        }
        if (!session.offer(msg.payload())) {
            log.warn("出站队列已满，关闭慢连接: connectionId={}", msg.handle().connectionId());
            remove(msg.handle(), REASON_SLOW_CONSUMER);
        }
        return this;
    }

    private Behavior<HubMessage> onCountConnections(CountConnections msg) {
        Map<String, ClientSession> sessions = tenants.get(msg.tenantId());
        msg.replyTo().tell(sessions == null ? 0 : sessions.size());
        return this;
    }

    private Behavior<HubMessage> onPostStop(PostStop signal) {
        int total = tenants.values().stream().mapToInt(Map::size).sum();
        log.info("Hub 停止，关闭全部连接: {}", total);
        for (Map<String, ClientSession> sessions : tenants.values()) {
            sessions.values().forEach(session -> session.close("server shutdown"));
        }
        for (String tenantId : new ArrayList<>(tenants.keySet())) {
            notifyIdle(tenantId);
        }
        tenants.clear();
        return this;
    }

    private void remove(ConnectionHandle handle, String reason) {
        Map<String, ClientSession> sessions = tenants.get(handle.tenantId());
        if (sessions == null) {
            return;
        }
        ClientSession session = sessions.remove(handle.connectionId());
        if (session == null) {
            return;
        }
        session.close(reason);
        log.info("连接已注销: tenantId={}, connectionId={}, reason={}",
                handle.tenantId(), handle.connectionId(), reason);

        if (sessions.isEmpty()) {
            tenants.remove(handle.tenantId());
            notifyIdle(handle.tenantId());
        }
    }

    private void notifyActive(String tenantId) {
        try {
            lifecycleListener.onTenantActive(tenantId);
        } catch (RuntimeException e) {
            log.error("租户激活回调失败: tenantId={}", tenantId, e);
        }
    }

    private void notifyIdle(String tenantId) {
        try {
            lifecycleListener.onTenantIdle(tenantId);
        } catch (RuntimeException e) {
            log.error("租户空闲回调失败: tenantId={}", tenantId, e);
        }
    }
}
