package com.sunny.conduit.job.realtime.broker;

import com.sunny.conduit.job.realtime.hub.TenantLifecycleListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 租户订阅注册表
 * <p>
 * 租户第一个连接注册时创建 Broker 桥接，最后一个连接离开时关闭；同一租户最多一个桥接
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public class TenantSubscriptionRegistry implements TenantLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(TenantSubscriptionRegistry.class);

    private final Function<String, BrokerBridge> bridgeFactory;
    private final Map<String, BrokerBridge> bridges = new ConcurrentHashMap<>();

    public TenantSubscriptionRegistry(Function<String, BrokerBridge> bridgeFactory) {
        this.bridgeFactory = bridgeFactory;
    }

    @Override
    public void onTenantActive(String tenantId) {
        bridges.computeIfAbsent(tenantId, id -> {
            BrokerBridge bridge = bridgeFactory.apply(id);
            bridge.subscribe();
            return bridge;
        });
    }

    @Override
    public void onTenantIdle(String tenantId) {
        BrokerBridge bridge = bridges.remove(tenantId);
        if (bridge != null) {
            bridge.close();
            log.info("租户已无在线连接，关闭订阅: tenantId={}", tenantId);
        }
    }

    public Set<String> activeTenants() {
        return Set.copyOf(bridges.keySet());
    }

    /**
     * 关闭全部桥接
     */
    public void closeAll() {
        bridges.keySet().forEach(this::onTenantIdle);
    }
}
