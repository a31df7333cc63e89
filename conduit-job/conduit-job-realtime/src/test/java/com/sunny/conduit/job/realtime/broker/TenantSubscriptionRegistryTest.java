package com.sunny.conduit.job.realtime.broker;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class TenantSubscriptionRegistryTest {

    private final Map<String, BrokerBridge> created = new HashMap<>();
    private final AtomicInteger factoryCalls = new AtomicInteger();
    private final TenantSubscriptionRegistry registry = new TenantSubscriptionRegistry(tenantId -> {
        factoryCalls.incrementAndGet();
        BrokerBridge bridge = mock(BrokerBridge.class);
        created.put(tenantId, bridge);
        return bridge;
    });

    @Test
    void onTenantActive_shouldCreateOneBridgePerTenant() {
        registry.onTenantActive("t1");
        registry.onTenantActive("t1");
        registry.onTenantActive("t2");

        assertEquals(2, factoryCalls.get());
        assertEquals(Set.of("t1", "t2"), registry.activeTenants());
        verify(created.get("t1"), times(1)).subscribe();
        verify(created.get("t2"), times(1)).subscribe();
    }

    @Test
    void onTenantIdle_shouldCloseBridgeAndAllowResubscribe() {
        registry.onTenantActive("t1");
        BrokerBridge first = created.get("t1");

        registry.onTenantIdle("t1");
        registry.onTenantIdle("t1");

        verify(first, times(1)).close();
        assertTrue(registry.activeTenants().isEmpty());

        registry.onTenantActive("t1");
        assertEquals(2, factoryCalls.get());
        verify(created.get("t1"), times(1)).subscribe();
        verify(first, times(1)).close();
    }

    @Test
    void closeAll_shouldCloseEveryBridge() {
        registry.onTenantActive("t1");
        registry.onTenantActive("t2");

        registry.closeAll();

        verify(created.get("t1")).close();
        verify(created.get("t2")).close();
        assertTrue(registry.activeTenants().isEmpty());
    }

    @Test
    void onTenantIdle_unknownTenantShouldBeIgnored() {
        registry.onTenantIdle("missing");

        assertEquals(0, factoryCalls.get());
        created.values().forEach(bridge -> verify(bridge, never()).close());
    }
}
