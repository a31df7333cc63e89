package com.sunny.conduit.job.realtime.hub;

/**
 * 租户活跃状态监听
 * <p>
 * 在 Hub 的 Actor 线程中回调，实现方不能阻塞
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public interface TenantLifecycleListener {

    TenantLifecycleListener NOOP = new TenantLifecycleListener() {
        @Override
        public void onTenantActive(String tenantId) {
        }

        @Override
        public void onTenantIdle(String tenantId) {
        }
    };

    /**
     * 租户的第一个连接注册后
     */
    void onTenantActive(String tenantId);

    /**
     * 租户的最后一个连接离开后
     */
    void onTenantIdle(String tenantId);
}
