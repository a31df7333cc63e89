package com.sunny.conduit.job.realtime.auth;

/**
 * 握手通过后的连接身份
 *
 * @param tenantId 租户 ID
 * @param userId   用户 ID
 * @param username 用户名
 * @author SunnyX6
 * @date 2026-03-06
 */
public record RealtimeIdentity(String tenantId, Long userId, String username) {
}
