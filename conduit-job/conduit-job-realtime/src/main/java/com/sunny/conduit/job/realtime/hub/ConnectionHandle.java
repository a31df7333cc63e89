package com.sunny.conduit.job.realtime.hub;

/**
 * 注册凭据，注销与单播时使用
 *
 * @param connectionId 连接 ID
 * @param tenantId     所属租户
 * @author SunnyX6
 * @date 2026-03-06
 */
public record ConnectionHandle(String connectionId, String tenantId) {
}
