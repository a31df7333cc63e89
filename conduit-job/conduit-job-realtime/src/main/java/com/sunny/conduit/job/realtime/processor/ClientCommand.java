package com.sunny.conduit.job.realtime.processor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 客户端入站指令 {command, payload}
 *
 * @param command 指令编码
 * @param payload 指令参数，可为 null
 * @author SunnyX6
 * @date 2026-03-06
 */
public record ClientCommand(String command, JsonNode payload) {
}
