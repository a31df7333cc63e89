package com.sunny.conduit.job.core.model;

import java.util.Map;

/**
 * 条件观测数据
 *
 * @param watermark 观测水位，同一观测源内单调递增
 * @param data      观测到的字段
 * @author SunnyX6
 * @date 2026-03-03
 */
public record Observation(long watermark, Map<String, Object> data) {

    public Observation {
        data = data == null ? Map.of() : data;
    }
}
