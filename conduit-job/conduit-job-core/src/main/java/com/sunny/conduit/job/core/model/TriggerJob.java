package com.sunny.conduit.job.core.model;

import java.util.Map;

/**
 * 触发器与目标任务的关联
 * <p>
 * 一个触发器只关联一个任务，一个任务可以被多个触发器关联
 *
 * @param jobId         目标任务 ID
 * @param params        执行参数
 * @param passEventData 是否把条件观测数据作为 event 参数传给任务
 * @author SunnyX6
 * @date 2026-03-03
 */
public record TriggerJob(long jobId, Map<String, Object> params, boolean passEventData) {

    public TriggerJob {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static TriggerJob of(long jobId) {
        return new TriggerJob(jobId, Map.of(), false);
    }
}
