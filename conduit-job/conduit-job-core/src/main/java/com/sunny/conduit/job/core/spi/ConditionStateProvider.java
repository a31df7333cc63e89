package com.sunny.conduit.job.core.spi;

import com.sunny.conduit.job.core.model.Observation;

import java.util.Optional;

/**
 * 条件观测状态提供者
 * <p>
 * 返回某个观测源中水位高于 afterWatermark 的最新一份数据，供条件触发器求值。
 * 没有更新的观测时返回空，同一份观测因此最多触发一次
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
@FunctionalInterface
public interface ConditionStateProvider {

    /**
     * 没有任何观测源时使用
     */
    ConditionStateProvider NONE = (tenantId, source, afterWatermark) -> Optional.empty();

    Optional<Observation> latest(String tenantId, String source, long afterWatermark);
}
