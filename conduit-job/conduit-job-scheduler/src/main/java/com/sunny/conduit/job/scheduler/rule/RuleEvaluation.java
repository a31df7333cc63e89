package com.sunny.conduit.job.scheduler.rule;

import com.sunny.conduit.job.core.model.Observation;

import java.util.Map;

/**
 * 规则求值结果
 *
 * @param outcome   结果类型
 * @param nextRunAt 下一次运行或复查时间（毫秒）
 * @param eventData 条件触发时观测到的数据，其余为 null
 * @param watermark 条件触发时观测数据的水位，其余为 null
 * @param reason    求值失败原因
 * @author SunnyX6
 * @date 2026-03-05
 */
public record RuleEvaluation(Outcome outcome, long nextRunAt, Map<String, Object> eventData, Long watermark,
                             String reason) {

    public enum Outcome {
        /**
         * 满足，需要分发
         */
        FIRE,
        /**
         * 条件不满足，等待下次复查
         */
        WAIT,
        /**
         * 规则不合法或观测失败
         */
        INVALID
    }

    public static RuleEvaluation fire(long nextRunAt) {
        return new RuleEvaluation(Outcome.FIRE, nextRunAt, null, null, null);
    }

    public static RuleEvaluation fire(long nextRunAt, Observation observation) {
        return new RuleEvaluation(Outcome.FIRE, nextRunAt, observation.data(), observation.watermark(), null);
    }

    public static RuleEvaluation await(long nextRunAt) {
        return new RuleEvaluation(Outcome.WAIT, nextRunAt, null, null, null);
    }

    public static RuleEvaluation invalid(long nextRunAt, String reason) {
        return new RuleEvaluation(Outcome.INVALID, nextRunAt, null, null, reason);
    }
}
