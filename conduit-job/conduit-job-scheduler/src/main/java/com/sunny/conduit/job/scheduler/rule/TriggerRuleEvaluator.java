package com.sunny.conduit.job.scheduler.rule;

import com.sunny.conduit.job.core.condition.ConditionEvaluator;
import com.sunny.conduit.job.core.model.Observation;
import com.sunny.conduit.job.core.model.Trigger;
import com.sunny.conduit.job.core.schedule.ScheduleUtils;
import com.sunny.conduit.job.core.spi.ConditionStateProvider;

import java.time.ZoneId;
import java.util.Optional;

/**
 * 触发规则求值
 * <p>
 * 按触发器类型分派：时间型到期即触发，只计算下一次运行时间；
 * 条件型读取水位之后的最新观测数据再比较
 *
 * @author SunnyX6
 * @date 2026-03-05
 */
public class TriggerRuleEvaluator {

    private final ConditionStateProvider stateProvider;
    private final ConditionEvaluator conditionEvaluator;
    private final ZoneId zone;
    private final long errorRecheckMs;

    public TriggerRuleEvaluator(ConditionStateProvider stateProvider, ZoneId zone, long errorRecheckMs) {
        this.stateProvider = stateProvider == null ? ConditionStateProvider.NONE : stateProvider;
        this.conditionEvaluator = new ConditionEvaluator();
        this.zone = zone;
        this.errorRecheckMs = errorRecheckMs;
    }

    /**
     * 对到期触发器求值
     *
     * @param trigger 到期触发器
     * @param now     本轮轮询的当前时间（毫秒）
     */
    public RuleEvaluation evaluate(Trigger trigger, long now) {
        if (trigger.kind() == null || trigger.rule() == null) {
            return RuleEvaluation.invalid(now + errorRecheckMs, "触发器缺少类型或规则");
        }
        try {
            return switch (trigger.kind()) {
                case INTERVAL, CRON -> evaluateSchedule(trigger, now);
                case CONDITION -> evaluateCondition(trigger, now);
            };
        } catch (RuntimeException e) {
            return RuleEvaluation.invalid(now + errorRecheckMs, e.getMessage());
        }
    }

    private RuleEvaluation evaluateSchedule(Trigger trigger, long now) {
        long next = ScheduleUtils.nextRunTime(trigger, now, zone);
        if (next <= now) {
            return RuleEvaluation.invalid(now + errorRecheckMs, "调度表达式没有后续触发时间: " + trigger.rule().expression());
        }
        return RuleEvaluation.fire(next);
    }

    private RuleEvaluation evaluateCondition(Trigger trigger, long now) {
        String source = trigger.rule().source();
        if (source == null || source.isBlank()) {
            return RuleEvaluation.invalid(now + errorRecheckMs, "条件触发器缺少观测源");
        }
        long next = ScheduleUtils.nextRunTime(trigger, now, zone);
        Optional<Observation> observation = stateProvider.latest(trigger.tenantId(), source, trigger.watermark());
        if (observation.isEmpty()) {
            return RuleEvaluation.await(next);
        }
        return conditionEvaluator.matches(trigger.rule(), observation.get().data())
                ? RuleEvaluation.fire(next, observation.get())
                : RuleEvaluation.await(next);
    }
}
