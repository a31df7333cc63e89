package com.sunny.conduit.job.core.model;

import com.sunny.conduit.job.core.enums.MatchMode;

import java.util.List;

/**
 * 触发规则
 * <p>
 * 时间型触发器只使用 expression；条件型触发器使用 source、matchMode、conditions 与 checkIntervalMs
 *
 * @param expression      间隔表达式（30s / 5m）或 Cron 表达式 / 日历简写（daily 09:30）
 * @param source          条件触发器的观测源
 * @param matchMode       条件组合方式
 * @param conditions      条件列表，为空时只要观测到数据即满足
 * @param checkIntervalMs 条件不满足时的复查间隔（毫秒）
 * @author SunnyX6
 * @date 2026-03-03
 */
public record TriggerRule(
        String expression,
        String source,
        MatchMode matchMode,
        List<Condition> conditions,
        long checkIntervalMs
) {

    public TriggerRule {
        matchMode = matchMode == null ? MatchMode.ALL : matchMode;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static TriggerRule schedule(String expression) {
        return new TriggerRule(expression, null, MatchMode.ALL, List.of(), 0);
    }

    public static TriggerRule condition(String source, MatchMode matchMode, List<Condition> conditions, long checkIntervalMs) {
        return new TriggerRule(null, source, matchMode, conditions, checkIntervalMs);
    }
}
