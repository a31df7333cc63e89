package com.sunny.conduit.job.core.schedule;

import com.sunny.conduit.job.core.common.Assert;
import com.sunny.conduit.job.core.common.Constants;
import com.sunny.conduit.job.core.enums.TriggerKind;
import com.sunny.conduit.job.core.model.Trigger;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * 调度时间工具类
 * <p>
 * 基于 Spring CronExpression 实现，额外支持间隔表达式与日历简写
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
public final class ScheduleUtils {

    public static final ZoneId DEFAULT_ZONE = ZoneId.of(Constants.SYSTEM_TIMEZONE);

    private ScheduleUtils() {
    }

    /**
     * 计算触发器的下一次运行时间
     * <p>
     * 返回值严格大于 now
     *
     * @param trigger 触发器
     * @param now     本轮轮询的当前时间（毫秒）
     * @param zone    Cron 计算时区
     * @return 下一次运行时间（毫秒），-1 表示没有后续触发时间
     */
    public static long nextRunTime(Trigger trigger, long now, ZoneId zone) {
        Assert.notNull(trigger, "触发器不能为空");
        TriggerKind kind = Assert.notNull(trigger.kind(), "触发器类型不能为空");

        return switch (kind) {
            case INTERVAL -> nextIntervalTime(trigger.rule().expression(), trigger.nextRunAt(), now);
            case CRON -> nextCronTime(trigger.rule().expression(), now, zone);
            case CONDITION -> now + conditionCheckInterval(trigger);
        };
    }

    /**
     * 固定间隔的下一次运行时间
     * <p>
     * 以上次计划时间为锚点按整数倍推进，错过的时间点直接跳过，不补跑
     */
    public static long nextIntervalTime(String intervalExpr, long anchorMs, long now) {
        long intervalMs = Assert.positive(parseInterval(intervalExpr), "间隔必须大于 0: " + intervalExpr);
        if (anchorMs <= 0 || anchorMs > now) {
            return now + intervalMs;
        }
        long elapsed = now - anchorMs;
        return anchorMs + (elapsed / intervalMs + 1) * intervalMs;
    }

    /**
     * Cron 下一次运行时间
     *
     * @return 下一次触发时间 (毫秒)，-1 表示无法计算
     */
    public static long nextCronTime(String expression, long fromMs, ZoneId zone) {
        Assert.notBlank(expression, "Cron 表达式不能为空");

        CronExpression cron = CronExpression.parse(resolveCron(expression));
        ZonedDateTime from = Instant.ofEpochMilli(fromMs).atZone(zone == null ? DEFAULT_ZONE : zone);
        ZonedDateTime next = cron.next(from);

        if (next == null) {
            return -1;
        }
        return next.toInstant().toEpochMilli();
    }

    /**
     * 解析间隔表达式
     * <p>
     * 支持格式：
     * <ul>
     *     <li>纯数字：秒数</li>
     *     <li>带单位：500ms, 10s, 5m, 1h, 1d</li>
     * </ul>
     *
     * @param intervalExpr 间隔表达式
     * @return 间隔毫秒数
     */
    public static long parseInterval(String intervalExpr) {
        Assert.notBlank(intervalExpr, "间隔表达式不能为空");

        String expr = intervalExpr.trim().toLowerCase(Locale.ROOT);
        try {
            if (expr.endsWith("ms")) {
                return Long.parseLong(expr.substring(0, expr.length() - 2).trim());
            } else if (expr.endsWith("s")) {
                return Long.parseLong(expr.substring(0, expr.length() - 1).trim()) * 1000;
            } else if (expr.endsWith("m")) {
                return Long.parseLong(expr.substring(0, expr.length() - 1).trim()) * 60 * 1000;
            } else if (expr.endsWith("h")) {
                return Long.parseLong(expr.substring(0, expr.length() - 1).trim()) * 60 * 60 * 1000;
            } else if (expr.endsWith("d")) {
                return Long.parseLong(expr.substring(0, expr.length() - 1).trim()) * 24 * 60 * 60 * 1000;
            }
            return Long.parseLong(expr) * 1000;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("非法的间隔表达式: " + intervalExpr, e);
        }
    }

    /**
     * 把日历简写翻译为 Spring Cron 表达式，非简写原样返回
     * <p>
     * 支持格式：
     * <ul>
     *     <li>daily HH:MM</li>
     *     <li>weekly D HH:MM，D 取 0（周日）~ 6（周六）</li>
     *     <li>monthly N HH:MM，N 取 1 ~ 31</li>
     * </ul>
     */
    public static String resolveCron(String expression) {
        Assert.notBlank(expression, "Cron 表达式不能为空");

        String[] parts = expression.trim().split("\\s+");
        String mode = parts[0].toLowerCase(Locale.ROOT);
        switch (mode) {
            case "daily" -> {
                Assert.isTrue(parts.length == 2, "daily 格式应为 daily HH:MM");
                int[] time = parseClock(parts[1]);
                return "0 " + time[1] + " " + time[0] + " * * *";
            }
            case "weekly" -> {
                Assert.isTrue(parts.length == 3, "weekly 格式应为 weekly D HH:MM");
                int day = parseRange(parts[1], 0, 6, "星期");
                int[] time = parseClock(parts[2]);
                return "0 " + time[1] + " " + time[0] + " * * " + day;
            }
            case "monthly" -> {
                Assert.isTrue(parts.length == 3, "monthly 格式应为 monthly N HH:MM");
                int day = parseRange(parts[1], 1, 31, "日期");
                int[] time = parseClock(parts[2]);
                return "0 " + time[1] + " " + time[0] + " " + day + " * *";
            }
            default -> {
                return expression.trim();
            }
        }
    }

    /**
     * 验证调度表达式是否有效
     */
    public static boolean isValidCron(String expression) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        try {
            CronExpression.parse(resolveCron(expression));
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static long conditionCheckInterval(Trigger trigger) {
        long interval = trigger.rule().checkIntervalMs();
        return interval > 0 ? interval : Constants.DEFAULT_CONDITION_CHECK_INTERVAL_MS;
    }

    private static int[] parseClock(String clock) {
        String[] hm = clock.split(":");
        Assert.isTrue(hm.length == 2, "时间格式应为 HH:MM: " + clock);
        int hour = parseRange(hm[0], 0, 23, "小时");
        int minute = parseRange(hm[1], 0, 59, "分钟");
        return new int[]{hour, minute};
    }

    private static int parseRange(String text, int min, int max, String name) {
        int value;
        try {
            value = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + "不是数字: " + text, e);
        }
        Assert.isTrue(value >= min && value <= max, name + "超出范围 [" + min + ", " + max + "]: " + text);
        return value;
    }
}
