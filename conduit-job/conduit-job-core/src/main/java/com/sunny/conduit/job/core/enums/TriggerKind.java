package com.sunny.conduit.job.core.enums;

/**
 * 触发器类型
 * <p>
 * INTERVAL、CRON 为时间型，到期即触发；CONDITION 需要对最新观测状态求值
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
public enum TriggerKind {

    INTERVAL("interval", "固定间隔"),
    CRON("cron", "日历调度"),
    CONDITION("condition", "条件触发");

    private final String code;
    private final String desc;

    TriggerKind(String code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public String getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }

    /**
     * 是否为时间型触发器
     */
    public boolean isTemporal() {
        return this == INTERVAL || this == CRON;
    }

    public static TriggerKind of(String code) {
        for (TriggerKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("未知的触发器类型: " + code);
    }
}
