package com.sunny.conduit.job.core.enums;

/**
 * 触发器状态
 * <p>
 * 仅 ENABLED 状态参与轮询；状态可被外部随时修改，下一轮轮询自然生效
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
public enum TriggerStatus {

    ENABLED("enabled", "启用"),
    PAUSED("paused", "暂停"),
    DISABLED("disabled", "禁用"),
    ERROR("error", "异常");

    private final String code;
    private final String desc;

    TriggerStatus(String code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public String getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }

    public boolean isSchedulable() {
        return this == ENABLED;
    }

    public static TriggerStatus of(String code) {
        for (TriggerStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("未知的触发器状态: " + code);
    }
}
