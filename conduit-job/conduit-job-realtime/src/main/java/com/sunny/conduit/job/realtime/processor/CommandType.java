package com.sunny.conduit.job.realtime.processor;

/**
 * 客户端指令类型
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public enum CommandType {

    START_JOB("start_job"),
    CANCEL_EXECUTION("cancel_execution"),
    SUBSCRIBE_JOB("subscribe_job"),
    PING("ping");

    private final String code;

    CommandType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * @return 未知指令返回 null
     */
    public static CommandType of(String code) {
        for (CommandType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        return null;
    }
}
