package com.sunny.conduit.job.core.enums;

/**
 * 触发执行状态
 * <p>
 * 状态流转：
 * <pre>
 * PENDING ──分发──→ RUNNING ──执行成功──→ SUCCEEDED
 *                     │
 *                     ├──执行失败/超时──→ FAILED ──可重试──→ 新的 RUNNING 记录（attempt + 1）
 *                     │
 *                     └──用户取消──→ CANCELLED（不重试）
 * </pre>
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
public enum ExecutionStatus {

    PENDING("pending", "等待中"),
    RUNNING("running", "运行中"),
    SUCCEEDED("succeeded", "成功"),
    FAILED("failed", "失败"),
    CANCELLED("cancelled", "取消");

    private final String code;
    private final String desc;

    ExecutionStatus(String code, String desc) {
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
     * 是否为终态
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public static ExecutionStatus of(String code) {
        for (ExecutionStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("未知的执行状态: " + code);
    }
}
