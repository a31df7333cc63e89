package com.sunny.conduit.job.core.common;

/**
 * 常量定义
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
public final class Constants {

    private Constants() {
    }

    // ==================== 系统常量 ====================

    /**
     * 默认时区
     */
    public static final String SYSTEM_TIMEZONE = "Asia/Shanghai";

    // ==================== 调度常量 ====================

    /**
     * 默认轮询间隔 (毫秒)
     */
    public static final long DEFAULT_POLL_INTERVAL_MS = 10_000L;

    /**
     * 默认并发执行上限
     */
    public static final int DEFAULT_MAX_WORKERS = 10;

    /**
     * 单次轮询最多读取的到期触发器数
     */
    public static final int DEFAULT_POLL_BATCH_SIZE = 200;

    /**
     * 默认任务执行超时 (毫秒)
     */
    public static final long DEFAULT_JOB_TIMEOUT_MS = 300_000L;

    /**
     * 停止时等待在途任务的宽限期 (毫秒)
     */
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 30_000L;

    /**
     * 条件触发器默认复查间隔 (毫秒)
     */
    public static final long DEFAULT_CONDITION_CHECK_INTERVAL_MS = 60_000L;

    /**
     * 规则求值失败后的复查间隔 (毫秒)
     */
    public static final long DEFAULT_ERROR_RECHECK_MS = 60_000L;

    // ==================== 重试常量 ====================

    /**
     * 默认最大尝试次数（含首次执行）
     */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /**
     * 默认退避基础间隔 (毫秒)
     */
    public static final long DEFAULT_BACKOFF_BASE_MS = 10_000L;

    /**
     * 默认退避上限 (毫秒)
     */
    public static final long DEFAULT_MAX_BACKOFF_MS = 600_000L;

    // ==================== 实时推送常量 ====================

    /**
     * 租户主题前缀，完整主题为 conduit.tenant.{tenantId}.events
     */
    public static final String TENANT_TOPIC_PREFIX = "conduit.tenant.";

    /**
     * 租户主题后缀
     */
    public static final String TENANT_TOPIC_SUFFIX = ".events";

    /**
     * 错误信息最大保存长度
     */
    public static final int MAX_ERROR_LENGTH = 2000;

    /**
     * 事件样本最大保存长度
     */
    public static final int MAX_EVENT_SAMPLE_LENGTH = 4000;
}
