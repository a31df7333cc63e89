package com.sunny.conduit.common.constant;

/**
 * 统一错误类型常量
 * 错误语义统一通过 type 字段传递给客户端
 *
 * @author Sunny
 * @date 2026-03-02
 */
public final class ErrorType {

    public static final String BAD_REQUEST = "BAD_REQUEST";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String CONFLICT = "CONFLICT";
    public static final String TOO_MANY_REQUESTS = "TOO_MANY_REQUESTS";
    public static final String SERVICE_UNAVAILABLE = "SERVICE_UNAVAILABLE";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public static final String TOKEN_EXPIRED = "TOKEN_EXPIRED";
    public static final String TOKEN_INVALID = "TOKEN_INVALID";
    public static final String TENANT_MISSING = "TENANT_MISSING";
    public static final String COMMAND_INVALID = "COMMAND_INVALID";
    public static final String COMMAND_UNKNOWN = "COMMAND_UNKNOWN";
    public static final String EXECUTION_RUNNING = "EXECUTION_RUNNING";
    public static final String WORKER_BUSY = "WORKER_BUSY";
    public static final String SCHEDULER_STOPPED = "SCHEDULER_STOPPED";

    private ErrorType() {
    }
}
