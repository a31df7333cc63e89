package com.sunny.conduit.common.constant;

/**
 * 统一错误码常量
 * 调度、实时推送与命令处理共用同一套状态码
 *
 * @author Sunny
 * @date 2026-03-02
 */
public final class Code {

    public static final int OK = 0;
    public static final int BAD_REQUEST = 400;
    public static final int UNAUTHORIZED = 401;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;
    public static final int TOO_MANY_REQUESTS = 429;
    public static final int INTERNAL_ERROR = 500;
    public static final int SERVICE_UNAVAILABLE = 503;

    private Code() {
    }
}
