package com.sunny.conduit.common.exception;

import com.sunny.conduit.common.constant.Code;
import com.sunny.conduit.common.constant.ErrorType;
import java.util.Map;

/**
 * 容量不足异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class TooManyRequestsException extends ConduitRuntimeException {

    public TooManyRequestsException(String message, Object... args) {
        super(Code.TOO_MANY_REQUESTS, ErrorType.TOO_MANY_REQUESTS, null, false, message, args);
    }

    public TooManyRequestsException(Throwable cause, String message, Object... args) {
        super(cause, Code.TOO_MANY_REQUESTS, ErrorType.TOO_MANY_REQUESTS, null, false, message, args);
    }

    public TooManyRequestsException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.TOO_MANY_REQUESTS, type, context, false, message, args);
    }
}
