package com.sunny.conduit.common.exception;

import com.sunny.conduit.common.constant.Code;
import com.sunny.conduit.common.constant.ErrorType;
import java.util.Map;

/**
 * 服务不可用异常，可重试
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class ServiceUnavailableException extends ConduitRuntimeException {

    public ServiceUnavailableException(String message, Object... args) {
        super(Code.SERVICE_UNAVAILABLE, ErrorType.SERVICE_UNAVAILABLE, null, true, message, args);
    }

    public ServiceUnavailableException(Throwable cause, String message, Object... args) {
        super(cause, Code.SERVICE_UNAVAILABLE, ErrorType.SERVICE_UNAVAILABLE, null, true, message, args);
    }

    public ServiceUnavailableException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.SERVICE_UNAVAILABLE, type, context, true, message, args);
    }
}
