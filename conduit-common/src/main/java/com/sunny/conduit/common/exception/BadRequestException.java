package com.sunny.conduit.common.exception;

import com.sunny.conduit.common.constant.Code;
import com.sunny.conduit.common.constant.ErrorType;
import java.util.Map;

/**
 * 请求参数异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class BadRequestException extends ConduitRuntimeException {

    public BadRequestException(String message, Object... args) {
        super(Code.BAD_REQUEST, ErrorType.BAD_REQUEST, null, false, message, args);
    }

    public BadRequestException(Throwable cause, String message, Object... args) {
        super(cause, Code.BAD_REQUEST, ErrorType.BAD_REQUEST, null, false, message, args);
    }

    public BadRequestException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.BAD_REQUEST, type, context, false, message, args);
    }
}
