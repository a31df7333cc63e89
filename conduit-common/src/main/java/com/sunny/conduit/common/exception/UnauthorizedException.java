package com.sunny.conduit.common.exception;

import com.sunny.conduit.common.constant.Code;
import com.sunny.conduit.common.constant.ErrorType;
import java.util.Map;

/**
 * 身份校验失败异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class UnauthorizedException extends ConduitRuntimeException {

    public UnauthorizedException(String message, Object... args) {
        super(Code.UNAUTHORIZED, ErrorType.UNAUTHORIZED, null, false, message, args);
    }

    public UnauthorizedException(Throwable cause, String message, Object... args) {
        super(cause, Code.UNAUTHORIZED, ErrorType.UNAUTHORIZED, null, false, message, args);
    }

    public UnauthorizedException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.UNAUTHORIZED, type, context, false, message, args);
    }
}
