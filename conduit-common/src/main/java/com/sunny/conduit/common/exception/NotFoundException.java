package com.sunny.conduit.common.exception;

import com.sunny.conduit.common.constant.Code;
import com.sunny.conduit.common.constant.ErrorType;
import java.util.Map;

/**
 * 资源不存在异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class NotFoundException extends ConduitRuntimeException {

    public NotFoundException(String message, Object... args) {
        super(Code.NOT_FOUND, ErrorType.NOT_FOUND, null, false, message, args);
    }

    public NotFoundException(Throwable cause, String message, Object... args) {
        super(cause, Code.NOT_FOUND, ErrorType.NOT_FOUND, null, false, message, args);
    }

    public NotFoundException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.NOT_FOUND, type, context, false, message, args);
    }
}
