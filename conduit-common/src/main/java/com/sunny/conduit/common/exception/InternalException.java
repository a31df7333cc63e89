package com.sunny.conduit.common.exception;

import com.sunny.conduit.common.constant.Code;
import com.sunny.conduit.common.constant.ErrorType;
import java.util.Map;

/**
 * 内部异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class InternalException extends ConduitRuntimeException {

    public InternalException(String message, Object... args) {
        super(Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, null, false, message, args);
    }

    public InternalException(Throwable cause, String message, Object... args) {
        super(cause, Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, null, false, message, args);
    }

    public InternalException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.INTERNAL_ERROR, type, context, false, message, args);
    }
}
