package com.sunny.conduit.common.exception;

import com.sunny.conduit.common.constant.Code;
import com.sunny.conduit.common.constant.ErrorType;
import java.util.Map;

/**
 * 状态冲突异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class ConflictException extends ConduitRuntimeException {

    public ConflictException(String message, Object... args) {
        super(Code.CONFLICT, ErrorType.CONFLICT, null, false, message, args);
    }

    public ConflictException(Throwable cause, String message, Object... args) {
        super(cause, Code.CONFLICT, ErrorType.CONFLICT, null, false, message, args);
    }

    public ConflictException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.CONFLICT, type, context, false, message, args);
    }
}
