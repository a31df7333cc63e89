package com.sunny.conduit.common.exception;

import com.sunny.conduit.common.constant.Code;
import com.sunny.conduit.common.constant.ErrorType;
import java.util.Map;

/**
 * 运行时异常基类
 * 携带错误码、错误类型、上下文与可重试标记
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class ConduitRuntimeException extends RuntimeException {

    private final int code;
    private final String type;
    private final Map<String, String> context;
    private final boolean retryable;

    protected ConduitRuntimeException(String message, Object... args) {
        this(Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, null, false, null, format(message, args));
    }

    protected ConduitRuntimeException(int code, String type, String message, Object... args) {
        this(code, type, null, false, null, format(message, args));
    }

    protected ConduitRuntimeException(int code,
                                      String type,
                                      Map<String, String> context,
                                      boolean retryable,
                                      String message,
                                      Object... args) {
        this(code, type, context, retryable, null, format(message, args));
    }

    protected ConduitRuntimeException(Throwable cause,
                                      int code,
                                      String type,
                                      Map<String, String> context,
                                      boolean retryable,
                                      String message,
                                      Object... args) {
        this(code, type, context, retryable, cause, format(message, args));
    }

    private ConduitRuntimeException(int code,
                                    String type,
                                    Map<String, String> context,
                                    boolean retryable,
                                    Throwable cause,
                                    String message) {
        super(message, cause);
        this.code = code;
        this.type = type;
        this.context = context == null ? Map.of() : Map.copyOf(context);
        this.retryable = retryable;
    }

    public int getCode() {
        return code;
    }

    public String getType() {
        return type;
    }

    public Map<String, String> getContext() {
        return context;
    }

    public boolean isRetryable() {
        return retryable;
    }

    private static String format(String message, Object... args) {
        if (message == null) {
            return "";
        }
        if (args == null || args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }
}
