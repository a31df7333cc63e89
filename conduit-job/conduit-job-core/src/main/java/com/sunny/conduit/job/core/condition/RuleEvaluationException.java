package com.sunny.conduit.job.core.condition;

/**
 * 规则求值异常
 * <p>
 * 规则或条件本身不合法（操作数类型不符、正则非法等），与"条件不满足"区分
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
public class RuleEvaluationException extends RuntimeException {

    public RuleEvaluationException(String message) {
        super(message);
    }

    public RuleEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
