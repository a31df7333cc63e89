package com.sunny.conduit.job.core.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 条件比较操作符
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
public enum ConditionOperator {

    EQ("eq"),
    NEQ("neq"),
    CONTAINS("contains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    REGEX("regex"),
    IN("in"),
    NOT_IN("notIn"),
    EXISTS("exists"),
    NOT_EXISTS("notExists");

    private final String code;

    ConditionOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否为数值比较
     */
    public boolean isNumeric() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }

    @JsonCreator
    public static ConditionOperator of(String code) {
        for (ConditionOperator operator : values()) {
            if (operator.code.equals(code)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("未知的条件操作符: " + code);
    }
}
