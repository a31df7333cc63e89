package com.sunny.conduit.job.core.model;

import com.sunny.conduit.job.core.enums.ConditionOperator;

/**
 * 单个比较条件
 *
 * @param field    观测数据中的字段路径，使用点号分隔（如 payload.status）
 * @param operator 比较操作符
 * @param value    比较值；in / notIn 为集合，exists / notExists 忽略
 * @author SunnyX6
 * @date 2026-03-03
 */
public record Condition(String field, ConditionOperator operator, Object value) {
}
