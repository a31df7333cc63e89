package com.sunny.conduit.job.core.condition;

import com.sunny.conduit.job.core.enums.ConditionOperator;
import com.sunny.conduit.job.core.model.Condition;
import com.sunny.conduit.job.core.model.TriggerRule;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 条件求值器
 * <p>
 * 对观测数据逐条比较，ALL 要求全部满足，ANY 要求任一满足。
 * 字段不存在时除 notExists 外一律不满足
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
public class ConditionEvaluator {

    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    /**
     * 判断观测数据是否满足规则
     *
     * @param rule    触发规则
     * @param payload 观测数据
     * @throws RuleEvaluationException 条件不合法
     */
    public boolean matches(TriggerRule rule, Map<String, Object> payload) {
        if (payload == null) {
            return false;
        }
        List<Condition> conditions = rule.conditions();
        if (conditions.isEmpty()) {
            return true;
        }
        return switch (rule.matchMode()) {
            case ALL -> conditions.stream().allMatch(condition -> evaluate(condition, payload));
            case ANY -> conditions.stream().anyMatch(condition -> evaluate(condition, payload));
        };
    }

    boolean evaluate(Condition condition, Map<String, Object> payload) {
        ConditionOperator operator = condition.operator();
        if (operator == null || condition.field() == null || condition.field().isBlank()) {
            throw new RuleEvaluationException("条件缺少字段或操作符: " + condition);
        }
        Object actual = resolve(payload, condition.field());
        Object expected = condition.value();

        if (operator == ConditionOperator.EXISTS) {
            return actual != null;
        }
        if (operator == ConditionOperator.NOT_EXISTS) {
            return actual == null;
        }
        if (actual == null) {
            return false;
        }

        return switch (operator) {
            case EQ -> looselyEquals(actual, expected);
            case NEQ -> !looselyEquals(actual, expected);
            case CONTAINS -> contains(actual, expected);
            case STARTS_WITH -> String.valueOf(actual).startsWith(String.valueOf(expected));
            case ENDS_WITH -> String.valueOf(actual).endsWith(String.valueOf(expected));
            case GT -> compare(actual, expected, condition) > 0;
            case GTE -> compare(actual, expected, condition) >= 0;
            case LT -> compare(actual, expected, condition) < 0;
            case LTE -> compare(actual, expected, condition) <= 0;
            case REGEX -> pattern(expected).matcher(String.valueOf(actual)).find();
            case IN -> in(actual, expected, condition);
            case NOT_IN -> !in(actual, expected, condition);
            case EXISTS, NOT_EXISTS -> throw new IllegalStateException("unreachable");
        };
    }

    /**
     * 按点号路径逐层读取嵌套 Map
     */
    @SuppressWarnings("unchecked")
    static Object resolve(Map<String, Object> payload, String path) {
        if (payload.containsKey(path)) {
            return payload.get(path);
        }
        Object current = payload;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = ((Map<String, Object>) map).get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private boolean looselyEquals(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        BigDecimal left = toDecimal(actual);
        BigDecimal right = toDecimal(expected);
        if (left != null && right != null) {
            return left.compareTo(right) == 0;
        }
        return Objects.equals(String.valueOf(actual), String.valueOf(expected));
    }

    private boolean contains(Object actual, Object expected) {
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> looselyEquals(item, expected));
        }
        return String.valueOf(actual).contains(String.valueOf(expected));
    }

    private boolean in(Object actual, Object expected, Condition condition) {
        if (!(expected instanceof Collection<?> candidates)) {
            throw new RuleEvaluationException("in/notIn 的比较值必须是列表: " + condition);
        }
        return candidates.stream().anyMatch(candidate -> looselyEquals(actual, candidate));
    }

    private int compare(Object actual, Object expected, Condition condition) {
        BigDecimal left = toDecimal(actual);
        BigDecimal right = toDecimal(expected);
        if (right == null) {
            throw new RuleEvaluationException("数值比较的比较值不是数字: " + condition);
        }
        if (left == null) {
            throw new RuleEvaluationException("字段值不是数字: " + condition.field() + "=" + actual);
        }
        return left.compareTo(right);
    }

    private Pattern pattern(Object expected) {
        String regex = String.valueOf(expected);
        try {
            return patternCache.computeIfAbsent(regex, Pattern::compile);
        } catch (PatternSyntaxException e) {
            throw new RuleEvaluationException("非法的正则表达式: " + regex, e);
        }
    }

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number || value instanceof String) {
            try {
                return new BigDecimal(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
