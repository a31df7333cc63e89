package com.sunny.conduit.job.core.condition;

import com.sunny.conduit.job.core.enums.ConditionOperator;
import com.sunny.conduit.job.core.enums.MatchMode;
import com.sunny.conduit.job.core.model.Condition;
import com.sunny.conduit.job.core.model.TriggerRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private final Map<String, Object> payload = Map.of(
            "status", "FAILED",
            "count", 12,
            "order", Map.of("amount", "99.50", "tags", List.of("vip", "cn")));

    @Test
    void matches_shouldCombineConditionsWithAll() {
        TriggerRule rule = rule(MatchMode.ALL,
                new Condition("status", ConditionOperator.EQ, "FAILED"),
                new Condition("count", ConditionOperator.GTE, 10));

        assertTrue(evaluator.matches(rule, payload));
    }

    @Test
    void matches_shouldCombineConditionsWithAny() {
        TriggerRule rule = rule(MatchMode.ANY,
                new Condition("status", ConditionOperator.EQ, "OK"),
                new Condition("order.amount", ConditionOperator.GT, "99"));

        assertTrue(evaluator.matches(rule, payload));
    }

    @Test
    void matches_shouldTreatMissingFieldAsUnmatched() {
        assertFalse(evaluator.matches(rule(MatchMode.ALL, new Condition("missing", ConditionOperator.NEQ, "x")), payload));
        assertTrue(evaluator.matches(rule(MatchMode.ALL, new Condition("missing", ConditionOperator.NOT_EXISTS, null)), payload));
    }

    @Test
    void matches_shouldSupportStringAndCollectionOperators() {
        assertTrue(evaluator.matches(rule(MatchMode.ALL,
                new Condition("status", ConditionOperator.STARTS_WITH, "FAIL"),
                new Condition("status", ConditionOperator.REGEX, "^F.*D$"),
                new Condition("order.tags", ConditionOperator.CONTAINS, "vip"),
                new Condition("status", ConditionOperator.IN, List.of("FAILED", "TIMEOUT"))), payload));
    }

    @Test
    void matches_shouldReturnFalseWithoutObservedData() {
        assertFalse(evaluator.matches(rule(MatchMode.ALL), null));
        assertTrue(evaluator.matches(rule(MatchMode.ALL), Map.of()));
    }

    @Test
    void matches_shouldRejectNonNumericOperandForNumericOperator() {
        TriggerRule rule = rule(MatchMode.ALL, new Condition("status", ConditionOperator.GT, 3));

        assertThrows(RuleEvaluationException.class, () -> evaluator.matches(rule, payload));
    }

    @Test
    void matches_shouldRejectBrokenRegex() {
        TriggerRule rule = rule(MatchMode.ALL, new Condition("status", ConditionOperator.REGEX, "(["));

        assertThrows(RuleEvaluationException.class, () -> evaluator.matches(rule, payload));
    }

    private static TriggerRule rule(MatchMode mode, Condition... conditions) {
        return TriggerRule.condition("metrics", mode, List.of(conditions), 1_000L);
    }
}
