package com.metricalerts.evaluation;

import com.metricalerts.domain.enums.ThresholdOperator;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.BiPredicate;
import org.springframework.stereotype.Component;

/**
 * Compares a measured metric value against a rule threshold.
 *
 * <p>Each {@link ThresholdOperator} is backed by one registered comparison. Equality is
 * tolerant: values within {@link #EQUALITY_EPSILON} of the threshold are equal, which
 * absorbs rounding in computed percentages and averages.
 *
 * <p>Never throws. A missing value or threshold, or an operator symbol that matches no
 * registered comparison, evaluates to false so that one malformed rule cannot abort a
 * batch.
 */
@Component
public class ConditionEvaluator {

    public static final BigDecimal EQUALITY_EPSILON = new BigDecimal("0.001");

    private final Map<ThresholdOperator, BiPredicate<BigDecimal, BigDecimal>> comparisons =
            new EnumMap<>(ThresholdOperator.class);

    public ConditionEvaluator() {
        comparisons.put(ThresholdOperator.GT, (value, threshold) -> value.compareTo(threshold) > 0);
        comparisons.put(ThresholdOperator.LT, (value, threshold) -> value.compareTo(threshold) < 0);
        comparisons.put(ThresholdOperator.GTE, (value, threshold) -> value.compareTo(threshold) >= 0);
        comparisons.put(ThresholdOperator.LTE, (value, threshold) -> value.compareTo(threshold) <= 0);
        comparisons.put(ThresholdOperator.EQ, ConditionEvaluator::withinEpsilon);
        comparisons.put(ThresholdOperator.NEQ, (value, threshold) -> !withinEpsilon(value, threshold));
    }

    /**
     * Evaluates {@code value <operator> threshold} for an operator stored by its symbol.
     *
     * @return true if the condition holds; false if it does not or cannot be evaluated
     */
    public boolean evaluate(BigDecimal value, BigDecimal threshold, String operatorSymbol) {
        return ThresholdOperator.fromSymbol(operatorSymbol)
                .map(operator -> evaluate(value, threshold, operator))
                .orElse(false);
    }

    public boolean evaluate(BigDecimal value, BigDecimal threshold, ThresholdOperator operator) {
        if (value == null || threshold == null || operator == null) {
            return false;
        }
        BiPredicate<BigDecimal, BigDecimal> comparison = comparisons.get(operator);
        return comparison != null && comparison.test(value, threshold);
    }

    private static boolean withinEpsilon(BigDecimal value, BigDecimal threshold) {
        return value.subtract(threshold).abs().compareTo(EQUALITY_EPSILON) < 0;
    }
}
