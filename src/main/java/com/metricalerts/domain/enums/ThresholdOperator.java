package com.metricalerts.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators for alert rule thresholds.
 *
 * <p>GT and LT are strict, GTE and LTE inclusive. EQ and NEQ compare within
 * {@code ConditionEvaluator.EQUALITY_EPSILON} to tolerate floating point noise
 * in computed metrics. Rules store the operator by its symbol.
 */
public enum ThresholdOperator {
    /** value > threshold. */
    GT(">"),
    /** value < threshold. */
    LT("<"),
    /** value >= threshold. */
    GTE(">="),
    /** value <= threshold. */
    LTE("<="),
    /** |value - threshold| < epsilon. */
    EQ("="),
    /** |value - threshold| >= epsilon. */
    NEQ("!=");

    private final String symbol;

    ThresholdOperator(String symbol) {
        this.symbol = symbol;
    }

    public static Optional<ThresholdOperator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String trimmed = symbol.trim();
        return Arrays.stream(values())
                .filter(operator -> operator.symbol.equals(trimmed))
                .findFirst();
    }
}
