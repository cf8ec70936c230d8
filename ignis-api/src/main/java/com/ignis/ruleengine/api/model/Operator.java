/*
 * Copyright (c) 2025 Ignis Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.ignis.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Closed set of comparison operators a condition may use.
 *
 * <p>Each constant carries its own comparison, so a condition resolves its operator
 * once at load time and never dispatches on the symbol again.
 *
 * <p>Equality operators compare numbers numerically and strings exactly. Ordering
 * operators are defined for numbers only. A kind mismatch between the record value
 * and the operand is never an error: {@link #test} returns {@code false}.
 */
public enum Operator {
    GREATER_THAN(">") {
        @Override
        boolean compare(Object actual, Object expected, ValueKind kind) {
            return kind == ValueKind.NUMERIC && compareNumbers(actual, expected) > 0;
        }
    },
    LESS_THAN("<") {
        @Override
        boolean compare(Object actual, Object expected, ValueKind kind) {
            return kind == ValueKind.NUMERIC && compareNumbers(actual, expected) < 0;
        }
    },
    GREATER_THAN_OR_EQUAL(">=") {
        @Override
        boolean compare(Object actual, Object expected, ValueKind kind) {
            return kind == ValueKind.NUMERIC && compareNumbers(actual, expected) >= 0;
        }
    },
    LESS_THAN_OR_EQUAL("<=") {
        @Override
        boolean compare(Object actual, Object expected, ValueKind kind) {
            return kind == ValueKind.NUMERIC && compareNumbers(actual, expected) <= 0;
        }
    },
    EQUAL_TO("==") {
        @Override
        boolean compare(Object actual, Object expected, ValueKind kind) {
            return kind == ValueKind.NUMERIC
                    ? compareNumbers(actual, expected) == 0
                    : actual.equals(expected);
        }
    },
    NOT_EQUAL_TO("!=") {
        @Override
        boolean compare(Object actual, Object expected, ValueKind kind) {
            return kind == ValueKind.NUMERIC
                    ? compareNumbers(actual, expected) != 0
                    : !actual.equals(expected);
        }
    };

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /**
     * Returns true if this operator orders its operands rather than testing equality.
     */
    public boolean isOrdering() {
        return this != EQUAL_TO && this != NOT_EQUAL_TO;
    }

    /**
     * Applies this operator to a record value and a rule operand.
     *
     * @param actual      value read from the record, may be null
     * @param expected    operand declared by the rule
     * @param operandKind kind tagged on the operand at load time
     * @return false when the value is null or its kind differs from the operand's
     */
    public boolean test(Object actual, Object expected, ValueKind operandKind) {
        if (actual == null || expected == null) {
            return false;
        }
        if (ValueKind.of(actual) != operandKind) {
            return false;
        }
        if (operandKind == ValueKind.NUMERIC && (isNaN(actual) || isNaN(expected))) {
            return false;
        }
        return compare(actual, expected, operandKind);
    }

    abstract boolean compare(Object actual, Object expected, ValueKind kind);

    /**
     * Resolves a symbol such as {@code ">="}.
     *
     * @return the operator, or null if the symbol is not recognized
     */
    public static Operator fromSymbol(String symbol) {
        if (symbol == null) return null;
        String trimmed = symbol.trim();
        for (Operator op : values()) {
            if (op.symbol.equals(trimmed)) {
                return op;
            }
        }
        return null;
    }

    private static int compareNumbers(Object actual, Object expected) {
        Number a = (Number) actual;
        Number b = (Number) expected;
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        if ((a instanceof BigDecimal || b instanceof BigDecimal) && isFinite(a) && isFinite(b)) {
            return toBigDecimal(a).compareTo(toBigDecimal(b));
        }
        // longs above 2^53 lose precision as doubles
        if ((isIntegral(a) || isIntegral(b)) && isFinite(a) && isFinite(b)) {
            return exact(a).compareTo(exact(b));
        }
        double x = a.doubleValue();
        double y = b.doubleValue();
        return x < y ? -1 : (x > y ? 1 : 0);
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    private static boolean isNaN(Object n) {
        return (n instanceof Double && ((Double) n).isNaN()) || (n instanceof Float && ((Float) n).isNaN());
    }

    private static boolean isFinite(Number n) {
        return !(n instanceof Double || n instanceof Float) || Double.isFinite(n.doubleValue());
    }

    private static BigDecimal exact(Number n) {
        return isIntegral(n) ? BigDecimal.valueOf(n.longValue()) : new BigDecimal(n.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number n) {
        return n instanceof BigDecimal ? (BigDecimal) n : new BigDecimal(n.toString());
    }

    @Override
    public String toString() {
        return symbol;
    }
}
