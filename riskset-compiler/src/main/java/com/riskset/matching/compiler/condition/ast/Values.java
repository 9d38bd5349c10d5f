/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition.ast;

import com.riskset.matching.runtime.model.DateValues;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Value semantics of the condition language.
 *
 * <p>Missing values follow three-valued logic: a comparison with a missing operand is
 * missing, {@code false && NA} is false, {@code true || NA} is true, and a condition that
 * evaluates to missing does not admit the control.
 *
 * <p>Numbers compare numerically across boxed types. Dates compare chronologically and
 * an ISO date string is accepted wherever the other operand is a date. Arithmetic on a
 * date and a number shifts the date by that many days; subtracting two dates yields the
 * number of days between them.
 */
public final class Values {

    private Values() {
        throw new AssertionError("No instances");
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    /**
     * Reads a logical operand: a Boolean, or null for missing.
     */
    public static Boolean toLogical(Object value) {
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new IllegalArgumentException("Expected a boolean but got " + describe(value));
    }

    /**
     * Reads {@code value} as a date when {@code other} is one, so that a missing-value
     * marker opposite a date becomes missing. Other values are returned unchanged.
     */
    public static Object coerceAgainst(Object value, Object other) {
        if (other instanceof LocalDate && !(value instanceof LocalDate)) {
            return DateValues.toLocalDate(value);
        }
        return value;
    }

    /**
     * Equality of two non-missing operands, after {@link #coerceAgainst}.
     */
    public static boolean equal(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return compareNumbers(a, b) == 0;
        }
        return left.equals(right);
    }

    /**
     * Ordering of two non-missing operands, after {@link #coerceAgainst}.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return compareNumbers(a, b);
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        if (left instanceof Comparable a && left.getClass() == right.getClass()) {
            return a.compareTo(right);
        }
        throw new IllegalArgumentException("Cannot compare " + describe(left) + " with " + describe(right));
    }

    private static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    public static Object add(Object left, Object right) {
        if (left instanceof LocalDate date && right instanceof Number days) {
            return date.plusDays(wholeDays(days));
        }
        if (left instanceof Number days && right instanceof LocalDate date) {
            return date.plusDays(wholeDays(days));
        }
        Number a = requireNumber(left, "+");
        Number b = requireNumber(right, "+");
        if (isIntegral(a) && isIntegral(b)) {
            return Math.addExact(a.longValue(), b.longValue());
        }
        return a.doubleValue() + b.doubleValue();
    }

    public static Object subtract(Object left, Object right) {
        if (left instanceof LocalDate date && right instanceof Number days) {
            return date.minusDays(wholeDays(days));
        }
        if (left instanceof LocalDate a && right instanceof LocalDate b) {
            return ChronoUnit.DAYS.between(b, a);
        }
        Number a = requireNumber(left, "-");
        Number b = requireNumber(right, "-");
        if (isIntegral(a) && isIntegral(b)) {
            return Math.subtractExact(a.longValue(), b.longValue());
        }
        return a.doubleValue() - b.doubleValue();
    }

    public static Object multiply(Object left, Object right) {
        Number a = requireNumber(left, "*");
        Number b = requireNumber(right, "*");
        if (isIntegral(a) && isIntegral(b)) {
            return Math.multiplyExact(a.longValue(), b.longValue());
        }
        return a.doubleValue() * b.doubleValue();
    }

    /**
     * Division always yields a double; division by zero yields a missing value.
     */
    public static Object divide(Object left, Object right) {
        Number a = requireNumber(left, "/");
        Number b = requireNumber(right, "/");
        if (b.doubleValue() == 0.0) {
            return null;
        }
        return a.doubleValue() / b.doubleValue();
    }

    public static Object negate(Object value) {
        Number n = requireNumber(value, "unary -");
        return isIntegral(n) ? (Object) Math.negateExact(n.longValue()) : (Object) (-n.doubleValue());
    }

    private static long wholeDays(Number days) {
        double d = days.doubleValue();
        if (d != Math.rint(d)) {
            throw new IllegalArgumentException("Date arithmetic requires whole days, got " + days);
        }
        return days.longValue();
    }

    private static Number requireNumber(Object value, String operator) {
        if (value instanceof Number n) {
            return n;
        }
        throw new IllegalArgumentException("Operator " + operator + " expects numbers but got " + describe(value));
    }

    static String describe(Object value) {
        return value == null ? "NA" : value.getClass().getSimpleName() + " '" + value + "'";
    }
}
