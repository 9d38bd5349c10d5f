/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.model;

import com.riskset.matching.api.model.SubjectRecord;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The tuple of match-variable values of a record, used for exact-equality matching.
 *
 * <p>Numeric values are normalized so that integral values compare equal regardless of
 * their boxed type ({@code 1}, {@code 1L} and {@code 1.0} are the same key component).
 * A key with a missing component is incomplete and matches nothing.
 */
public final class MatchKey {

    private final List<Object> values;
    private final boolean complete;
    private final int hash;

    private MatchKey(List<Object> values) {
        this.values = Collections.unmodifiableList(values);
        this.complete = !values.contains(null);
        this.hash = values.hashCode();
    }

    /**
     * Extracts the key of a record for the given match variables.
     */
    public static MatchKey of(SubjectRecord record, List<String> matchVars) {
        List<Object> values = new ArrayList<>(matchVars.size());
        for (String var : matchVars) {
            values.add(normalize(record.value(var)));
        }
        return new MatchKey(values);
    }

    static Object normalize(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : new BigDecimal(big);
        }
        if (value instanceof Float || value instanceof Double) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return null;
            }
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.0e15) {
                return (long) d;
            }
            return d;
        }
        if (value instanceof BigDecimal dec) {
            BigDecimal stripped = dec.stripTrailingZeros();
            if (stripped.scale() <= 0 && stripped.precision() - stripped.scale() < 19) {
                return stripped.longValueExact();
            }
            return stripped.doubleValue();
        }
        return value;
    }

    public List<Object> values() {
        return values;
    }

    /**
     * True when no component is missing.
     */
    public boolean isComplete() {
        return complete;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchKey other)) return false;
        return hash == other.hash && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
