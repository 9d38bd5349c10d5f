/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.model;

import java.util.Objects;

/**
 * A column referenced by an extra condition, on either the case or the control side.
 *
 * @param side   which record the column is read from
 * @param column the column name
 */
public record FieldReference(Side side, String column) {

    public enum Side {
        CASE, CONTROL
    }

    public FieldReference {
        Objects.requireNonNull(side, "side must not be null");
        Objects.requireNonNull(column, "column must not be null");
    }

    public static FieldReference ofCase(String column) {
        return new FieldReference(Side.CASE, column);
    }

    public static FieldReference ofControl(String column) {
        return new FieldReference(Side.CONTROL, column);
    }

    @Override
    public String toString() {
        return (side == Side.CASE ? "case." : "control.") + column;
    }
}
