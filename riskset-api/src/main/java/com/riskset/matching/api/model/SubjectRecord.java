/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single row of a cohort table: a case or a candidate control.
 *
 * <p>Values may be null (missing). The map keeps the column order of the source table.
 *
 * @param id     unique identifier within its table
 * @param values column values keyed by column name
 */
public record SubjectRecord(String id, Map<String, Object> values) {

    public SubjectRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(values, "values must not be null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns the value of a column, or null when missing.
     */
    public Object value(String column) {
        return values.get(column);
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    /**
     * Returns a copy of this record with one column replaced.
     */
    public SubjectRecord with(String column, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        return new SubjectRecord(id, copy);
    }
}
