/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.context;

import com.riskset.matching.api.exceptions.ConfigurationException;
import com.riskset.matching.api.model.CohortTable;
import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.DateValues;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts the configured date columns of a table to {@link LocalDate} values.
 *
 * <p>ISO strings and integral day offsets from the configured origin are converted; values
 * that already are dates are kept. Missing values stay missing. The set of date columns is
 * supplied per run, so concurrent runs with different conventions do not interfere.
 */
public final class DateColumnNormalizer {

    private final Set<String> dateFields;
    private final LocalDate origin;

    public DateColumnNormalizer(Set<String> dateFields, LocalDate origin) {
        this.dateFields = Set.copyOf(dateFields);
        this.origin = Objects.requireNonNull(origin, "origin must not be null");
    }

    /**
     * Returns the table with its date columns converted, or the table itself when it has none.
     *
     * @throws ConfigurationException if a value of a date column cannot be read as a date
     */
    public CohortTable normalize(CohortTable table) {
        List<String> present = table.columns().stream().filter(dateFields::contains).toList();
        if (present.isEmpty() || table.isEmpty()) {
            return table;
        }
        return table.mapRows(row -> convert(table, row, present));
    }

    private SubjectRecord convert(CohortTable table, SubjectRecord row, List<String> columns) {
        Map<String, Object> values = new LinkedHashMap<>(row.values());
        boolean changed = false;
        for (String column : columns) {
            Object raw = values.get(column);
            if (raw == null || raw instanceof LocalDate) {
                continue;
            }
            try {
                values.put(column, DateValues.toLocalDate(raw, origin));
                changed = true;
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(String.format(
                        "Column '%s' of subject '%s' in table '%s' is not a date: %s",
                        column, row.id(), table.name(), e.getMessage()), table.name(), column, e);
            }
        }
        return changed ? new SubjectRecord(row.id(), values) : row;
    }
}
