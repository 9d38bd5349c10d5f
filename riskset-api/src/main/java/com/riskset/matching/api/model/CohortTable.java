/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.model;

import com.riskset.matching.api.exceptions.ConfigurationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * An immutable table of subject records sharing one column layout.
 *
 * <p>Used for both the cases table and the control pool. Identifiers are unique
 * within a table.
 *
 * @param name     display name used in error messages (e.g. "cases")
 * @param idColumn column holding the subject identifier
 * @param columns  column names in source order
 * @param rows     the records, in input order
 */
public record CohortTable(String name, String idColumn, List<String> columns, List<SubjectRecord> rows) {

    public CohortTable {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(idColumn, "idColumn must not be null");
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    /**
     * Builds a table from raw rows. The column set is the union of all row keys
     * in first-seen order.
     *
     * @throws ConfigurationException if the id column is absent, or an identifier is missing or duplicated
     */
    public static CohortTable fromRows(String name, String idColumn, List<? extends Map<String, ?>> rawRows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, ?> row : rawRows) {
            columns.addAll(row.keySet());
        }
        if (!rawRows.isEmpty() && !columns.contains(idColumn)) {
            throw ConfigurationException.missingColumn(name, idColumn, "identifier");
        }
        columns.add(idColumn);

        List<SubjectRecord> rows = new ArrayList<>(rawRows.size());
        Set<String> seen = new HashSet<>();
        int index = 0;
        for (Map<String, ?> row : rawRows) {
            Object rawId = row.get(idColumn);
            if (rawId == null) {
                throw new ConfigurationException(String.format(
                        "Row %d of table '%s' has no value for identifier column '%s'", index, name, idColumn),
                        name, idColumn, null);
            }
            String id = String.valueOf(rawId);
            if (!seen.add(id)) {
                throw new ConfigurationException(String.format(
                        "Duplicate identifier '%s' in table '%s'", id, name), name, idColumn, null);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> values = (Map<String, Object>) row;
            rows.add(new SubjectRecord(id, values));
            index++;
        }
        return new CohortTable(name, idColumn, new ArrayList<>(columns), rows);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Whether the table declares any column besides its identifier. An empty JSON array
     * yields a table without a schema.
     */
    public boolean hasSchema() {
        return columns.stream().anyMatch(column -> !column.equals(idColumn));
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Returns a table with every row rewritten by the given function.
     */
    public CohortTable mapRows(UnaryOperator<SubjectRecord> mapper) {
        List<SubjectRecord> mapped = new ArrayList<>(rows.size());
        for (SubjectRecord row : rows) {
            mapped.add(mapper.apply(row));
        }
        return new CohortTable(name, idColumn, columns, mapped);
    }
}
