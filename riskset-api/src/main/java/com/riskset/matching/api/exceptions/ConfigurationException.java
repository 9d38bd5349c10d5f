/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.exceptions;

/**
 * Raised when a matching run is misconfigured.
 *
 * <p>Configuration errors are fatal and are always raised before any case is
 * processed: a missing match or extra column, a non-positive control count, an
 * unknown matching method or an invalid extra condition.
 */
public class ConfigurationException extends RuntimeException {

    private final String table;
    private final String column;

    public ConfigurationException(String message) {
        this(message, null, null, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public ConfigurationException(String message, String table, String column, Throwable cause) {
        super(message, cause);
        this.table = table;
        this.column = column;
    }

    /**
     * Builds the error for a column referenced by the configuration that a table does not carry.
     *
     * @param table  name of the table that lacks the column
     * @param column the missing column
     * @param usage  what the column was requested for (e.g. "match variable")
     */
    public static ConfigurationException missingColumn(String table, String column, String usage) {
        return new ConfigurationException(
                String.format("Column '%s' (%s) is missing from table '%s'", column, usage, table),
                table, column, null);
    }

    /**
     * Returns the table the error refers to, or null when not table specific.
     */
    public String getTable() {
        return table;
    }

    /**
     * Returns the column the error refers to, or null when not column specific.
     */
    public String getColumn() {
        return column;
    }
}
