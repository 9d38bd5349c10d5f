/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.infra.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.riskset.matching.api.exceptions.ConfigurationException;
import com.riskset.matching.api.model.CohortTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads a cohort table from a JSON array of flat objects, one object per subject.
 *
 * <pre>
 * [
 *   {"id": "c1", "sex": "F", "site": 3, "idx_date": "2010-06-01"},
 *   {"id": "c2", "sex": "M", "site": 3, "idx_date": null}
 * ]
 * </pre>
 *
 * <p>JSON {@code null} becomes a missing value. Nested objects and arrays are rejected.
 * Dates stay strings here; the engine converts its date columns before matching.
 */
public class CohortTableReader {
    private static final Logger logger = Logger.getLogger(CohortTableReader.class.getName());

    private final ObjectMapper objectMapper;

    public CohortTableReader() {
        this(new ObjectMapper());
    }

    public CohortTableReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads a table from a file.
     *
     * @param path      JSON file
     * @param tableName name used in error messages
     * @param idColumn  column holding subject identifiers
     * @throws IOException            if the file cannot be read
     * @throws ConfigurationException if the content is not an array of flat objects,
     *                                or identifiers are missing or duplicated
     */
    public CohortTable read(Path path, String tableName, String idColumn) throws IOException {
        String content = Files.readString(path);
        CohortTable table = parse(content, tableName, idColumn);
        logger.info("Read " + table.size() + " rows into table '" + tableName + "' from " + path);
        return table;
    }

    /**
     * Parses a table from JSON text.
     */
    public CohortTable parse(String json, String tableName, String idColumn) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Table '" + tableName + "' is not valid JSON: " + e.getOriginalMessage(),
                    tableName, null, e);
        }
        if (root == null || !root.isArray()) {
            throw new ConfigurationException("Table '" + tableName + "' must be a JSON array of objects",
                    tableName, null, null);
        }

        List<Map<String, Object>> rows = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode element : root) {
            if (!(element instanceof ObjectNode object)) {
                throw new ConfigurationException(String.format(
                        "Row %d of table '%s' is not a JSON object", index, tableName), tableName, null, null);
            }
            rows.add(toRow(object, tableName, index));
            index++;
        }
        return CohortTable.fromRows(tableName, idColumn, rows);
    }

    private static Map<String, Object> toRow(ObjectNode object, String tableName, int index) {
        Map<String, Object> row = new LinkedHashMap<>();
        var fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            row.put(field.getKey(), toValue(field.getValue(), field.getKey(), tableName, index));
        }
        return row;
    }

    private static Object toValue(JsonNode node, String column, String tableName, int index) {
        if (node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        throw new ConfigurationException(String.format(
                "Column '%s' in row %d of table '%s' must be a scalar value", column, index, tableName),
                tableName, column, null);
    }
}
