/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminates case rows from control rows in the matched-set table.
 */
public enum SubjectRole {
    CASE,
    CONTROL;

    @JsonValue
    public String label() {
        return this == CASE ? "case" : "control";
    }
}
