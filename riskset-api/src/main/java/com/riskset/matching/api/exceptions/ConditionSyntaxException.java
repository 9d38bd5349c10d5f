/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.exceptions;

/**
 * Raised when an extra eligibility condition cannot be parsed.
 */
public class ConditionSyntaxException extends ConfigurationException {

    private final String source;
    private final int position;

    public ConditionSyntaxException(String message, String source, int position) {
        super(String.format("Invalid extra condition at position %d: %s [%s]", position, message, source));
        this.source = source;
        this.position = position;
    }

    public String getSource() {
        return source;
    }

    /**
     * Zero-based character offset of the offending token.
     */
    public int getPosition() {
        return position;
    }
}
