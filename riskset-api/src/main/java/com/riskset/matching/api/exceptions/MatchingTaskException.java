/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.exceptions;

/**
 * Raised when matching a single case fails. The whole run is aborted and no
 * partial result is returned.
 */
public class MatchingTaskException extends RuntimeException {

    private final String caseId;
    private final int position;

    public MatchingTaskException(String caseId, int position, Throwable cause) {
        super(String.format("Matching failed for case '%s' at position %d: %s",
                caseId, position, cause.getMessage()), cause);
        this.caseId = caseId;
        this.position = position;
    }

    public String getCaseId() {
        return caseId;
    }

    public int getPosition() {
        return position;
    }
}
