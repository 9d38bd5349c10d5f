/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reports a case that received fewer controls than requested.
 *
 * @param caseId    identifier of the case
 * @param position  zero-based position of the case in the input
 * @param requested configured number of controls per case
 * @param matched   number of controls actually assigned
 */
public record Shortfall(
        @JsonProperty("case_id") String caseId,
        @JsonProperty("position") int position,
        @JsonProperty("requested") int requested,
        @JsonProperty("matched") int matched) {

    /**
     * Number of controls that could not be assigned.
     */
    public int missing() {
        return requested - matched;
    }
}
