/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary of one matching run.
 *
 * @param cases                 number of cases processed
 * @param controlsAssigned      total control rows emitted
 * @param shortfallCases        cases that received fewer controls than requested
 * @param workers               effective number of workers used
 * @param parallelismDowngraded true when more workers were requested than the method allows
 * @param durationNanos         wall-clock duration of the run
 */
public record MatchingStats(
        @JsonProperty("cases") int cases,
        @JsonProperty("controls_assigned") int controlsAssigned,
        @JsonProperty("shortfall_cases") int shortfallCases,
        @JsonProperty("workers") int workers,
        @JsonProperty("parallelism_downgraded") boolean parallelismDowngraded,
        @JsonProperty("duration_nanos") long durationNanos) {

    public long durationMillis() {
        return durationNanos / 1_000_000;
    }
}
