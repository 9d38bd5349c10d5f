/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Output of a matching run: the matched-set table plus per-case detail.
 *
 * <p>Rows and sets are ordered by case input order regardless of how many workers
 * computed them.
 *
 * @param rows        matched-set table, case row first within each set
 * @param matchedSets one entry per case
 * @param shortfalls  cases that received fewer controls than requested
 * @param stats       run summary
 */
public record MatchingResult(
        @JsonProperty("rows") List<MatchedRow> rows,
        @JsonIgnore List<MatchedSet> matchedSets,
        @JsonProperty("shortfalls") List<Shortfall> shortfalls,
        @JsonProperty("stats") MatchingStats stats) {

    public MatchingResult {
        rows = List.copyOf(rows);
        matchedSets = List.copyOf(matchedSets);
        shortfalls = List.copyOf(shortfalls);
    }

    public boolean hasShortfalls() {
        return !shortfalls.isEmpty();
    }

    /**
     * Returns the rows of one matched set.
     */
    public List<MatchedRow> rowsForSet(int matchedSetId) {
        return rows.stream().filter(r -> r.matchedSetId() == matchedSetId).toList();
    }

    /**
     * Returns the matched set of a case.
     */
    public Optional<MatchedSet> matchedSet(String caseId) {
        return matchedSets.stream().filter(s -> s.caseId().equals(caseId)).findFirst();
    }
}
