/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One row of the matched-set table.
 *
 * @param caseId       identifier of the case the row belongs to
 * @param matchedSetId identifier shared by the case and its controls
 * @param subjectId    identifier of the subject on this row (the case itself for case rows)
 * @param role         case or control
 * @param matchValues  match-variable values, equal across the set
 * @param extraValues  carried-through extra-variable values of this subject
 */
public record MatchedRow(
        @JsonProperty("case_id") String caseId,
        @JsonProperty("matched_set") int matchedSetId,
        @JsonProperty("subject_id") String subjectId,
        @JsonProperty("role") SubjectRole role,
        @JsonProperty("match_values") Map<String, Object> matchValues,
        @JsonProperty("extra_values") Map<String, Object> extraValues) {

    public boolean isCase() {
        return role == SubjectRole.CASE;
    }
}
