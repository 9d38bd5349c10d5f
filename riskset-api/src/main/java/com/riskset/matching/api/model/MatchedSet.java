/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api.model;

import java.util.List;
import java.util.Optional;

/**
 * One case and the controls assigned to it.
 *
 * @param matchedSetId identifier shared by every row of the set (1-based, in case input order)
 * @param position     zero-based position of the case in the input
 * @param caseRecord   the case
 * @param controls     assigned controls in draw order; may be empty
 * @param requested    configured number of controls per case
 */
public record MatchedSet(
        int matchedSetId,
        int position,
        SubjectRecord caseRecord,
        List<SubjectRecord> controls,
        int requested) {

    public MatchedSet {
        controls = List.copyOf(controls);
    }

    public String caseId() {
        return caseRecord.id();
    }

    public int size() {
        return controls.size();
    }

    public List<String> controlIds() {
        return controls.stream().map(SubjectRecord::id).toList();
    }

    public boolean isShortfall() {
        return controls.size() < requested;
    }

    /**
     * Returns the shortfall for this set, if it has fewer controls than requested.
     */
    public Optional<Shortfall> shortfall() {
        return isShortfall()
                ? Optional.of(new Shortfall(caseId(), position, requested, controls.size()))
                : Optional.empty();
    }
}
