/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.model;

import com.riskset.matching.api.model.SubjectRecord;

import java.time.LocalDate;
import java.util.function.Predicate;

/**
 * Eligibility test of candidate controls for one case.
 *
 * <p>A control is eligible when
 * <ol>
 *   <li>its match-variable values equal the case's exactly,</li>
 *   <li>the extra condition, if any, holds for the (case, control) pair, and</li>
 *   <li>under incidence density with an index date column, it is at risk at the case's index date.</li>
 * </ol>
 *
 * <p>The first test is split out as {@link #matchKey()} so a pool indexed by key can skip
 * it; {@link #testResidual(SubjectRecord)} evaluates the remaining two.
 */
public final class EligibilityPredicate implements Predicate<SubjectRecord> {

    private final EligibilityModel model;
    private final SubjectRecord caseRecord;
    private final MatchKey matchKey;
    private final LocalDate indexDate;

    EligibilityPredicate(EligibilityModel model, SubjectRecord caseRecord) {
        this.model = model;
        this.caseRecord = caseRecord;
        this.matchKey = model.keyOf(caseRecord);
        this.indexDate = model.getAtRiskRule().map(rule -> rule.indexDate(caseRecord)).orElse(null);
    }

    @Override
    public boolean test(SubjectRecord control) {
        return matchKey.isComplete() && matchKey.equals(model.keyOf(control)) && testResidual(control);
    }

    /**
     * Evaluates the extra condition and the at-risk rule only. The caller guarantees
     * that the control's match key equals {@link #matchKey()}.
     */
    public boolean testResidual(SubjectRecord control) {
        if (indexDate != null && !model.getAtRiskRule().get().isAtRisk(indexDate, control)) {
            return false;
        }
        return model.getExtraCondition()
                .map(condition -> condition.test(caseRecord, control))
                .orElse(true);
    }

    public MatchKey matchKey() {
        return matchKey;
    }

    public SubjectRecord caseRecord() {
        return caseRecord;
    }

    /**
     * The case's index date, or null when no temporal constraint applies.
     */
    public LocalDate indexDate() {
        return indexDate;
    }
}
