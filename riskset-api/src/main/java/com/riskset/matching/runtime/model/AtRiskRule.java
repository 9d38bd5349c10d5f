/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.model;

import com.riskset.matching.api.model.SubjectRecord;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Temporal eligibility under incidence-density sampling.
 *
 * <p>A control is at risk at the case's index date when it has no recorded date of its
 * own, or its date is strictly later than the index date. A case without an index date
 * imposes no constraint.
 *
 * @param caseDateField    index date column of the cases table
 * @param controlDateField event date column of the control pool
 */
public record AtRiskRule(String caseDateField, String controlDateField) {

    public AtRiskRule {
        Objects.requireNonNull(caseDateField, "caseDateField must not be null");
        Objects.requireNonNull(controlDateField, "controlDateField must not be null");
    }

    /**
     * Reads the index date of a case, or null when it has none.
     */
    public LocalDate indexDate(SubjectRecord caseRecord) {
        return DateValues.toLocalDate(caseRecord.value(caseDateField));
    }

    /**
     * Tests a control against a case's already-resolved index date.
     */
    public boolean isAtRisk(LocalDate indexDate, SubjectRecord control) {
        if (indexDate == null) {
            return true;
        }
        LocalDate controlDate = DateValues.toLocalDate(control.value(controlDateField));
        return controlDate == null || controlDate.isAfter(indexDate);
    }

    public boolean isAtRisk(SubjectRecord caseRecord, SubjectRecord control) {
        return isAtRisk(indexDate(caseRecord), control);
    }
}
