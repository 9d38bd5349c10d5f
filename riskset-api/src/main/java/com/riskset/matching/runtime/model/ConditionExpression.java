/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.model;

import com.riskset.matching.api.model.SubjectRecord;

import java.util.Set;

/**
 * A compiled extra eligibility condition evaluated against a (case, control) pair.
 *
 * <p>Implementations are immutable and thread-safe.
 */
public interface ConditionExpression {

    /**
     * Evaluates the condition.
     *
     * @param caseRecord the case being matched
     * @param control    the candidate control
     * @return true when the control is eligible for the case
     */
    boolean test(SubjectRecord caseRecord, SubjectRecord control);

    /**
     * Columns read by the condition, used to validate it against the input tables.
     */
    Set<FieldReference> references();

    /**
     * The condition text it was compiled from.
     */
    String source();
}
