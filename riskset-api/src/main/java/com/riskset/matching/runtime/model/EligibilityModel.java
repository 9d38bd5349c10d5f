/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.model;

import com.riskset.matching.api.model.MatchMethod;
import com.riskset.matching.api.model.SubjectRecord;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The validated, compiled eligibility rules of a run.
 *
 * <p>Produced once per run by the eligibility compiler after the configuration has been
 * checked against both input tables. Immutable and thread-safe; per-case predicates are
 * derived from it with {@link #forCase(SubjectRecord)}.
 */
public final class EligibilityModel {

    private final MatchMethod method;
    private final List<String> matchVars;
    private final List<String> extraVars;
    private final ConditionExpression extraCondition;
    private final AtRiskRule atRiskRule;

    public EligibilityModel(MatchMethod method,
                            List<String> matchVars,
                            List<String> extraVars,
                            ConditionExpression extraCondition,
                            AtRiskRule atRiskRule) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.matchVars = List.copyOf(matchVars);
        this.extraVars = List.copyOf(extraVars);
        this.extraCondition = extraCondition;
        this.atRiskRule = atRiskRule;
        if (atRiskRule != null && method != MatchMethod.INCIDENCE_DENSITY) {
            throw new IllegalArgumentException("At-risk rule only applies to incidence density sampling");
        }
    }

    /**
     * Builds the eligibility test of one case.
     */
    public EligibilityPredicate forCase(SubjectRecord caseRecord) {
        return new EligibilityPredicate(this, caseRecord);
    }

    public MatchKey keyOf(SubjectRecord record) {
        return MatchKey.of(record, matchVars);
    }

    public MatchMethod getMethod() { return method; }
    public List<String> getMatchVars() { return matchVars; }
    public List<String> getExtraVars() { return extraVars; }
    public Optional<ConditionExpression> getExtraCondition() { return Optional.ofNullable(extraCondition); }
    public Optional<AtRiskRule> getAtRiskRule() { return Optional.ofNullable(atRiskRule); }
}
