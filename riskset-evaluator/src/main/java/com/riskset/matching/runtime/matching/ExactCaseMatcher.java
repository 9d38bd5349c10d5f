/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.matching;

import com.riskset.matching.api.model.MatchMethod;
import com.riskset.matching.runtime.evaluation.MatchingMetrics;
import com.riskset.matching.runtime.model.EligibilityModel;
import com.riskset.matching.runtime.pool.ControlPool;
import com.riskset.matching.runtime.sampling.ControlSampler;
import com.riskset.matching.runtime.sampling.SampleOutcome;

/**
 * Exact matching: every assigned control leaves the pool, so a control serves at most one
 * case. Cases must be processed one at a time in input order.
 */
public final class ExactCaseMatcher extends AbstractCaseMatcher {

    public ExactCaseMatcher(EligibilityModel model, ControlPool pool, ControlSampler sampler,
                            int nControls, long seed, MatchingMetrics metrics) {
        super(model, pool, sampler, nControls, seed, metrics);
        if (!pool.isExclusive()) {
            throw new IllegalArgumentException("Exact matching requires an exclusive control pool");
        }
    }

    @Override
    protected void afterDraw(SampleOutcome outcome) {
        pool.removeIndices(outcome.selected());
    }

    @Override
    public boolean supportsConcurrentCases() {
        return false;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.EXACT;
    }
}
