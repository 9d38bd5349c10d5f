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
 * Incidence density sampling: the pool never changes, so a control may serve several
 * cases (and a later case may itself be a control of an earlier one). Cases are
 * independent and may be matched concurrently.
 */
public final class IncidenceDensityCaseMatcher extends AbstractCaseMatcher {

    public IncidenceDensityCaseMatcher(EligibilityModel model, ControlPool pool, ControlSampler sampler,
                                       int nControls, long seed, MatchingMetrics metrics) {
        super(model, pool, sampler, nControls, seed, metrics);
    }

    @Override
    protected void afterDraw(SampleOutcome outcome) {
        // pool is shared; nothing to release
    }

    @Override
    public boolean supportsConcurrentCases() {
        return true;
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.INCIDENCE_DENSITY;
    }
}
