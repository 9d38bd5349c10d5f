/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.matching;

import com.riskset.matching.api.model.MatchedSet;
import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.evaluation.MatchingMetrics;
import com.riskset.matching.runtime.model.EligibilityModel;
import com.riskset.matching.runtime.model.EligibilityPredicate;
import com.riskset.matching.runtime.pool.ControlPool;
import com.riskset.matching.runtime.sampling.CaseSeeds;
import com.riskset.matching.runtime.sampling.ControlSampler;
import com.riskset.matching.runtime.sampling.SampleOutcome;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shared draw logic: build the case's predicate, scan the pool, sample, and record metrics.
 */
abstract class AbstractCaseMatcher implements CaseMatchingStrategy {

    protected final EligibilityModel model;
    protected final ControlPool pool;
    private final ControlSampler sampler;
    private final int nControls;
    private final long seed;
    private final MatchingMetrics metrics;

    AbstractCaseMatcher(EligibilityModel model, ControlPool pool, ControlSampler sampler,
                        int nControls, long seed, MatchingMetrics metrics) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        if (nControls <= 0) {
            throw new IllegalArgumentException("nControls must be positive, got: " + nControls);
        }
        this.nControls = nControls;
        this.seed = seed;
    }

    @Override
    public MatchedSet matchCase(int position, SubjectRecord caseRecord) {
        long start = System.nanoTime();
        EligibilityPredicate predicate = model.forCase(caseRecord);
        IntList eligible = pool.eligibleIndices(predicate);
        SampleOutcome outcome = sampler.sample(eligible, nControls, CaseSeeds.randomFor(seed, position));
        afterDraw(outcome);

        List<SubjectRecord> controls = new ArrayList<>(outcome.selected().size());
        IntList selected = outcome.selected();
        for (int i = 0; i < selected.size(); i++) {
            controls.add(pool.member(selected.getInt(i)));
        }
        metrics.recordCase(System.nanoTime() - start, outcome.eligibleCount(), controls.size(),
                outcome.isShortfall());
        return new MatchedSet(position + 1, position, caseRecord, controls, nControls);
    }

    /**
     * Hook run after each draw, before the set is built.
     */
    protected abstract void afterDraw(SampleOutcome outcome);
}
