/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.sampling;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.SplittableRandom;

/**
 * Draws controls uniformly at random without replacement.
 *
 * <p>Uses a partial Fisher-Yates shuffle over a copy of the eligible indices. When no more
 * than the requested number are eligible, all of them are taken without consuming
 * randomness. Stateless and thread-safe; the random stream is owned by the caller.
 */
public final class ControlSampler {

    /**
     * @param eligible  eligible member indices, in ascending order
     * @param requested number of controls to draw, positive
     * @param random    the case's random stream
     */
    public SampleOutcome sample(IntList eligible, int requested, SplittableRandom random) {
        if (requested <= 0) {
            throw new IllegalArgumentException("requested must be positive, got: " + requested);
        }
        int available = eligible.size();
        if (available <= requested) {
            return new SampleOutcome(eligible, requested, available);
        }
        int[] candidates = eligible.toIntArray();
        for (int i = 0; i < requested; i++) {
            int j = i + random.nextInt(available - i);
            int swap = candidates[i];
            candidates[i] = candidates[j];
            candidates[j] = swap;
        }
        return new SampleOutcome(IntArrayList.wrap(candidates, requested), requested, available);
    }
}
