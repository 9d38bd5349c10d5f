/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.sampling;

import java.util.SplittableRandom;

/**
 * Derives an independent random stream for each case from the run seed and the case's
 * input position, so draws do not depend on which worker handles a case or when.
 */
public final class CaseSeeds {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private CaseSeeds() {
    }

    public static long seedFor(long runSeed, int position) {
        return mix64(runSeed ^ mix64(GOLDEN_GAMMA * (position + 1L)));
    }

    public static SplittableRandom randomFor(long runSeed, int position) {
        return new SplittableRandom(seedFor(runSeed, position));
    }

    // Stafford variant 13 finalizer
    static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
