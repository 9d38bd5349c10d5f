/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.sampling;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Result of drawing controls for one case.
 *
 * @param selected      chosen member indices, in draw order
 * @param requested     number of controls asked for
 * @param eligibleCount size of the eligible set the draw was made from
 */
public record SampleOutcome(IntList selected, int requested, int eligibleCount) {

    public SampleOutcome {
        selected = IntList.of(selected.toIntArray());
    }

    public boolean isShortfall() {
        return selected.size() < requested;
    }
}
