/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.evaluation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters of a matching run.
 *
 * <p>Lock-free ({@link LongAdder}) so parallel case workers can record without contention.
 */
public final class MatchingMetrics {

    private final LongAdder casesMatched = new LongAdder();
    private final LongAdder candidatesEligible = new LongAdder();
    private final LongAdder controlsAssigned = new LongAdder();
    private final LongAdder shortfallCases = new LongAdder();
    private final LongAdder totalCaseTimeNanos = new LongAdder();
    private final LongAdder trackerFailures = new LongAdder();

    /**
     * Records one processed case.
     */
    public void recordCase(long caseTimeNanos, int eligible, int assigned, boolean shortfall) {
        casesMatched.increment();
        candidatesEligible.add(eligible);
        controlsAssigned.add(assigned);
        totalCaseTimeNanos.add(caseTimeNanos);
        if (shortfall) {
            shortfallCases.increment();
        }
    }

    public void recordTrackerFailure() {
        trackerFailures.increment();
    }

    public long getCasesMatched() {
        return casesMatched.sum();
    }

    public long getControlsAssigned() {
        return controlsAssigned.sum();
    }

    public long getShortfallCases() {
        return shortfallCases.sum();
    }

    public long getTrackerFailures() {
        return trackerFailures.sum();
    }

    /**
     * Returns a point-in-time copy of all counters.
     */
    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        long cases = casesMatched.sum();
        long eligible = candidatesEligible.sum();
        long totalTime = totalCaseTimeNanos.sum();

        snapshot.put("casesMatched", cases);
        snapshot.put("controlsAssigned", controlsAssigned.sum());
        snapshot.put("shortfallCases", shortfallCases.sum());
        snapshot.put("avgEligiblePerCase", cases > 0 ? (double) eligible / cases : 0.0);
        snapshot.put("avgCaseTimeNanos", cases > 0 ? totalTime / cases : 0);
        snapshot.put("trackerFailures", trackerFailures.sum());
        return snapshot;
    }
}
