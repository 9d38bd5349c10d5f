/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.infra;

import com.riskset.matching.api.MatchProgressTracker;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Logs matching progress every {@code interval} cases and when the last case completes.
 * Safe to share between workers.
 */
public final class LoggingProgressTracker implements MatchProgressTracker {
    private static final Logger logger = Logger.getLogger(LoggingProgressTracker.class.getName());

    private final int totalCases;
    private final int interval;
    private final AtomicInteger processed = new AtomicInteger();

    public LoggingProgressTracker(int totalCases, int interval) {
        if (interval <= 0) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
        this.totalCases = totalCases;
        this.interval = interval;
    }

    /**
     * Logs roughly every 5% of the cases.
     */
    public static LoggingProgressTracker forCases(int totalCases) {
        return new LoggingProgressTracker(totalCases, Math.max(1, totalCases / 20));
    }

    @Override
    public void onCaseProcessed(int position, String caseId) {
        int done = processed.incrementAndGet();
        if (done % interval == 0 || done == totalCases) {
            logger.info(String.format("Matched %d/%d cases (%.0f%%)", done, totalCases,
                    totalCases > 0 ? 100.0 * done / totalCases : 100.0));
        }
    }

    public int getProcessed() {
        return processed.get();
    }
}
