/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api;

/**
 * Observer notified after each case has been matched.
 *
 * <p>Invoked exactly once per case. When cases are matched by several workers the
 * invocation order does not follow input order and calls may overlap, so
 * implementations that write to a shared sink must synchronize themselves.
 * Trackers never influence matching results; an exception thrown by a tracker is
 * logged and ignored.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * MatchingConfig config = MatchingConfig.builder()
 *     .nControls(4)
 *     .matchVars(List.of("sex", "practice"))
 *     .track(true)
 *     .tracker((position, caseId) -> System.out.printf("matched case %d (%s)%n", position, caseId))
 *     .build();
 * }</pre>
 */
@FunctionalInterface
public interface MatchProgressTracker {

    /**
     * Tracker that does nothing.
     */
    MatchProgressTracker NONE = (position, caseId) -> { };

    /**
     * Called after a case's matched set has been drawn.
     *
     * @param position zero-based position of the case in the input
     * @param caseId   identifier of the case
     */
    void onCaseProcessed(int position, String caseId);
}
