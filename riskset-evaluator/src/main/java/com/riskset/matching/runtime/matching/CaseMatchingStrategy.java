/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.matching;

import com.riskset.matching.api.model.MatchMethod;
import com.riskset.matching.api.model.MatchedSet;
import com.riskset.matching.api.model.SubjectRecord;

/**
 * Assigns controls to a single case.
 *
 * <p>The two sampling methods differ in what happens to the pool after a draw and in
 * whether cases may be processed concurrently. The orchestrator only relies on this
 * interface.
 */
public interface CaseMatchingStrategy {

    /**
     * Draws the controls of one case.
     *
     * @param position   zero-based position of the case in the input
     * @param caseRecord the case
     * @return the matched set, possibly with fewer controls than requested
     */
    MatchedSet matchCase(int position, SubjectRecord caseRecord);

    /**
     * True when {@link #matchCase} may be called from several threads at once.
     */
    boolean supportsConcurrentCases();

    MatchMethod method();
}
