/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api;

import com.riskset.matching.api.config.MatchingConfig;
import com.riskset.matching.api.exceptions.ConfigurationException;
import com.riskset.matching.api.exceptions.MatchingTaskException;
import com.riskset.matching.api.model.CohortTable;
import com.riskset.matching.api.model.MatchingResult;

/**
 * Assigns matched controls to cases.
 *
 * <p>The engine is configured once at construction and holds no state between runs,
 * so one instance can serve several runs, including concurrent ones.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MatchingConfig config = MatchingConfig.builder()
 *     .nControls(2)
 *     .matchVars(List.of("sex", "site"))
 *     .method(MatchMethod.INCIDENCE_DENSITY)
 *     .indexDateField("idx_date")
 *     .cores(4)
 *     .build();
 *
 * IControlMatchingEngine engine = new ControlMatchingEngine(config);
 * MatchingResult result = engine.match(cases, controlPool);
 *
 * for (Shortfall s : result.shortfalls()) {
 *     System.out.printf("case %s is missing %d controls%n", s.caseId(), s.missing());
 * }
 * }</pre>
 */
public interface IControlMatchingEngine {

    /**
     * Runs one matching pass.
     *
     * @param cases    the cases, processed in table order
     * @param controls the candidate control pool; never modified
     * @return the matched-set table, ordered by case input order
     * @throws ConfigurationException if a configured column is missing or the condition is invalid;
     *                                raised before any case is matched
     * @throws MatchingTaskException  if matching a case fails; no partial result is returned
     */
    MatchingResult match(CohortTable cases, CohortTable controls);

    /**
     * Returns the configuration the engine was built with.
     */
    MatchingConfig getConfig();
}
