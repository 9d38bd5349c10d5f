/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.runtime.evaluation;

import com.riskset.matching.api.IControlMatchingEngine;
import com.riskset.matching.api.config.MatchingConfig;
import com.riskset.matching.api.model.CohortTable;
import com.riskset.matching.api.model.MatchMethod;
import com.riskset.matching.api.model.MatchedSet;
import com.riskset.matching.api.model.MatchingResult;
import com.riskset.matching.api.model.Shortfall;
import com.riskset.matching.compiler.EligibilityCompiler;
import com.riskset.matching.runtime.assembly.ResultAssembler;
import com.riskset.matching.runtime.context.DateColumnNormalizer;
import com.riskset.matching.runtime.matching.CaseMatchingStrategy;
import com.riskset.matching.runtime.matching.ExactCaseMatcher;
import com.riskset.matching.runtime.matching.IncidenceDensityCaseMatcher;
import com.riskset.matching.runtime.matching.MatchOrchestrator;
import com.riskset.matching.runtime.model.EligibilityModel;
import com.riskset.matching.runtime.pool.ControlPool;
import com.riskset.matching.runtime.sampling.ControlSampler;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Case-control matching engine.
 *
 * <h2>Pipeline</h2>
 * <ol>
 * <li>Convert the configured date columns of both tables.</li>
 * <li>Compile the eligibility rules, checking every referenced column. Nothing is matched
 * if this fails.</li>
 * <li>Index the control pool by match key.</li>
 * <li>Match every case with the method's strategy, serially or on a worker pool.</li>
 * <li>Flatten the matched sets into the result table and report shortfalls.</li>
 * </ol>
 *
 * <h2>Determinism</h2>
 * <p>Every case draws from its own random stream derived from the configured seed and
 * the case's input position. For a given seed, input and configuration the result is the
 * same regardless of the number of workers.
 *
 * <h2>Thread Safety</h2>
 * <p>All per-run state (pool, strategy, metrics) is created inside {@link #match}; the
 * engine itself is immutable and can serve concurrent runs.
 */
public final class ControlMatchingEngine implements IControlMatchingEngine {
    private static final Logger logger = LoggerFactory.getLogger(ControlMatchingEngine.class);

    private final MatchingConfig config;
    private final Tracer tracer;
    private final EligibilityCompiler eligibilityCompiler;
    private final ControlSampler sampler;

    public ControlMatchingEngine(MatchingConfig config, Tracer tracer, EligibilityCompiler eligibilityCompiler) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.eligibilityCompiler = Objects.requireNonNull(eligibilityCompiler, "eligibilityCompiler must not be null");
        this.sampler = new ControlSampler();
        if (config.isParallelismDowngraded()) {
            logger.warn("cores={} requested with method '{}', which matches cases serially; using 1 worker",
                    config.getCores(), config.getMethod().key());
        }
    }

    public ControlMatchingEngine(MatchingConfig config, Tracer tracer) {
        this(config, tracer, new EligibilityCompiler(tracer));
    }

    public ControlMatchingEngine(MatchingConfig config) {
        this(config, OpenTelemetry.noop().getTracer("riskset-evaluator"));
    }

    @Override
    public MatchingResult match(CohortTable cases, CohortTable controls) {
        Objects.requireNonNull(cases, "cases must not be null");
        Objects.requireNonNull(controls, "controls must not be null");

        Span span = tracer.spanBuilder("match-controls").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long start = System.nanoTime();
            span.setAttribute("method", config.getMethod().key());
            span.setAttribute("cases", cases.size());
            span.setAttribute("controls", controls.size());

            DateColumnNormalizer normalizer = new DateColumnNormalizer(config.getAllDateFields(), config.getDateOrigin());
            CohortTable normalizedCases = normalizer.normalize(cases);
            CohortTable normalizedControls = normalizer.normalize(controls);

            EligibilityModel model = eligibilityCompiler.compile(config, normalizedCases, normalizedControls);
            ControlPool pool = buildPool(normalizedControls, model);

            MatchingMetrics metrics = new MatchingMetrics();
            CaseMatchingStrategy strategy = createStrategy(model, pool, metrics);
            MatchOrchestrator orchestrator = new MatchOrchestrator(strategy, config.getEffectiveCores(),
                    config.getActiveTracker(), metrics);

            List<MatchedSet> sets = matchCases(orchestrator, normalizedCases);

            ResultAssembler assembler = new ResultAssembler(config.getMatchVars(), config.getExtraVars());
            MatchingResult result = assembleResult(assembler, sets, orchestrator.effectiveWorkers(),
                    System.nanoTime() - start);

            for (Shortfall shortfall : result.shortfalls()) {
                logger.warn("Case '{}' (position {}) matched {} of {} requested controls",
                        shortfall.caseId(), shortfall.position(), shortfall.matched(), shortfall.requested());
            }
            logger.info("Matched {} cases with {} controls ({} shortfalls) in {} ms",
                    result.stats().cases(), result.stats().controlsAssigned(),
                    result.stats().shortfallCases(), result.stats().durationMillis());
            logger.debug("Matching metrics: {}", metrics.getSnapshot());

            span.setAttribute("controlsAssigned", result.stats().controlsAssigned());
            span.setAttribute("shortfalls", result.stats().shortfallCases());
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public MatchingConfig getConfig() {
        return config;
    }

    private ControlPool buildPool(CohortTable controls, EligibilityModel model) {
        Span span = tracer.spanBuilder("build-control-pool").startSpan();
        try (Scope scope = span.makeCurrent()) {
            ControlPool pool = model.getMethod() == MatchMethod.EXACT
                    ? ControlPool.exclusive(controls, model)
                    : ControlPool.shared(controls, model);
            span.setAttribute("members", pool.size());
            span.setAttribute("blocks", pool.blockCount());
            return pool;
        } finally {
            span.end();
        }
    }

    private CaseMatchingStrategy createStrategy(EligibilityModel model, ControlPool pool, MatchingMetrics metrics) {
        return switch (model.getMethod()) {
            case EXACT -> new ExactCaseMatcher(model, pool, sampler, config.getNControls(), config.getSeed(), metrics);
            case INCIDENCE_DENSITY -> new IncidenceDensityCaseMatcher(model, pool, sampler,
                    config.getNControls(), config.getSeed(), metrics);
        };
    }

    private List<MatchedSet> matchCases(MatchOrchestrator orchestrator, CohortTable cases) {
        Span span = tracer.spanBuilder("match-cases").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("workers", orchestrator.effectiveWorkers());
            return orchestrator.run(cases.rows());
        } finally {
            span.end();
        }
    }

    private MatchingResult assembleResult(ResultAssembler assembler, List<MatchedSet> sets, int workers,
                                          long durationNanos) {
        Span span = tracer.spanBuilder("assemble-results").startSpan();
        try (Scope scope = span.makeCurrent()) {
            MatchingResult result = assembler.assemble(sets, workers, config.isParallelismDowngraded(), durationNanos);
            span.setAttribute("rows", result.rows().size());
            return result;
        } finally {
            span.end();
        }
    }
}
