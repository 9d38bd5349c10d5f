/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler;

import com.riskset.matching.api.IConditionCompiler;
import com.riskset.matching.api.config.MatchingConfig;
import com.riskset.matching.api.exceptions.ConfigurationException;
import com.riskset.matching.api.model.CohortTable;
import com.riskset.matching.api.model.MatchMethod;
import com.riskset.matching.compiler.condition.ConditionCompiler;
import com.riskset.matching.runtime.model.AtRiskRule;
import com.riskset.matching.runtime.model.ConditionExpression;
import com.riskset.matching.runtime.model.EligibilityModel;
import com.riskset.matching.runtime.model.FieldReference;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Validates a matching configuration against the input tables and compiles it into an
 * {@link EligibilityModel}.
 *
 * <p>All configuration errors surface here, before any case is matched:
 * <ol>
 *   <li>match and extra variables must exist in both tables,</li>
 *   <li>the extra condition must parse, and every column it reads must exist on its side,</li>
 *   <li>under incidence density, the index date column must exist in the cases table and
 *       the control date column in the pool.</li>
 * </ol>
 * A table without rows is still checked against the columns it declares; only a table
 * that declares nothing beyond its identifier, such as an empty JSON array, is skipped.
 */
public class EligibilityCompiler {
    private static final Logger logger = Logger.getLogger(EligibilityCompiler.class.getName());

    private final IConditionCompiler conditionCompiler;
    private final Tracer tracer;

    public EligibilityCompiler(IConditionCompiler conditionCompiler, Tracer tracer) {
        this.conditionCompiler = Objects.requireNonNull(conditionCompiler, "conditionCompiler must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.conditionCompiler.setTracer(tracer);
    }

    public EligibilityCompiler(Tracer tracer) {
        this(new ConditionCompiler(tracer), tracer);
    }

    public EligibilityCompiler() {
        this(OpenTelemetry.noop().getTracer("riskset-compiler"));
    }

    /**
     * Compiles the eligibility rules of one run.
     *
     * @throws ConfigurationException if the configuration does not fit the tables
     */
    public EligibilityModel compile(MatchingConfig config, CohortTable cases, CohortTable controls) {
        Span span = tracer.spanBuilder("compile-eligibility").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("method", config.getMethod().key());
            span.setAttribute("matchVars", config.getMatchVars().size());

            for (String var : config.getMatchVars()) {
                requireColumn(cases, var, "match variable");
                requireColumn(controls, var, "match variable");
            }
            for (String var : config.getExtraVars()) {
                requireColumn(cases, var, "extra variable");
                requireColumn(controls, var, "extra variable");
            }

            ConditionExpression condition = null;
            if (config.getExtraConditions() != null) {
                condition = conditionCompiler.compile(config.getExtraConditions());
                for (FieldReference ref : condition.references()) {
                    CohortTable table = ref.side() == FieldReference.Side.CASE ? cases : controls;
                    requireColumn(table, ref.column(), "extra condition");
                }
            }

            AtRiskRule atRiskRule = null;
            if (config.usesAtRiskConstraint()) {
                requireColumn(cases, config.getIndexDateField(), "index date");
                requireColumn(controls, config.getEffectiveControlDateField(), "control date");
                atRiskRule = new AtRiskRule(config.getIndexDateField(), config.getEffectiveControlDateField());
            } else if (config.getMethod() == MatchMethod.EXACT && config.getIndexDateField() != null) {
                logger.info("index_date_field '" + config.getIndexDateField()
                        + "' is ignored for exact matching");
            }

            span.setAttribute("hasExtraCondition", condition != null);
            span.setAttribute("atRisk", atRiskRule != null);

            return new EligibilityModel(config.getMethod(), config.getMatchVars(), config.getExtraVars(),
                    condition, atRiskRule);
        } catch (ConfigurationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static void requireColumn(CohortTable table, String column, String usage) {
        if (table.isEmpty() && !table.hasSchema()) {
            return;
        }
        if (!table.hasColumn(column)) {
            throw ConfigurationException.missingColumn(table.name(), column, usage);
        }
    }
}
