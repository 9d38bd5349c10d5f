/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition;

import com.riskset.matching.api.IConditionCompiler;
import com.riskset.matching.api.exceptions.ConditionSyntaxException;
import com.riskset.matching.api.exceptions.ConfigurationException;
import com.riskset.matching.compiler.condition.ast.ExpressionNode;
import com.riskset.matching.runtime.model.ConditionExpression;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Compiles extra eligibility conditions into an expression tree.
 *
 * <p>The language is deliberately small: field reads on the case and the control,
 * literals, comparisons, boolean connectives, arithmetic, membership tests and a handful
 * of functions. It has no side effects and no access to anything but the two records.
 *
 * <h2>Examples</h2>
 * <pre>
 * yob &gt;= case.yob - 2 &amp;&amp; yob &lt;= case.yob + 2
 * yob &gt;= (.(yob) - 2) &amp; yob &lt;= (.(yob) + 2)
 * region in ('north', 'east') and not is_na(startdate)
 * startdate &lt;= case.eventdate - 365
 * </pre>
 */
public class ConditionCompiler implements IConditionCompiler {
    private static final Logger logger = Logger.getLogger(ConditionCompiler.class.getName());

    private Tracer tracer;

    public ConditionCompiler(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    public ConditionCompiler() {
        this(OpenTelemetry.noop().getTracer("riskset-compiler"));
    }

    @Override
    public ConditionExpression compile(String source) {
        if (source == null || source.isBlank()) {
            throw new ConfigurationException("extra condition must not be blank");
        }
        Span span = tracer.spanBuilder("compile-condition").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("condition", source);
            ExpressionNode root = new ConditionParser(source).parse();
            CompiledCondition compiled = new CompiledCondition(source, root);
            span.setAttribute("referencedFields", compiled.references().size());
            logger.fine(() -> "Compiled extra condition '" + source + "' reading " + compiled.references());
            return compiled;
        } catch (ConditionSyntaxException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }
}
