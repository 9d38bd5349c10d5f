/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.api;

import com.riskset.matching.api.exceptions.ConditionSyntaxException;
import com.riskset.matching.runtime.model.ConditionExpression;
import io.opentelemetry.api.trace.Tracer;

/**
 * Contract for compiling extra eligibility conditions into evaluable expressions.
 */
public interface IConditionCompiler {

    /**
     * Compiles a condition such as {@code yob >= case.yob - 2 && yob <= case.yob + 2}.
     *
     * @param source condition text
     * @return compiled expression, safe to evaluate from several threads
     * @throws ConditionSyntaxException if the text is not a valid condition
     */
    ConditionExpression compile(String source);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }
}
