/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition;

import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.compiler.condition.ast.ExpressionNode;
import com.riskset.matching.compiler.condition.ast.Values;
import com.riskset.matching.runtime.model.ConditionExpression;
import com.riskset.matching.runtime.model.FieldReference;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A parsed condition tree. A condition that evaluates to missing does not admit the control.
 */
public final class CompiledCondition implements ConditionExpression {

    private final String source;
    private final ExpressionNode root;
    private final Set<FieldReference> references;

    public CompiledCondition(String source, ExpressionNode root) {
        this.source = source;
        this.root = root;
        Set<FieldReference> refs = new LinkedHashSet<>();
        root.collectReferences(refs);
        this.references = Collections.unmodifiableSet(refs);
    }

    @Override
    public boolean test(SubjectRecord caseRecord, SubjectRecord control) {
        return Boolean.TRUE.equals(Values.toLogical(root.evaluate(caseRecord, control)));
    }

    @Override
    public Set<FieldReference> references() {
        return references;
    }

    @Override
    public String source() {
        return source;
    }

    public ExpressionNode root() {
        return root;
    }

    @Override
    public String toString() {
        return "CompiledCondition{" + source + "}";
    }
}
