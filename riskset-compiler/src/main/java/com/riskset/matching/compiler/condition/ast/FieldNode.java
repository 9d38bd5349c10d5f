/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition.ast;

import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.FieldReference;

import java.util.Set;

/**
 * Reads a column of the case or of the candidate control.
 */
public record FieldNode(FieldReference reference) implements ExpressionNode {

    @Override
    public Object evaluate(SubjectRecord caseRecord, SubjectRecord control) {
        SubjectRecord source = reference.side() == FieldReference.Side.CASE ? caseRecord : control;
        Object value = source.value(reference.column());
        if (value instanceof Double d && d.isNaN()) {
            return null;
        }
        return value;
    }

    @Override
    public ResultType resultType() {
        return ResultType.ANY;
    }

    @Override
    public void collectReferences(Set<FieldReference> references) {
        references.add(reference);
    }
}
