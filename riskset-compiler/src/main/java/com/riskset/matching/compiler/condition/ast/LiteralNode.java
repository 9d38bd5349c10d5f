/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition.ast;

import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.FieldReference;

import java.util.Set;

/**
 * A constant: number, string, boolean or date.
 */
public record LiteralNode(Object value) implements ExpressionNode {

    @Override
    public Object evaluate(SubjectRecord caseRecord, SubjectRecord control) {
        return value;
    }

    @Override
    public ResultType resultType() {
        return value instanceof Boolean ? ResultType.BOOLEAN : ResultType.VALUE;
    }

    @Override
    public void collectReferences(Set<FieldReference> references) {
    }
}
