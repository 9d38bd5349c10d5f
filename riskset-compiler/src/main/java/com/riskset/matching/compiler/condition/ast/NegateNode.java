/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition.ast;

import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.FieldReference;

import java.util.Set;

/**
 * Unary minus.
 */
public record NegateNode(ExpressionNode operand) implements ExpressionNode {

    @Override
    public Object evaluate(SubjectRecord caseRecord, SubjectRecord control) {
        Object value = operand.evaluate(caseRecord, control);
        return value == null ? null : Values.negate(value);
    }

    @Override
    public ResultType resultType() {
        return ResultType.VALUE;
    }

    @Override
    public void collectReferences(Set<FieldReference> references) {
        operand.collectReferences(references);
    }
}
