/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition.ast;

import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.FieldReference;

import java.util.Set;

/**
 * Binary arithmetic. Missing operands propagate as missing.
 */
public record ArithmeticNode(Operator operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {

    public enum Operator {
        ADD, SUBTRACT, MULTIPLY, DIVIDE
    }

    @Override
    public Object evaluate(SubjectRecord caseRecord, SubjectRecord control) {
        Object l = left.evaluate(caseRecord, control);
        Object r = right.evaluate(caseRecord, control);
        if (l == null || r == null) {
            return null;
        }
        return switch (operator) {
            case ADD -> Values.add(l, r);
            case SUBTRACT -> Values.subtract(l, r);
            case MULTIPLY -> Values.multiply(l, r);
            case DIVIDE -> Values.divide(l, r);
        };
    }

    @Override
    public ResultType resultType() {
        return ResultType.VALUE;
    }

    @Override
    public void collectReferences(Set<FieldReference> references) {
        left.collectReferences(references);
        right.collectReferences(references);
    }
}
