/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition.ast;

import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.FieldReference;

import java.util.Set;

/**
 * Binary comparison. A comparison with a missing operand is missing.
 */
public record ComparisonNode(Operator operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {

    public enum Operator {
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    @Override
    public Object evaluate(SubjectRecord caseRecord, SubjectRecord control) {
        Object leftValue = left.evaluate(caseRecord, control);
        if (leftValue == null) {
            return null;
        }
        Object rightValue = right.evaluate(caseRecord, control);
        if (rightValue == null) {
            return null;
        }
        Object l = Values.coerceAgainst(leftValue, rightValue);
        Object r = Values.coerceAgainst(rightValue, leftValue);
        if (l == null || r == null) {
            return null;
        }
        return switch (operator) {
            case EQ -> Values.equal(l, r);
            case NE -> !Values.equal(l, r);
            case LT -> Values.compare(l, r) < 0;
            case LE -> Values.compare(l, r) <= 0;
            case GT -> Values.compare(l, r) > 0;
            case GE -> Values.compare(l, r) >= 0;
        };
    }

    @Override
    public ResultType resultType() {
        return ResultType.BOOLEAN;
    }

    @Override
    public void collectReferences(Set<FieldReference> references) {
        left.collectReferences(references);
        right.collectReferences(references);
    }
}
