/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition.ast;

import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.FieldReference;

import java.util.Set;

/**
 * Short-circuit conjunction or disjunction under three-valued logic.
 */
public record LogicalNode(Connective connective, ExpressionNode left, ExpressionNode right) implements ExpressionNode {

    public enum Connective {
        AND, OR
    }

    @Override
    public Object evaluate(SubjectRecord caseRecord, SubjectRecord control) {
        Boolean l = Values.toLogical(left.evaluate(caseRecord, control));
        if (connective == Connective.AND) {
            if (Boolean.FALSE.equals(l)) {
                return Boolean.FALSE;
            }
            Boolean r = Values.toLogical(right.evaluate(caseRecord, control));
            if (Boolean.FALSE.equals(r)) {
                return Boolean.FALSE;
            }
            return l == null || r == null ? null : Boolean.TRUE;
        }
        if (Boolean.TRUE.equals(l)) {
            return Boolean.TRUE;
        }
        Boolean r = Values.toLogical(right.evaluate(caseRecord, control));
        if (Boolean.TRUE.equals(r)) {
            return Boolean.TRUE;
        }
        return l == null || r == null ? null : Boolean.FALSE;
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
