/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition.ast;

import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.FieldReference;

import java.util.List;
import java.util.Set;

/**
 * Membership test {@code x in (a, b, c)}. Missing when the operand is missing,
 * including a missing-value marker tested against dates.
 */
public record InListNode(ExpressionNode operand, List<ExpressionNode> items, boolean negated) implements ExpressionNode {

    public InListNode {
        items = List.copyOf(items);
    }

    @Override
    public Object evaluate(SubjectRecord caseRecord, SubjectRecord control) {
        Object value = operand.evaluate(caseRecord, control);
        if (value == null) {
            return null;
        }
        boolean found = false;
        for (ExpressionNode item : items) {
            Object candidate = item.evaluate(caseRecord, control);
            if (candidate == null) {
                continue;
            }
            Object v = Values.coerceAgainst(value, candidate);
            if (v == null) {
                return null;
            }
            Object c = Values.coerceAgainst(candidate, value);
            if (c != null && Values.equal(v, c)) {
                found = true;
                break;
            }
        }
        return negated != found;
    }

    @Override
    public ResultType resultType() {
        return ResultType.BOOLEAN;
    }

    @Override
    public void collectReferences(Set<FieldReference> references) {
        operand.collectReferences(references);
        for (ExpressionNode item : items) {
            item.collectReferences(references);
        }
    }
}
