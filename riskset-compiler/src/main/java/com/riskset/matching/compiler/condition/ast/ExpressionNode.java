/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition.ast;

import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.FieldReference;

import java.util.Set;

/**
 * Node of a compiled condition tree. Nodes are immutable.
 */
public interface ExpressionNode {

    /**
     * Static result category, checked when the tree is built.
     */
    enum ResultType {
        /** Always yields a Boolean */
        BOOLEAN,
        /** Yields a number, string or date */
        VALUE,
        /** Type known only at evaluation time (column reads) */
        ANY
    }

    /**
     * Evaluates the node. Returns null for a missing value.
     */
    Object evaluate(SubjectRecord caseRecord, SubjectRecord control);

    ResultType resultType();

    void collectReferences(Set<FieldReference> references);
}
