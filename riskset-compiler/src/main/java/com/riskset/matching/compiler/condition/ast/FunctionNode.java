/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition.ast;

import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.DateValues;
import com.riskset.matching.runtime.model.FieldReference;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Call of a built-in function.
 */
public record FunctionNode(Function function, List<ExpressionNode> arguments) implements ExpressionNode {

    public enum Function {
        IS_NA(1, ResultType.BOOLEAN),
        NOT_NA(1, ResultType.BOOLEAN),
        ABS(1, ResultType.VALUE),
        DATE(1, ResultType.VALUE),
        YEAR(1, ResultType.VALUE);

        private final int arity;
        private final ResultType resultType;

        Function(int arity, ResultType resultType) {
            this.arity = arity;
            this.resultType = resultType;
        }

        public int arity() {
            return arity;
        }

        /**
         * Looks up a function by name. Accepts R spellings such as {@code is.na}.
         */
        public static Optional<Function> lookup(String name) {
            String normalized = name.toUpperCase(Locale.ROOT).replace('.', '_');
            for (Function f : values()) {
                if (f.name().equals(normalized)) {
                    return Optional.of(f);
                }
            }
            return Optional.empty();
        }
    }

    public FunctionNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public Object evaluate(SubjectRecord caseRecord, SubjectRecord control) {
        Object arg = arguments.get(0).evaluate(caseRecord, control);
        return switch (function) {
            case IS_NA -> arg == null;
            case NOT_NA -> arg != null;
            case ABS -> arg == null ? null : abs(arg);
            case DATE -> DateValues.toLocalDate(arg);
            case YEAR -> {
                var date = DateValues.toLocalDate(arg);
                yield date == null ? null : (Object) (long) date.getYear();
            }
        };
    }

    private static Object abs(Object value) {
        if (!(value instanceof Number n)) {
            throw new IllegalArgumentException("abs() expects a number but got " + Values.describe(value));
        }
        return Values.isIntegral(n) ? (Object) Math.abs(n.longValue()) : (Object) Math.abs(n.doubleValue());
    }

    @Override
    public ResultType resultType() {
        return function.resultType;
    }

    @Override
    public void collectReferences(Set<FieldReference> references) {
        for (ExpressionNode argument : arguments) {
            argument.collectReferences(references);
        }
    }
}
