/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition;

/**
 * Lexical categories of the extra-condition language.
 */
public enum TokenType {
    NUMBER, STRING, IDENTIFIER,
    TRUE, FALSE,
    AND, OR, NOT, IN,
    EQ, NE, LT, LE, GT, GE,
    PLUS, MINUS, STAR, SLASH,
    LPAREN, RPAREN, COMMA, DOT,
    /** The case-value shorthand opener {@code .(} */
    CASE_REF,
    EOF
}
