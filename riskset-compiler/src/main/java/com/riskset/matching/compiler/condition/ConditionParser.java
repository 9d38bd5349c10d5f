/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition;

import com.riskset.matching.api.exceptions.ConditionSyntaxException;
import com.riskset.matching.compiler.condition.ast.ArithmeticNode;
import com.riskset.matching.compiler.condition.ast.ComparisonNode;
import com.riskset.matching.compiler.condition.ast.ExpressionNode;
import com.riskset.matching.compiler.condition.ast.ExpressionNode.ResultType;
import com.riskset.matching.compiler.condition.ast.FieldNode;
import com.riskset.matching.compiler.condition.ast.FunctionNode;
import com.riskset.matching.compiler.condition.ast.InListNode;
import com.riskset.matching.compiler.condition.ast.LiteralNode;
import com.riskset.matching.compiler.condition.ast.LogicalNode;
import com.riskset.matching.compiler.condition.ast.NegateNode;
import com.riskset.matching.compiler.condition.ast.NotNode;
import com.riskset.matching.runtime.model.DateValues;
import com.riskset.matching.runtime.model.FieldReference;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for extra eligibility conditions.
 *
 * <h2>Grammar</h2>
 * <pre>
 * condition      := or EOF
 * or             := and (OR and)*
 * and            := not (AND not)*
 * not            := NOT not | comparison
 * comparison     := additive ((EQ|NE|LT|LE|GT|GE) additive | NOT? IN '(' additive (',' additive)* ')')?
 * additive       := multiplicative ((PLUS|MINUS) multiplicative)*
 * multiplicative := unary ((STAR|SLASH) unary)*
 * unary          := MINUS unary | primary
 * primary        := NUMBER | STRING | TRUE | FALSE | '(' or ')'
 *                 | CASE_REF IDENTIFIER ')'
 *                 | IDENTIFIER '(' arguments ')'
 *                 | ('case' | 'control') DOT IDENTIFIER
 *                 | IDENTIFIER
 * </pre>
 *
 * <p>A bare identifier reads the candidate control's column; {@code case.x} and the
 * template shorthand {@code .(x)} read the case's column.
 */
public final class ConditionParser {

    private final String source;
    private final List<Token> tokens;
    private int index;

    public ConditionParser(String source) {
        this.source = source;
        this.tokens = new ConditionLexer(source).tokenize();
    }

    /**
     * Parses the whole source into a boolean-valued tree.
     */
    public ExpressionNode parse() {
        ExpressionNode root = parseOr();
        Token trailing = peek();
        if (!trailing.is(TokenType.EOF)) {
            throw error("unexpected '" + trailing.text() + "'", trailing);
        }
        requireLogical(root, tokens.get(0));
        return root;
    }

    private ExpressionNode parseOr() {
        ExpressionNode left = parseAnd();
        while (peek().is(TokenType.OR)) {
            Token op = advance();
            requireLogical(left, op);
            ExpressionNode right = parseAnd();
            requireLogical(right, op);
            left = new LogicalNode(LogicalNode.Connective.OR, left, right);
        }
        return left;
    }

    private ExpressionNode parseAnd() {
        ExpressionNode left = parseNot();
        while (peek().is(TokenType.AND)) {
            Token op = advance();
            requireLogical(left, op);
            ExpressionNode right = parseNot();
            requireLogical(right, op);
            left = new LogicalNode(LogicalNode.Connective.AND, left, right);
        }
        return left;
    }

    private ExpressionNode parseNot() {
        if (peek().is(TokenType.NOT) && !peekAt(1).is(TokenType.IN)) {
            Token op = advance();
            ExpressionNode operand = parseNot();
            requireLogical(operand, op);
            return new NotNode(operand);
        }
        return parseComparison();
    }

    private ExpressionNode parseComparison() {
        ExpressionNode left = parseAdditive();
        Token op = peek();
        ComparisonNode.Operator operator = switch (op.type()) {
            case EQ -> ComparisonNode.Operator.EQ;
            case NE -> ComparisonNode.Operator.NE;
            case LT -> ComparisonNode.Operator.LT;
            case LE -> ComparisonNode.Operator.LE;
            case GT -> ComparisonNode.Operator.GT;
            case GE -> ComparisonNode.Operator.GE;
            default -> null;
        };
        if (operator != null) {
            advance();
            ExpressionNode right = parseAdditive();
            return new ComparisonNode(operator, left, right);
        }

        boolean negated = false;
        if (op.is(TokenType.NOT) && peekAt(1).is(TokenType.IN)) {
            advance();
            negated = true;
        }
        if (peek().is(TokenType.IN)) {
            advance();
            expect(TokenType.LPAREN, "'(' after in");
            List<ExpressionNode> items = new ArrayList<>();
            items.add(parseAdditive());
            while (peek().is(TokenType.COMMA)) {
                advance();
                items.add(parseAdditive());
            }
            expect(TokenType.RPAREN, "')' closing the in-list");
            return new InListNode(left, items, negated);
        }
        return left;
    }

    private ExpressionNode parseAdditive() {
        ExpressionNode left = parseMultiplicative();
        while (peek().is(TokenType.PLUS) || peek().is(TokenType.MINUS)) {
            Token op = advance();
            ExpressionNode right = parseMultiplicative();
            left = new ArithmeticNode(op.is(TokenType.PLUS)
                    ? ArithmeticNode.Operator.ADD
                    : ArithmeticNode.Operator.SUBTRACT, left, right);
        }
        return left;
    }

    private ExpressionNode parseMultiplicative() {
        ExpressionNode left = parseUnary();
        while (peek().is(TokenType.STAR) || peek().is(TokenType.SLASH)) {
            Token op = advance();
            ExpressionNode right = parseUnary();
            left = new ArithmeticNode(op.is(TokenType.STAR)
                    ? ArithmeticNode.Operator.MULTIPLY
                    : ArithmeticNode.Operator.DIVIDE, left, right);
        }
        return left;
    }

    private ExpressionNode parseUnary() {
        if (peek().is(TokenType.MINUS)) {
            advance();
            ExpressionNode operand = parseUnary();
            if (operand instanceof LiteralNode literal && literal.value() instanceof Long l) {
                return new LiteralNode(-l);
            }
            if (operand instanceof LiteralNode literal && literal.value() instanceof Double d) {
                return new LiteralNode(-d);
            }
            return new NegateNode(operand);
        }
        return parsePrimary();
    }

    private ExpressionNode parsePrimary() {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
                return new LiteralNode(parseNumber(token));
            case STRING:
                return new LiteralNode(token.text());
            case TRUE:
                return new LiteralNode(Boolean.TRUE);
            case FALSE:
                return new LiteralNode(Boolean.FALSE);
            case LPAREN: {
                ExpressionNode inner = parseOr();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            case CASE_REF: {
                Token name = expect(TokenType.IDENTIFIER, "column name inside .( )");
                expect(TokenType.RPAREN, "')' closing .(");
                return new FieldNode(FieldReference.ofCase(name.text()));
            }
            case IDENTIFIER:
                return parseIdentifier(token);
            default:
                throw error(token.is(TokenType.EOF)
                        ? "unexpected end of condition"
                        : "unexpected '" + token.text() + "'", token);
        }
    }

    private ExpressionNode parseIdentifier(Token name) {
        if (peek().is(TokenType.LPAREN)) {
            return parseCall(name, name.text());
        }
        if (peek().is(TokenType.DOT)) {
            String qualifier = name.text();
            advance();
            Token member = expect(TokenType.IDENTIFIER, "name after '" + qualifier + ".'");
            if (peek().is(TokenType.LPAREN)) {
                // R-style dotted function names such as is.na(x)
                return parseCall(name, qualifier + "." + member.text());
            }
            if ("case".equals(qualifier)) {
                return new FieldNode(FieldReference.ofCase(member.text()));
            }
            if ("control".equals(qualifier)) {
                return new FieldNode(FieldReference.ofControl(member.text()));
            }
            throw error("unknown qualifier '" + qualifier + "', expected 'case' or 'control'", name);
        }
        return new FieldNode(FieldReference.ofControl(name.text()));
    }

    private ExpressionNode parseCall(Token name, String functionName) {
        FunctionNode.Function function = FunctionNode.Function.lookup(functionName)
                .orElseThrow(() -> error("unknown function '" + functionName + "'", name));
        expect(TokenType.LPAREN, "'('");
        List<ExpressionNode> arguments = new ArrayList<>();
        if (!peek().is(TokenType.RPAREN)) {
            arguments.add(parseAdditive());
            while (peek().is(TokenType.COMMA)) {
                advance();
                arguments.add(parseAdditive());
            }
        }
        expect(TokenType.RPAREN, "')' closing " + functionName + "(");
        if (arguments.size() != function.arity()) {
            throw error(String.format("%s() takes %d argument(s), got %d",
                    functionName, function.arity(), arguments.size()), name);
        }
        if (function == FunctionNode.Function.DATE && arguments.get(0) instanceof LiteralNode literal) {
            try {
                return new LiteralNode(DateValues.toLocalDate(literal.value()));
            } catch (IllegalArgumentException e) {
                throw error(e.getMessage(), name);
            }
        }
        return new FunctionNode(function, arguments);
    }

    private Object parseNumber(Token token) {
        String text = token.text();
        try {
            if (text.contains(".")) {
                return Double.parseDouble(text);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw error("invalid number '" + text + "'", token);
        }
    }

    private void requireLogical(ExpressionNode node, Token at) {
        if (node.resultType() == ResultType.VALUE) {
            throw error("expected a boolean expression near '" + at.text() + "'", at);
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (!token.is(TokenType.EOF)) {
            index++;
        }
        return token;
    }

    private Token expect(TokenType type, String what) {
        Token token = peek();
        if (!token.is(type)) {
            throw error("expected " + what + " but found '" + token.text() + "'", token);
        }
        return advance();
    }

    private ConditionSyntaxException error(String message, Token at) {
        return new ConditionSyntaxException(message, source, at.position());
    }
}
