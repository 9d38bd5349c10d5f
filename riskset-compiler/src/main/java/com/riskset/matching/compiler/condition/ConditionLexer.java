/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler.condition;

import com.riskset.matching.api.exceptions.ConditionSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits condition text into tokens.
 *
 * <p>Both C-style and R-style connectives are accepted ({@code &&}/{@code &}/{@code and},
 * {@code ||}/{@code |}/{@code or}, {@code !}/{@code not}, {@code in}/{@code %in%}).
 */
public final class ConditionLexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "and", TokenType.AND,
            "or", TokenType.OR,
            "not", TokenType.NOT,
            "in", TokenType.IN,
            "true", TokenType.TRUE,
            "false", TokenType.FALSE);

    private final String source;
    private int pos;

    public ConditionLexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private Token next() {
        int start = pos;
        char c = source.charAt(pos);

        if (Character.isDigit(c)) {
            return number(start);
        }
        if (Character.isLetter(c) || c == '_') {
            return word(start);
        }
        if (c == '\'' || c == '"') {
            return string(start, c);
        }

        switch (c) {
            case '(': pos++; return new Token(TokenType.LPAREN, "(", start);
            case ')': pos++; return new Token(TokenType.RPAREN, ")", start);
            case ',': pos++; return new Token(TokenType.COMMA, ",", start);
            case '+': pos++; return new Token(TokenType.PLUS, "+", start);
            case '-': pos++; return new Token(TokenType.MINUS, "-", start);
            case '*': pos++; return new Token(TokenType.STAR, "*", start);
            case '/': pos++; return new Token(TokenType.SLASH, "/", start);
            case '.':
                if (peek(1) == '(') {
                    pos += 2;
                    return new Token(TokenType.CASE_REF, ".(", start);
                }
                if (Character.isDigit(peek(1))) {
                    return number(start);
                }
                pos++;
                return new Token(TokenType.DOT, ".", start);
            case '&':
                pos += peek(1) == '&' ? 2 : 1;
                return new Token(TokenType.AND, source.substring(start, pos), start);
            case '|':
                pos += peek(1) == '|' ? 2 : 1;
                return new Token(TokenType.OR, source.substring(start, pos), start);
            case '=':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.EQ, "==", start);
                }
                throw new ConditionSyntaxException("single '=' is not an operator, use '=='", source, start);
            case '!':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.NE, "!=", start);
                }
                pos++;
                return new Token(TokenType.NOT, "!", start);
            case '<':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.LE, "<=", start);
                }
                if (peek(1) == '>') {
                    pos += 2;
                    return new Token(TokenType.NE, "<>", start);
                }
                pos++;
                return new Token(TokenType.LT, "<", start);
            case '>':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(TokenType.GE, ">=", start);
                }
                pos++;
                return new Token(TokenType.GT, ">", start);
            case '%':
                if (source.startsWith("%in%", pos)) {
                    pos += 4;
                    return new Token(TokenType.IN, "%in%", start);
                }
                throw new ConditionSyntaxException("unknown operator starting with '%'", source, start);
            default:
                throw new ConditionSyntaxException("unexpected character '" + c + "'", source, start);
        }
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private Token number(int start) {
        boolean seenDot = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c)) {
                pos++;
            } else if (c == '.' && !seenDot && Character.isDigit(peek(1))) {
                seenDot = true;
                pos++;
            } else {
                break;
            }
        }
        // R integer suffix, e.g. 2L
        if (pos < source.length() && source.charAt(pos) == 'L' && !seenDot) {
            String text = source.substring(start, pos);
            pos++;
            return new Token(TokenType.NUMBER, text, start);
        }
        return new Token(TokenType.NUMBER, source.substring(start, pos), start);
    }

    private Token word(int start) {
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        String text = source.substring(start, pos);
        TokenType keyword = KEYWORDS.get(text.toLowerCase(Locale.ROOT));
        return new Token(keyword != null ? keyword : TokenType.IDENTIFIER, text, start);
    }

    private Token string(int start, char quote) {
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                sb.append(source.charAt(pos + 1));
                pos += 2;
            } else if (c == quote) {
                pos++;
                return new Token(TokenType.STRING, sb.toString(), start);
            } else {
                sb.append(c);
                pos++;
            }
        }
        throw new ConditionSyntaxException("unterminated string literal", source, start);
    }
}
