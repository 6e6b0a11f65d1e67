/*
 * This file is part of JTruth.
 * Copyright (C) 2023 (See AUTHORS)
 *
 * JTruth is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JTruth is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JTruth. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jtruth;

import javax.annotation.Nullable;

/**
 * Recursive-descent parser for propositional formulas.
 *
 * <p>Precedence from loosest to tightest binding: implication, or, xor, and, not. All binary
 * connectives associate to the left, so {@code a -> b -> c} is read as {@code (a -> b) -> c}.
 * Connectives may be written as words, ASCII symbols or Unicode symbols:</p>
 *
 * <ul>
 *   <li>and: {@code and}, {@code &&}, {@code ∧}</li>
 *   <li>or: {@code or}, {@code ||}, {@code ∨}</li>
 *   <li>xor: {@code xor}, {@code ⊕}, {@code ⊻}</li>
 *   <li>not: {@code not}, {@code !}, {@code ¬}</li>
 *   <li>implication: {@code ->}, {@code →}</li>
 * </ul>
 *
 * <p>Identifiers start with a letter or underscore, followed by letters, digits and underscores.
 * The words above are reserved.</p>
 */
public final class ExpressionParser {
    private enum Token {
        NOT("not"),
        AND("and"),
        OR("or"),
        XOR("xor"),
        IMPLICATION("->"),
        IDENTIFIER("identifier"),
        LEFT_PAREN("("),
        RIGHT_PAREN(")"),
        END("end of input");

        private final String description;

        Token(String description) {
            this.description = description;
        }
    }

    private final String input;
    private int position = 0;
    private Token token = Token.END;
    private int tokenStart = 0;
    @Nullable
    private String identifier = null;

    private ExpressionParser(String input) {
        this.input = input;
    }

    public static Expression parse(String input) throws ParseException {
        ExpressionParser parser = new ExpressionParser(input);
        parser.advance();
        Expression expression = parser.parseImplication();
        if (parser.token != Token.END) {
            throw parser.unexpected(Token.END.description);
        }
        return expression;
    }

    private Expression parseImplication() throws ParseException {
        Expression left = parseOr();
        while (token == Token.IMPLICATION) {
            advance();
            left = Expression.implication(left, parseOr());
        }
        return left;
    }

    private Expression parseOr() throws ParseException {
        Expression left = parseXor();
        while (token == Token.OR) {
            advance();
            left = Expression.or(left, parseXor());
        }
        return left;
    }

    private Expression parseXor() throws ParseException {
        Expression left = parseAnd();
        while (token == Token.XOR) {
            advance();
            left = Expression.xor(left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() throws ParseException {
        Expression left = parseUnary();
        while (token == Token.AND) {
            advance();
            left = Expression.and(left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() throws ParseException {
        if (token == Token.NOT) {
            advance();
            return Expression.not(parseUnary());
        }
        return parsePrimary();
    }

    private Expression parsePrimary() throws ParseException {
        switch (token) {
            case IDENTIFIER:
                assert identifier != null;
                Expression expression = Expression.identifier(identifier);
                advance();
                return expression;
            case LEFT_PAREN:
                advance();
                Expression inner = parseImplication();
                if (token != Token.RIGHT_PAREN) {
                    throw unexpected(Token.RIGHT_PAREN.description);
                }
                advance();
                return inner;
            case END:
                throw new ParseException("Unexpected end of input", tokenStart);
            default:
                throw unexpected("identifier or '('");
        }
    }

    private ParseException unexpected(String expected) {
        String found = token == Token.IDENTIFIER ? identifier : token.description;
        return new ParseException(
                String.format("Unexpected token at %d: expected %s, found %s", tokenStart, expected, found),
                tokenStart);
    }

    private void advance() throws ParseException {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position += 1;
        }
        tokenStart = position;
        identifier = null;
        if (position == input.length()) {
            token = Token.END;
            return;
        }

        int codePoint = input.codePointAt(position);
        if (Character.isAlphabetic(codePoint) || codePoint == '_') {
            int end = position + Character.charCount(codePoint);
            while (end < input.length() && VariableCollector.isNameCharacter(input.codePointAt(end))) {
                end += Character.charCount(input.codePointAt(end));
            }
            String word = input.substring(position, end);
            position = end;
            switch (word) {
                case "and":
                    token = Token.AND;
                    break;
                case "or":
                    token = Token.OR;
                    break;
                case "xor":
                    token = Token.XOR;
                    break;
                case "not":
                    token = Token.NOT;
                    break;
                default:
                    token = Token.IDENTIFIER;
                    identifier = word;
            }
            return;
        }

        char current = input.charAt(position);
        switch (current) {
            case '(':
                token = Token.LEFT_PAREN;
                break;
            case ')':
                token = Token.RIGHT_PAREN;
                break;
            case '!':
            case '¬':
                token = Token.NOT;
                break;
            case '∧':
                token = Token.AND;
                break;
            case '∨':
                token = Token.OR;
                break;
            case '⊕':
            case '⊻':
                token = Token.XOR;
                break;
            case '→':
                token = Token.IMPLICATION;
                break;
            case '&':
                token = symbolPair('&', Token.AND);
                break;
            case '|':
                token = symbolPair('|', Token.OR);
                break;
            case '-':
                token = symbolPair('>', Token.IMPLICATION);
                break;
            default:
                throw new ParseException(
                        String.format("Unexpected character '%c' at %d", codePoint, position), position);
        }
        position += 1;
    }

    // Consumes the first character of a two-character symbol
    private Token symbolPair(char second, Token result) throws ParseException {
        if (position + 1 < input.length() && input.charAt(position + 1) == second) {
            position += 1;
            return result;
        }
        throw new ParseException(String.format("Unexpected character '%c' at %d, expected '%c%c'",
                input.charAt(position), position, input.charAt(position), second), position);
    }

    public static class ParseException extends Exception {
        private static final long serialVersionUID = 1L;

        private final int position;

        public ParseException(String message, int position) {
            super(message);
            this.position = position;
        }

        /**
         * Index of the offending character in the input.
         */
        public int position() {
            return position;
        }
    }
}
