/*
 * This file is part of JROBDD.
 * Copyright (c) 2023 The JROBDD authors.
 *
 * JROBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JROBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JROBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.robdd;

import java.util.Objects;

/**
 * A lexical token of a formula together with its start position in the whitespace-free input.
 */
public final class Token {
    private final Type type;
    private final String text;
    private final int position;

    Token(Type type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    public Type type() {
        return type;
    }

    public String text() {
        return text;
    }

    public int position() {
        return position;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Token)) {
            return false;
        }
        Token that = (Token) object;
        return position == that.position && type == that.type && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, position);
    }

    @Override
    public String toString() {
        return text;
    }

    public enum Type {
        IDENTIFIER(null, -1),
        LEFT_PARENTHESIS("(", -1),
        RIGHT_PARENTHESIS(")", -1),
        NOT("!", -1),
        AND("&", 5),
        XOR("^", 4),
        OR("|", 3),
        IMPLICATION("->", 2),
        EQUIVALENCE("<->", 1);

        private final String symbol;
        private final int precedence;

        Type(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        /**
         * Returns the fixed spelling of this token type, or {@code null} for identifiers.
         */
        public String symbol() {
            return symbol;
        }

        /**
         * Binding strength of a binary operator, {@code -1} for all other token types.
         */
        public int precedence() {
            return precedence;
        }

        public boolean isBinaryOperator() {
            return precedence > 0;
        }

        public boolean isRightAssociative() {
            return this == IMPLICATION || this == EQUIVALENCE;
        }
    }
}
