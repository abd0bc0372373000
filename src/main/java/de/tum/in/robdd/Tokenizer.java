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

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Splits a formula into tokens. Whitespace is insignificant and removed before scanning, hence
 * {@code a b} reads as the single identifier {@code ab}.
 */
public final class Tokenizer {
    private static final int EXCERPT_LENGTH = 10;

    private Tokenizer() {}

    static String stripWhitespace(CharSequence input) {
        StringBuilder builder = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char character = input.charAt(i);
            if (!Character.isWhitespace(character)) {
                builder.append(character);
            }
        }
        return builder.toString();
    }

    public static List<Token> tokenize(CharSequence input) throws LexException {
        String string = stripWhitespace(input);
        List<Token> tokens = new ArrayList<>();

        int index = 0;
        int length = string.length();
        while (index < length) {
            char character = string.charAt(index);
            if (isIdentifierStart(character)) {
                int end = index + 1;
                while (end < length && isIdentifierPart(string.charAt(end))) {
                    end += 1;
                }
                tokens.add(new Token(Token.Type.IDENTIFIER, string.substring(index, end), index));
                index = end;
                continue;
            }

            // Longest match first
            Token.Type type;
            if (string.startsWith("<->", index)) {
                type = Token.Type.EQUIVALENCE;
            } else if (string.startsWith("->", index)) {
                type = Token.Type.IMPLICATION;
            } else {
                type = singleCharacterType(character);
            }
            if (type == null) {
                String excerpt = string.substring(index, Math.min(length, index + EXCERPT_LENGTH));
                throw new LexException(
                        String.format("Unexpected character '%c' at %d: %s", character, index, excerpt), index);
            }
            tokens.add(new Token(type, type.symbol(), index));
            index += type.symbol().length();
        }
        return tokens;
    }

    @Nullable
    private static Token.Type singleCharacterType(char character) {
        switch (character) {
            case '(':
                return Token.Type.LEFT_PARENTHESIS;
            case ')':
                return Token.Type.RIGHT_PARENTHESIS;
            case '!':
                return Token.Type.NOT;
            case '&':
                return Token.Type.AND;
            case '|':
                return Token.Type.OR;
            case '^':
                return Token.Type.XOR;
            default:
                return null;
        }
    }

    private static boolean isIdentifierStart(char character) {
        return ('a' <= character && character <= 'z') || ('A' <= character && character <= 'Z') || character == '_';
    }

    private static boolean isIdentifierPart(char character) {
        return isIdentifierStart(character) || ('0' <= character && character <= '9');
    }
}
