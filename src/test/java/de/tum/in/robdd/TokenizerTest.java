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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class TokenizerTest {
    private static List<Token.Type> types(String input) throws LexException {
        return Tokenizer.tokenize(input).stream().map(Token::type).collect(Collectors.toList());
    }

    private static List<String> texts(String input) throws LexException {
        return Tokenizer.tokenize(input).stream().map(Token::text).collect(Collectors.toList());
    }

    @Test
    public void testOperators() throws LexException {
        assertThat(
                types("(a&b)|!c^d->e<->f"),
                contains(
                        Token.Type.LEFT_PARENTHESIS,
                        Token.Type.IDENTIFIER,
                        Token.Type.AND,
                        Token.Type.IDENTIFIER,
                        Token.Type.RIGHT_PARENTHESIS,
                        Token.Type.OR,
                        Token.Type.NOT,
                        Token.Type.IDENTIFIER,
                        Token.Type.XOR,
                        Token.Type.IDENTIFIER,
                        Token.Type.IMPLICATION,
                        Token.Type.IDENTIFIER,
                        Token.Type.EQUIVALENCE,
                        Token.Type.IDENTIFIER));
    }

    @Test
    public void testIdentifiers() throws LexException {
        assertThat(texts("_x1 & Foo_Bar2 | z"), contains("_x1", "&", "Foo_Bar2", "|", "z"));
    }

    @Test
    public void testWhitespaceIsInsignificant() throws LexException {
        assertThat(texts(" a\t< - >\n b "), contains("a", "<->", "b"));
        // Whitespace is removed before scanning, so separated names are joined
        assertThat(texts("ab cd"), contains("abcd"));
        assertThat(Tokenizer.tokenize("   "), is(empty()));
    }

    @Test
    public void testPositions() throws LexException {
        List<Token> tokens = Tokenizer.tokenize("a <-> bc");
        assertThat(tokens.get(0).position(), is(0));
        assertThat(tokens.get(1).position(), is(1));
        assertThat(tokens.get(2).position(), is(4));
    }

    @Test
    public void testRejectsUnknownCharacter() {
        LexException exception = assertThrows(LexException.class, () -> Tokenizer.tokenize("a $ b"));
        assertThat(exception.position(), is(1));
        assertThat(exception.getMessage(), containsString("$"));
    }

    @Test
    public void testRejectsLeadingDigit() {
        LexException exception = assertThrows(LexException.class, () -> Tokenizer.tokenize("a & 1b"));
        assertThat(exception.position(), is(2));
    }

    @Test
    public void testRejectsIncompleteArrows() {
        assertThrows(LexException.class, () -> Tokenizer.tokenize("a - b"));
        assertThrows(LexException.class, () -> Tokenizer.tokenize("a <- b"));
        assertThrows(LexException.class, () -> Tokenizer.tokenize("a > b"));
    }
}
