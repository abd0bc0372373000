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
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class VariableOrderingTest {
    @Test
    public void testParse() {
        assertThat(VariableOrdering.parse(" b, a ,c").asList(), contains("b", "a", "c"));
    }

    @Test
    public void testRejectsDuplicates() {
        OrderingException exception = assertThrows(OrderingException.class, () -> VariableOrdering.of("a", "b", "a"));
        assertThat(exception.getMessage(), containsString("twice"));
    }

    @Test
    public void testRejectsEmptyNames() {
        assertThrows(OrderingException.class, () -> VariableOrdering.parse("a,,b"));
    }

    @Test
    public void testAlphabetical() throws FormulaParseException {
        Formula formula = FormulaParser.parse("(d & !c) | (b ^ a) | d");
        assertThat(VariableOrdering.alphabetical(formula).asList(), contains("a", "b", "c", "d"));
    }

    @Test
    public void testEquality() {
        assertThat(VariableOrdering.of("a", "b"), is(VariableOrdering.parse("a,b")));
        assertThat(VariableOrdering.of("a", "b").equals(VariableOrdering.of("b", "a")), is(false));
    }
}
