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
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A duplicate-free sequence of variable names. The first variable is tested at the root of a
 * diagram.
 */
public final class VariableOrdering {
    private final List<String> variables;

    private VariableOrdering(List<String> variables) {
        this.variables = variables;
    }

    public static VariableOrdering of(String... variables) {
        return of(Arrays.asList(variables));
    }

    public static VariableOrdering of(Collection<String> variables) {
        List<String> list = List.copyOf(variables);
        Set<String> seen = new HashSet<>();
        for (String variable : list) {
            if (variable.isEmpty()) {
                throw new OrderingException("Empty variable name in ordering " + list);
            }
            if (!seen.add(variable)) {
                throw new OrderingException(String.format("Variable %s occurs twice in ordering %s", variable, list));
            }
        }
        return new VariableOrdering(list);
    }

    /**
     * Reads a comma separated list of variable names. Surrounding whitespace of each name is ignored.
     */
    public static VariableOrdering parse(String commaSeparated) {
        List<String> names = new ArrayList<>();
        for (String name : commaSeparated.split(",", -1)) {
            names.add(name.strip());
        }
        return of(names);
    }

    /**
     * The default ordering of a formula: its free variables in alphabetical order.
     */
    public static VariableOrdering alphabetical(Formula formula) {
        if (formula.depth() > Formula.MAXIMUM_DEPTH) {
            throw new FormulaTooDeepException(formula.depth(), Formula.MAXIMUM_DEPTH);
        }
        return new VariableOrdering(List.copyOf(formula.freeVariables()));
    }

    public int size() {
        return variables.size();
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    public String get(int index) {
        return variables.get(index);
    }

    public boolean contains(String variable) {
        return variables.contains(variable);
    }

    public List<String> asList() {
        return variables;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof VariableOrdering)) {
            return false;
        }
        return variables.equals(((VariableOrdering) object).variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variables);
    }

    @Override
    public String toString() {
        return variables.toString();
    }
}
