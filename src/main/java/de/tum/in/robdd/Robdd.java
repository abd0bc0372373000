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

import java.util.List;

/**
 * A builder for reduced ordered binary decision diagrams which keeps all built diagrams in one
 * shared node table. Within one instance, two formulas denoting the same function under the same
 * ordering always yield the same root node.
 */
public interface Robdd extends DecisionDiagram {
    /**
     * Builds the diagram of {@code formula} by Shannon expansion along {@code ordering}.
     *
     * @param formula The formula to be converted.
     * @param ordering The variable order, the first variable is tested at the root.
     * @return The root node of the diagram.
     * @throws OrderingException If {@code ordering} does not contain a variable the function depends
     *     on.
     * @throws NodeLimitExceededException If the configured node limit is reached.
     */
    int build(Formula formula, VariableOrdering ordering);

    default int build(Formula formula, List<String> ordering) {
        return build(formula, VariableOrdering.of(ordering));
    }

    /**
     * Builds the diagram of {@code formula} with its free variables in alphabetical order.
     */
    default int build(Formula formula) {
        return build(formula, VariableOrdering.alphabetical(formula));
    }
}
