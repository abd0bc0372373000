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
import java.util.Set;
import java.util.function.IntConsumer;
import javax.annotation.Nullable;

/**
 * Read access to the nodes of a diagram. Node ids are stable for the life of the diagram: nodes are
 * never removed or rewritten, so a root obtained from a build may be inspected at any later time.
 */
public interface DecisionDiagram {
    /**
     * Returns the node representing {@code false}. This is always {@code 0}.
     */
    int falseNode();

    /**
     * Returns the node representing {@code true}. This is always {@code 1}.
     */
    int trueNode();

    /**
     * Determines whether the given {@code node} represents a constant.
     *
     * @param node The node to be checked.
     * @return If the {@code node} represents a constant.
     */
    boolean isLeaf(int node);

    /**
     * Gets the name of the variable tested by {@code node}, or {@code null} for a leaf.
     */
    @Nullable
    String variableOf(int node);

    /**
     * Returns the successor of {@code node} for the case that its variable is {@code false}.
     */
    int low(int node);

    /**
     * Returns the successor of {@code node} for the case that its variable is {@code true}.
     */
    int high(int node);

    /**
     * Number of allocated nodes, including both terminals.
     */
    int nodeCount();

    /**
     * All variable names known to this diagram, in the order they were first seen.
     */
    List<String> variables();

    /**
     * Calls {@code action} once for every node reachable from {@code node}, terminals included, in
     * depth-first pre-order with the low successor visited first.
     */
    void forEachNode(int node, IntConsumer action);

    /**
     * Returns the nodes reachable from {@code node} in the order of {@link #forEachNode(int,
     * IntConsumer)}.
     */
    int[] reachableNodes(int node);

    /**
     * Computes the <b>support</b> of the function represented by the given {@code node}, i.e. all
     * variables which are tested on some path.
     */
    Set<String> support(int node);

    /**
     * Follows the path selected by the assignment, where exactly the variables in {@code
     * trueVariables} are {@code true}.
     */
    boolean evaluate(int node, Set<String> trueVariables);

    /**
     * Returns a string containing some statistics about the diagram. The content and formatting of this
     * string may change drastically and are only intended as human-readable output.
     */
    String statistics();
}
