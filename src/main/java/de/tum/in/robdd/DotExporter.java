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

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the part of a diagram reachable from a root in Graphviz DOT syntax. Low edges are dashed
 * and labelled {@code 0}, high edges are solid and labelled {@code 1}.
 */
public final class DotExporter {
    private static final String FALSE_COLOR = "#ffcccc";
    private static final String TRUE_COLOR = "#ccffcc";

    private DotExporter() {}

    public static void write(DecisionDiagram diagram, int root, Appendable output) throws IOException {
        output.append("// ROBDD\n");
        output.append("digraph {\n");
        output.append("\trankdir=TB\n");
        appendLeaf(output, diagram.falseNode(), FALSE_COLOR);
        appendLeaf(output, diagram.trueNode(), TRUE_COLOR);

        // Collect first, the diagram must not be queried from within its own traversal
        for (int node : diagram.reachableNodes(root)) {
            if (!diagram.isLeaf(node)) {
                appendNode(output, diagram, node);
            }
        }
        output.append("}\n");
    }

    public static String toDot(DecisionDiagram diagram, int root) {
        StringBuilder builder = new StringBuilder(256);
        try {
            write(diagram, root, builder);
        } catch (IOException e) {
            throw new AssertionError("StringBuilder does not throw", e);
        }
        return builder.toString();
    }

    public static void write(DecisionDiagram diagram, int root, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(diagram, root, writer);
        }
    }

    private static void appendLeaf(Appendable output, int leaf, String color) throws IOException {
        output.append(String.format(
                "\t%d [label=%d fillcolor=\"%s\" shape=box style=filled]\n", leaf, leaf, color));
    }

    private static void appendNode(Appendable output, DecisionDiagram diagram, int node) throws IOException {
        output.append(String.format("\t%d [label=\"%s\" shape=circle]\n", node, diagram.variableOf(node)));
        output.append(String.format(
                "\t%d -> %d [label=0 color=red style=dashed]\n", node, diagram.low(node)));
        output.append(String.format(
                "\t%d -> %d [label=1 color=blue style=solid]\n", node, diagram.high(node)));
    }
}
