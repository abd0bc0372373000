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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DotExporterTest {
    private static long countLines(String dot, String prefix) {
        return Arrays.stream(dot.split("\n")).filter(line -> line.startsWith(prefix)).count();
    }

    @Test
    public void testConjunction() throws FormulaParseException {
        Robdd robdd = RobddFactory.buildRobdd();
        int root = robdd.build(FormulaParser.parse("a & b"), VariableOrdering.of("a", "b"));
        int b = robdd.high(root);
        String dot = DotExporter.toDot(robdd, root);

        assertThat(dot, startsWith("// ROBDD\ndigraph {\n"));
        assertThat(dot, endsWith("}\n"));
        assertThat(dot, containsString("\t0 [label=0 fillcolor=\"#ffcccc\" shape=box style=filled]\n"));
        assertThat(dot, containsString("\t1 [label=1 fillcolor=\"#ccffcc\" shape=box style=filled]\n"));
        assertThat(dot, containsString("\t" + root + " [label=\"a\" shape=circle]\n"));
        assertThat(dot, containsString("\t" + b + " [label=\"b\" shape=circle]\n"));
        assertThat(dot, containsString("\t" + root + " -> 0 [label=0 color=red style=dashed]\n"));
        assertThat(dot, containsString("\t" + root + " -> " + b + " [label=1 color=blue style=solid]\n"));
        assertThat(dot, containsString("\t" + b + " -> 1 [label=1 color=blue style=solid]\n"));
    }

    @Test
    public void testSharedNodesAppearOnce() throws FormulaParseException {
        Robdd robdd = RobddFactory.buildRobdd();
        int root = robdd.build(FormulaParser.parse("(a <-> b) ^ (c <-> d)"), VariableOrdering.of("a", "b", "c", "d"));
        String dot = DotExporter.toDot(robdd, root);

        for (int node : robdd.reachableNodes(root)) {
            assertThat(countLines(dot, "\t" + node + " ["), is(1L));
            if (!robdd.isLeaf(node)) {
                assertThat(countLines(dot, "\t" + node + " -> "), is(2L));
            }
        }
        assertThat(countLines(dot, "\t"), is(1L + 3L * robdd.reachableNodes(root).length - 4L));
    }

    @Test
    public void testConstantDiagram() {
        Robdd robdd = RobddFactory.buildRobdd();
        int root = robdd.build(Formula.constant(true));
        String dot = DotExporter.toDot(robdd, root);
        assertThat(dot, containsString("\t1 [label=1"));
        assertThat(dot, containsString("\t0 [label=0"));
        assertThat(dot, not(containsString("->")));
    }

    @Test
    public void testUnrelatedNodesAreNotWritten() throws FormulaParseException {
        Robdd robdd = RobddFactory.buildRobdd();
        robdd.build(FormulaParser.parse("x | y"), VariableOrdering.of("x", "y"));
        int root = robdd.build(FormulaParser.parse("a"), VariableOrdering.of("a"));
        String dot = DotExporter.toDot(robdd, root);
        assertThat(dot, not(containsString("\"x\"")));
        assertThat(dot, not(containsString("\"y\"")));
    }

    @Test
    public void testWriteFile(@TempDir Path directory) throws IOException, FormulaParseException {
        Robdd robdd = RobddFactory.buildRobdd();
        int root = robdd.build(FormulaParser.parse("a -> b"));
        Path path = directory.resolve("diagram.dot");
        DotExporter.write(robdd, root, path);
        assertThat(Files.readString(path, StandardCharsets.UTF_8), is(DotExporter.toDot(robdd, root)));
    }

    @Test
    public void testCheckedDiagram() throws FormulaParseException {
        Robdd robdd = RobddFactory.buildRobdd(ImmutableRobddConfiguration.builder()
                .threadSafetyCheck(true)
                .build());
        int root = robdd.build(FormulaParser.parse("a ^ b"));
        assertThat(DotExporter.toDot(robdd, root), containsString("\"b\""));
    }
}
