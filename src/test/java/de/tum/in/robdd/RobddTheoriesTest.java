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
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Builds random formulas and checks the resulting diagrams against the formulas and the structural
 * invariants of reduced ordered diagrams.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class RobddTheoriesTest {
    private static final Logger logger = Logger.getLogger(RobddTheoriesTest.class.getName());

    private static final int variableCount = 7;
    private static final int formulaCount = 300;
    private static final int treeDepth = 7;

    private static final FormulaGenerator generator = new FormulaGenerator(0L, variableCount);
    private static final List<String> variables = generator.variables();
    private static final List<String> reversed = ImmutableList.copyOf(variables).reverse();
    private static final List<Formula> formulas = generator.generate(formulaCount, treeDepth);

    private final RobddImpl robdd = new RobddImpl(ImmutableRobddConfiguration.builder()
            .initialSize(64)
            .build());

    public static Stream<Formula> formulas() {
        return formulas.stream();
    }

    public static Stream<Formula[]> pairs() {
        return Stream.iterate(0, i -> i + 2)
                .limit(formulaCount / 2)
                .map(i -> new Formula[] {formulas.get(i), formulas.get(i + 1)});
    }

    @AfterAll
    public void checkInvariants() {
        assertThat(robdd.check(), is(true));
        logger.log(Level.INFO, robdd.statistics());
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("formulas")
    public void testSemantics(Formula formula) {
        for (List<String> ordering : List.of(variables, reversed)) {
            int root = robdd.build(formula, ordering);
            for (Set<String> assignment : FormulaGenerator.assignments(variables)) {
                assertThat(robdd.evaluate(root, assignment), is(formula.evaluate(assignment)));
            }
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("formulas")
    public void testDeterminism(Formula formula) {
        int root = robdd.build(formula, variables);
        int nodeCount = robdd.nodeCount();
        assertThat(robdd.build(formula, variables), is(root));
        assertThat(robdd.nodeCount(), is(nodeCount));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("formulas")
    public void testDoubleNegation(Formula formula) {
        assertThat(robdd.build(Formula.not(Formula.not(formula)), variables), is(robdd.build(formula, variables)));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("formulas")
    public void testStructure(Formula formula) {
        int root = robdd.build(formula, variables);
        Map<List<Object>, Integer> triples = new HashMap<>();
        for (int node : robdd.reachableNodes(root)) {
            if (robdd.isLeaf(node)) {
                assertThat(robdd.variableOf(node) == null, is(true));
                continue;
            }
            int low = robdd.low(node);
            int high = robdd.high(node);
            assertThat("Redundant node " + node, low == high, is(false));

            Integer previous = triples.put(List.<Object>of(robdd.variableOf(node), low, high), node);
            assertThat("Duplicate node " + node, previous == null, is(true));

            int position = variables.indexOf(robdd.variableOf(node));
            for (int child : new int[] {low, high}) {
                if (!robdd.isLeaf(child)) {
                    assertThat(position, is(lessThan(variables.indexOf(robdd.variableOf(child)))));
                }
            }
        }
        assertThat(formula.freeVariables().containsAll(robdd.support(root)), is(true));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("pairs")
    public void testEquivalentConstructions(Formula left, Formula right) {
        int and = robdd.build(Formula.and(left, right), variables);
        int deMorgan = robdd.build(Formula.not(Formula.or(Formula.not(left), Formula.not(right))), variables);
        assertThat(and, is(deMorgan));

        int implication = robdd.build(Formula.implication(left, right), variables);
        int disjunction = robdd.build(Formula.or(Formula.not(left), right), variables);
        assertThat(implication, is(disjunction));

        int equivalence = robdd.build(Formula.equivalence(left, right), variables);
        int negatedXor = robdd.build(Formula.not(Formula.xor(left, right)), variables);
        assertThat(equivalence, is(negatedXor));

        int xor = robdd.build(Formula.xor(left, right), variables);
        int expanded = robdd.build(
                Formula.or(Formula.and(left, Formula.not(right)), Formula.and(Formula.not(left), right)), variables);
        assertThat(xor, is(expanded));
    }
}
