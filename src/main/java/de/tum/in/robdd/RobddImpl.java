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

import static de.tum.in.robdd.Util.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import javax.annotation.Nullable;

/* Implementation notes:
 * - Diagrams are built top-down by Shannon expansion of the formula and reduced bottom-up through
 *   makeNode, so the successors of a node always have a smaller index than the node itself.
 * - Variable numbers are assigned in order of first appearance in any ordering and only identify
 *   the variable. The order of tests along a path is the order of the ordering used for the build.
 */
final class RobddImpl extends NodeTable implements Robdd {
    private static final Logger logger = Logger.getLogger(RobddImpl.class.getName());

    private final RobddConfiguration configuration;

    private final List<String> variableNames = new ArrayList<>();
    private final Map<String, Integer> variableNumbers = new HashMap<>();

    /* Low and high successors of each node */
    private int[] tree;

    private int hashLookupLow = NOT_A_NODE;
    private int hashLookupHigh = NOT_A_NODE;

    // Statistics
    private long buildCount = 0;
    private long memoLookups = 0;
    private long memoHits = 0;

    RobddImpl(RobddConfiguration configuration) {
        super(configuration.initialSize(), configuration.growthFactor(), configuration.maximumNodeCount());
        this.configuration = configuration;
        this.tree = new int[2 * tableSize()];
        Arrays.fill(tree, 0, 2 * FIRST_NODE, NOT_A_NODE);
    }

    // Variables

    int variableNumber(String name) {
        Integer number = variableNumbers.get(name);
        if (number != null) {
            return number;
        }
        int newNumber = variableNames.size();
        variableNames.add(name);
        variableNumbers.put(name, newNumber);
        return newNumber;
    }

    @Override
    public List<String> variables() {
        return Collections.unmodifiableList(variableNames);
    }

    // Nodes

    @Override
    protected boolean checkLookupChildrenMatch(int lookup) {
        int[] tree = this.tree;
        return tree[lookup * 2] == hashLookupLow && tree[lookup * 2 + 1] == hashLookupHigh;
    }

    /**
     * Returns the unique node testing {@code variable} with the given successors. Redundant tests are
     * elided, i.e. if both successors are equal, that successor is returned.
     */
    int makeNode(int variable, int low, int high) {
        assert 0 <= variable && variable < variableNames.size();
        assert isNodeValidOrLeaf(low) && isNodeValidOrLeaf(high);

        if (low == high) {
            return low;
        }

        hashLookupLow = low;
        hashLookupHigh = high;
        int node = findOrCreateNode(variable, hashCode(variable, low, high));

        this.tree[2 * node] = low;
        this.tree[2 * node + 1] = high;
        assert hashCode(variable, low, high) == hashCode(node, variable);
        return node;
    }

    int makeNode(String variable, int low, int high) {
        return makeNode(variableNumber(variable), low, high);
    }

    @Override
    public int low(int node) {
        checkArgument(isNodeValid(node), "Node %d is not a valid inner node", node);
        return tree[2 * node];
    }

    @Override
    public int high(int node) {
        checkArgument(isNodeValid(node), "Node %d is not a valid inner node", node);
        return tree[2 * node + 1];
    }

    @Nullable
    @Override
    public String variableOf(int node) {
        checkArgument(isNodeValidOrLeaf(node), "Node %d does not exist", node);
        return isLeaf(node) ? null : variableNames.get(variableNumberOf(node));
    }

    // Construction

    @Override
    public int build(Formula formula, VariableOrdering ordering) {
        Objects.requireNonNull(formula);
        if (formula.depth() > Formula.MAXIMUM_DEPTH) {
            throw new FormulaTooDeepException(formula.depth(), Formula.MAXIMUM_DEPTH);
        }
        int[] variableOrder = new int[ordering.size()];
        for (int i = 0; i < ordering.size(); i++) {
            variableOrder[i] = variableNumber(ordering.get(i));
        }

        logger.log(Level.FINE, "Building {0} along {1}", new Object[] {formula, ordering});
        buildCount += 1;
        Map<BuildKey, Integer> memo = configuration.memoizeBuilds() ? new HashMap<>() : null;
        int root = buildRecursive(formula, variableOrder, 0, memo);
        logger.log(Level.FINER, "Built root {0}, table has {1} nodes", new Object[] {root, nodeCount()});

        if (configuration.logStatistics()) {
            logger.log(Level.INFO, statistics());
        }
        return root;
    }

    private int buildRecursive(
            Formula formula, int[] variableOrder, int depth, @Nullable Map<BuildKey, Integer> memo) {
        Formula simplified = formula.simplify();
        if (simplified.isTrue()) {
            return TRUE_NODE;
        }
        if (simplified.isFalse()) {
            return FALSE_NODE;
        }
        if (depth == variableOrder.length) {
            throw new OrderingException(String.format(
                    "Ordering is exhausted but %s still depends on %s", simplified, simplified.freeVariables()));
        }

        BuildKey key = null;
        if (memo != null) {
            key = new BuildKey(simplified, depth);
            memoLookups += 1;
            Integer cached = memo.get(key);
            if (cached != null) {
                memoHits += 1;
                return cached;
            }
        }

        int variable = variableOrder[depth];
        String name = variableNames.get(variable);
        int low = buildRecursive(simplified.substitute(name, false), variableOrder, depth + 1, memo);
        int high = buildRecursive(simplified.substitute(name, true), variableOrder, depth + 1, memo);
        int node = makeNode(variable, low, high);

        if (memo != null) {
            memo.put(key, node);
        }
        return node;
    }

    // Read access

    @Override
    public void forEachNode(int node, IntConsumer action) {
        checkArgument(isNodeValidOrLeaf(node), "Node %d does not exist", node);
        forEachNodeRecursive(node, new BitSet(nodeCount()), action);
    }

    private void forEachNodeRecursive(int node, BitSet seen, IntConsumer action) {
        if (seen.get(node)) {
            return;
        }
        seen.set(node);
        action.accept(node);
        if (isLeaf(node)) {
            return;
        }
        forEachNodeRecursive(tree[2 * node], seen, action);
        forEachNodeRecursive(tree[2 * node + 1], seen, action);
    }

    @Override
    public int[] reachableNodes(int node) {
        IntStream.Builder builder = IntStream.builder();
        forEachNode(node, builder);
        return builder.build().toArray();
    }

    @Override
    public Set<String> support(int node) {
        BitSet supportVariables = new BitSet(variableNames.size());
        forEachNode(node, current -> {
            if (!isLeaf(current)) {
                supportVariables.set(variableNumberOf(current));
            }
        });
        Set<String> support = new LinkedHashSet<>();
        supportVariables.stream().forEach(variable -> support.add(variableNames.get(variable)));
        return support;
    }

    @Override
    public boolean evaluate(int node, Set<String> trueVariables) {
        checkArgument(isNodeValidOrLeaf(node), "Node %d does not exist", node);
        int current = node;
        while (!isLeaf(current)) {
            String variable = variableNames.get(variableNumberOf(current));
            current = trueVariables.contains(variable) ? tree[2 * current + 1] : tree[2 * current];
        }
        return current == TRUE_NODE;
    }

    @Override
    public String statistics() {
        return getStatistics()
                + String.format(
                        "%n%d variables, %d builds, memo: %d lookups, %d hits",
                        variableNames.size(), buildCount, memoLookups, memoHits);
    }

    @Override
    protected void onTableResize(int newSize) {
        tree = Arrays.copyOf(tree, newSize * 2);
    }

    @Override
    protected int hashCode(int node, int variable) {
        return hashCode(variable, tree[2 * node], tree[2 * node + 1]);
    }

    private static int hashCode(int variable, int low, int high) {
        return HashUtil.hash(variable, low, high);
    }

    private static final class BuildKey {
        private final Formula formula;
        private final int depth;

        BuildKey(Formula formula, int depth) {
            this.formula = formula;
            this.depth = depth;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof BuildKey)) {
                return false;
            }
            BuildKey that = (BuildKey) object;
            return depth == that.depth && formula.equals(that.formula);
        }

        @Override
        public int hashCode() {
            return 31 * formula.hashCode() + depth;
        }
    }
}
