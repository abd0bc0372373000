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

import static de.tum.in.robdd.Util.checkState;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only node storage together with the unique table. Nodes are numbered consecutively, the
 * two leaves occupy {@code 0} and {@code 1}. Subclasses store the successors of each node and
 * decide when two nodes are equal.
 */
public abstract class NodeTable implements DecisionDiagram {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    protected static final int NOT_A_NODE = -1;
    protected static final int FALSE_NODE = 0;
    protected static final int TRUE_NODE = 1;
    protected static final int FIRST_NODE = 2;

    /* Variable number stored for both leaves */
    protected static final int LEAF_VARIABLE = -1;

    private static final int MINIMUM_NODE_TABLE_SIZE = 16;

    private final double growthFactor;
    private final int maximumNodeCount;

    /* Index of the next node to be allocated, equivalently the number of allocated nodes. */
    private int nextNode;

    /* Variable number of each node. */
    private int[] variables;

    /* Hash map for existing nodes. When a node with a certain hash is created, it is put in front of
     * the chain which starts at hashToChainStart[hash]. The chain continues at hashChain[node] and
     * ends with NOT_A_NODE. Leaves are never part of a chain. */
    private int[] hashToChainStart;
    private int[] hashChain;

    // Statistics
    private long createdNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;

    protected NodeTable(int initialSize, double growthFactor, int maximumNodeCount) {
        this.growthFactor = growthFactor;
        this.maximumNodeCount = maximumNodeCount;
        int tableSize = Math.max(initialSize, MINIMUM_NODE_TABLE_SIZE);

        variables = new int[tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];
        Arrays.fill(hashToChainStart, NOT_A_NODE);
        Arrays.fill(hashChain, NOT_A_NODE);

        variables[FALSE_NODE] = LEAF_VARIABLE;
        variables[TRUE_NODE] = LEAF_VARIABLE;
        nextNode = FIRST_NODE;
    }

    protected final int tableSize() {
        return variables.length;
    }

    @Override
    public final int nodeCount() {
        return nextNode;
    }

    @Override
    public int falseNode() {
        return FALSE_NODE;
    }

    @Override
    public int trueNode() {
        return TRUE_NODE;
    }

    @Override
    public boolean isLeaf(int node) {
        assert isNodeValidOrLeaf(node);
        return node == FALSE_NODE || node == TRUE_NODE;
    }

    protected final boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node < nextNode;
    }

    protected final boolean isNodeValidOrLeaf(int node) {
        return 0 <= node && node < nextNode;
    }

    protected final int variableNumberOf(int node) {
        assert isNodeValidOrLeaf(node);
        return variables[node];
    }

    private int hashToTable(int hashCode) {
        return HashUtil.mod(hashCode, tableSize());
    }

    /**
     * Returns the node with the given variable whose successors satisfy {@link
     * #checkLookupChildrenMatch(int)}, allocating a new one if none exists. Newly allocated nodes
     * have to be populated by the caller.
     */
    protected int findOrCreateNode(int variable, int hashCode) {
        int[] variables = this.variables;
        int[] hashChain = this.hashChain;

        int currentLookupNode = hashToChainStart[hashToTable(hashCode)];

        // Search for the node in the hash chain
        int chainLookups = 1;
        this.hashChainLookups += 1;
        while (currentLookupNode != NOT_A_NODE) {
            if (variables[currentLookupNode] == variable && checkLookupChildrenMatch(currentLookupNode)) {
                this.hashChainLookupLength += chainLookups;
                this.hashChainLookupHit += 1;
                return currentLookupNode;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        this.hashChainLookupLength += chainLookups;

        if (nextNode >= maximumNodeCount) {
            throw new NodeLimitExceededException(maximumNodeCount);
        }
        if (nextNode == tableSize()) {
            grow();
        }

        int freeNode = nextNode;
        nextNode += 1;
        createdNodes += 1;

        this.variables[freeNode] = variable;
        connectHashList(freeNode, hashCode);
        return freeNode;
    }

    private void connectHashList(int node, int hashCode) {
        int lookup = hashToTable(hashCode);
        hashChain[node] = hashToChainStart[lookup];
        hashToChainStart[lookup] = node;
    }

    private void grow() {
        int oldSize = tableSize();
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = (int) Math.min(RobddConfiguration.MAXIMAL_NODE_COUNT, Math.ceil(oldSize * growthFactor));
        checkState(oldSize < newSize, "Cannot grow table of size %d", oldSize);

        logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});
        growCount += 1;

        onTableResize(newSize);
        variables = Arrays.copyOf(variables, newSize);
        hashChain = new int[newSize];
        // The chain start depends on the table size, hence re-build the hash map completely
        hashToChainStart = new int[newSize];
        Arrays.fill(hashChain, NOT_A_NODE);
        Arrays.fill(hashToChainStart, NOT_A_NODE);

        for (int node = nextNode - 1; node >= FIRST_NODE; node--) {
            connectHashList(node, hashCode(node, variables[node]));
        }

        assert check();
        logger.log(Level.FINE, "Finished growing the table");
    }

    /**
     * Performs some integrity / invariant checks.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     */
    boolean check() {
        logger.log(Level.FINER, "Running integrity check");
        checkState(variables[FALSE_NODE] == LEAF_VARIABLE && variables[TRUE_NODE] == LEAF_VARIABLE);

        for (int node = FIRST_NODE; node < nextNode; node++) {
            int low = low(node);
            int high = high(node);
            checkState(variables[node] >= 0, "Node %s has no variable", nodeToString(node));
            checkState(low != high, "Node %s is redundant", nodeToString(node));
            checkState(
                    isNodeValidOrLeaf(low) && low < node && isNodeValidOrLeaf(high) && high < node,
                    "Node %s has invalid successors",
                    nodeToString(node));

            // Exactly this node with this triple has to be in the corresponding chain
            int found = 0;
            boolean contained = false;
            int chainNode = hashToChainStart[hashToTable(hashCode(node, variables[node]))];
            while (chainNode != NOT_A_NODE) {
                if (chainNode == node) {
                    contained = true;
                }
                if (variables[chainNode] == variables[node] && low(chainNode) == low && high(chainNode) == high) {
                    found += 1;
                }
                chainNode = hashChain[chainNode];
            }
            checkState(contained, "Node %s not in its hash chain", nodeToString(node));
            checkState(found == 1, "Node %s is stored %d times", nodeToString(node), found);
        }
        return true;
    }

    public String getStatistics() {
        int chains = 0;
        int longestChain = 0;
        for (int chainStart : hashToChainStart) {
            if (chainStart == NOT_A_NODE) {
                continue;
            }
            chains += 1;
            int length = 0;
            for (int node = chainStart; node != NOT_A_NODE; node = hashChain[node]) {
                length += 1;
            }
            longestChain = Math.max(longestChain, length);
        }

        return String.format(
                "Node table statistics:%n"
                        + "Table Size: %1$d, %2$d nodes (%3$d created, limit %4$d)%n"
                        + "Hash table: %5$d chains, %6$.2f load, %7$d max; "
                        + "%8$d lookups, %9$.2f avg. len, %10$d hits%n"
                        + "%11$d grows",
                tableSize(),
                nextNode,
                createdNodes,
                maximumNodeCount,
                chains,
                chains * 1.0 / tableSize(),
                longestChain,
                hashChainLookups,
                hashChainLookups == 0 ? 0.0 : hashChainLookupLength * 1.0 / hashChainLookups,
                hashChainLookupHit,
                growCount);
    }

    public String nodeToString(int node) {
        if (!isNodeValidOrLeaf(node)) {
            return String.format("%5d| == INVALID ==", node);
        }
        if (node == FALSE_NODE || node == TRUE_NODE) {
            return String.format("%5d| LEAF", node);
        }
        return String.format("%5d|%3d|%5d|%5d", node, variables[node], low(node), high(node));
    }

    protected abstract boolean checkLookupChildrenMatch(int lookup);

    protected abstract int hashCode(int node, int variable);

    protected abstract void onTableResize(int newSize);
}
