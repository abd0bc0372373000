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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class RobddConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final double DEFAULT_NODE_TABLE_GROWTH_FACTOR = 1.5d;
    public static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_NODE_TABLE_GROWTH_FACTOR;
    }

    /**
     * Upper bound on the number of nodes, terminals included. Builds which would exceed it fail with a
     * {@link NodeLimitExceededException}.
     */
    @Value.Default
    public int maximumNodeCount() {
        return MAXIMAL_NODE_COUNT;
    }

    /**
     * Whether a build caches the diagram of each residual formula per ordering depth.
     */
    @Value.Default
    public boolean memoizeBuilds() {
        return true;
    }

    @Value.Default
    public boolean threadSafetyCheck() {
        return false;
    }

    @Value.Default
    public boolean logStatistics() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(initialSize() > 0, "Initial size must be positive, got %d", initialSize());
        Util.checkArgument(growthFactor() > 1.0, "Growth factor must exceed 1, got %f", growthFactor());
        Util.checkArgument(
                2 <= maximumNodeCount() && maximumNodeCount() <= MAXIMAL_NODE_COUNT,
                "Maximum node count must be within [2, %d], got %d",
                MAXIMAL_NODE_COUNT,
                maximumNodeCount());
    }
}
