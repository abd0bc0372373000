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

public final class RobddFactory {
    private RobddFactory() {}

    public static Robdd buildRobdd() {
        return buildRobdd(ImmutableRobddConfiguration.builder().build());
    }

    public static Robdd buildRobdd(RobddConfiguration configuration) {
        RobddImpl robdd = new RobddImpl(configuration);
        return configuration.threadSafetyCheck() ? new CheckedRobdd(robdd) : robdd;
    }

    /**
     * Creates a diagram which may be shared between threads. Concurrent builds are serialized.
     */
    public static SynchronizedRobdd buildSynchronizedRobdd(RobddConfiguration configuration) {
        return SynchronizedRobdd.create(new RobddImpl(configuration));
    }
}
