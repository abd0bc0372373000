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

public class NodeLimitExceededException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final int limit;

    public NodeLimitExceededException(int limit) {
        super(String.format("Node table exceeded the configured limit of %d nodes", limit));
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
