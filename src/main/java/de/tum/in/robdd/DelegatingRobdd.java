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
 * Forwards every call to a delegate and notifies subclasses when a call starts and ends.
 */
public class DelegatingRobdd implements Robdd {
    private final Robdd delegate;

    public DelegatingRobdd(Robdd delegate) {
        this.delegate = delegate;
    }

    protected void onEnter(String name) {
        // Empty
    }

    protected void onExit() {
        // Empty
    }

    @Override
    public int build(Formula formula, VariableOrdering ordering) {
        onEnter("build");
        try {
            return delegate.build(formula, ordering);
        } finally {
            onExit();
        }
    }

    @Override
    public int falseNode() {
        onEnter("falseNode");
        try {
            return delegate.falseNode();
        } finally {
            onExit();
        }
    }

    @Override
    public int trueNode() {
        onEnter("trueNode");
        try {
            return delegate.trueNode();
        } finally {
            onExit();
        }
    }

    @Override
    public boolean isLeaf(int node) {
        onEnter("isLeaf");
        try {
            return delegate.isLeaf(node);
        } finally {
            onExit();
        }
    }

    @Nullable
    @Override
    public String variableOf(int node) {
        onEnter("variableOf");
        try {
            return delegate.variableOf(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int low(int node) {
        onEnter("low");
        try {
            return delegate.low(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int high(int node) {
        onEnter("high");
        try {
            return delegate.high(node);
        } finally {
            onExit();
        }
    }

    @Override
    public int nodeCount() {
        onEnter("nodeCount");
        try {
            return delegate.nodeCount();
        } finally {
            onExit();
        }
    }

    @Override
    public List<String> variables() {
        onEnter("variables");
        try {
            return delegate.variables();
        } finally {
            onExit();
        }
    }

    @Override
    public void forEachNode(int node, IntConsumer action) {
        onEnter("forEachNode");
        try {
            delegate.forEachNode(node, action);
        } finally {
            onExit();
        }
    }

    @Override
    public int[] reachableNodes(int node) {
        onEnter("reachableNodes");
        try {
            return delegate.reachableNodes(node);
        } finally {
            onExit();
        }
    }

    @Override
    public Set<String> support(int node) {
        onEnter("support");
        try {
            return delegate.support(node);
        } finally {
            onExit();
        }
    }

    @Override
    public boolean evaluate(int node, Set<String> trueVariables) {
        onEnter("evaluate");
        try {
            return delegate.evaluate(node, trueVariables);
        } finally {
            onExit();
        }
    }

    @Override
    public String statistics() {
        onEnter("statistics");
        try {
            return delegate.statistics();
        } finally {
            onExit();
        }
    }
}
