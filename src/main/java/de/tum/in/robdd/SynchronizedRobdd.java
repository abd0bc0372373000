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
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.IntConsumer;
import javax.annotation.Nullable;

/**
 * Guards a diagram with a read-write lock. Builds allocate nodes and hold the write lock, all other
 * operations only read the tables and share the read lock.
 */
public final class SynchronizedRobdd implements Robdd {
    private final Robdd delegate;
    private final Lock readLock;
    private final Lock writeLock;

    private SynchronizedRobdd(Robdd delegate, ReadWriteLock lock) {
        this.delegate = delegate;
        writeLock = lock.writeLock();
        readLock = lock.readLock();
    }

    public static SynchronizedRobdd create(Robdd robdd) {
        if (robdd instanceof SynchronizedRobdd) {
            return (SynchronizedRobdd) robdd;
        }
        ReadWriteLock lock = new ReentrantReadWriteLock();
        return new SynchronizedRobdd(robdd, lock);
    }

    @Override
    public int build(Formula formula, VariableOrdering ordering) {
        writeLock.lock();
        try {
            return delegate.build(formula, ordering);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int falseNode() {
        return delegate.falseNode();
    }

    @Override
    public int trueNode() {
        return delegate.trueNode();
    }

    @Override
    public boolean isLeaf(int node) {
        readLock.lock();
        try {
            return delegate.isLeaf(node);
        } finally {
            readLock.unlock();
        }
    }

    @Nullable
    @Override
    public String variableOf(int node) {
        readLock.lock();
        try {
            return delegate.variableOf(node);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int low(int node) {
        readLock.lock();
        try {
            return delegate.low(node);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int high(int node) {
        readLock.lock();
        try {
            return delegate.high(node);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int nodeCount() {
        readLock.lock();
        try {
            return delegate.nodeCount();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<String> variables() {
        readLock.lock();
        try {
            return List.copyOf(delegate.variables());
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void forEachNode(int node, IntConsumer action) {
        readLock.lock();
        try {
            delegate.forEachNode(node, action);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int[] reachableNodes(int node) {
        readLock.lock();
        try {
            return delegate.reachableNodes(node);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Set<String> support(int node) {
        readLock.lock();
        try {
            return delegate.support(node);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public boolean evaluate(int node, Set<String> trueVariables) {
        readLock.lock();
        try {
            return delegate.evaluate(node, trueVariables);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public String statistics() {
        readLock.lock();
        try {
            return delegate.statistics();
        } finally {
            readLock.unlock();
        }
    }
}
