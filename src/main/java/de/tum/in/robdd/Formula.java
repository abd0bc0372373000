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

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable propositional formula. Instances are compared structurally; simplification and
 * substitution always create new trees and share unchanged subtrees with the input.
 */
@SuppressWarnings({"AccessingNonPublicFieldOfAnotherObject", "PMD.GodClass"})
public abstract class Formula {
    /**
     * Deepest formula accepted by the parser and by {@link Robdd#build(Formula, VariableOrdering)}.
     * All tree operations recurse along the depth.
     */
    public static final int MAXIMUM_DEPTH = 1000;

    private static final Formula TRUE = new Constant(true);
    private static final Formula FALSE = new Constant(false);

    Formula() {}

    public static Formula constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Formula variable(String name) {
        return new Variable(name);
    }

    public static Formula not(Formula operand) {
        return new Not(operand);
    }

    public static Formula and(Formula left, Formula right) {
        return new Binary(BinaryType.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return new Binary(BinaryType.OR, left, right);
    }

    public static Formula xor(Formula left, Formula right) {
        return new Binary(BinaryType.XOR, left, right);
    }

    public static Formula implication(Formula left, Formula right) {
        return new Binary(BinaryType.IMPLICATION, left, right);
    }

    public static Formula equivalence(Formula left, Formula right) {
        return new Binary(BinaryType.EQUIVALENCE, left, right);
    }

    public static Formula binary(BinaryType type, Formula left, Formula right) {
        return new Binary(type, left, right);
    }

    public boolean isConstant() {
        return this instanceof Constant;
    }

    public boolean isTrue() {
        return this == TRUE || (this instanceof Constant && ((Constant) this).value);
    }

    public boolean isFalse() {
        return this == FALSE || (this instanceof Constant && !((Constant) this).value);
    }

    /**
     * Folds constants bottom-up. If the formula contains no variables, the result is a constant.
     */
    public abstract Formula simplify();

    /**
     * Replaces every occurrence of {@code variable} by the given constant.
     */
    public abstract Formula substitute(String variable, boolean value);

    /**
     * Evaluates the formula, where exactly the variables in {@code trueVariables} are assigned
     * {@code true}.
     */
    public abstract boolean evaluate(Set<String> trueVariables);

    public abstract boolean hasVariable(String name);

    abstract void gatherVariables(Set<String> set);

    public SortedSet<String> freeVariables() {
        SortedSet<String> variables = new TreeSet<>();
        gatherVariables(variables);
        return Collections.unmodifiableSortedSet(variables);
    }

    public abstract int depth();

    private static Formula negate(Formula simplified) {
        if (simplified instanceof Constant) {
            return constant(!((Constant) simplified).value);
        }
        if (simplified instanceof Not) {
            return ((Not) simplified).operand;
        }
        return new Not(simplified);
    }

    public enum BinaryType {
        AND("&"),
        OR("|"),
        XOR("^"),
        IMPLICATION("->"),
        EQUIVALENCE("<->");

        private final String symbol;

        BinaryType(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean apply(boolean left, boolean right) {
            switch (this) {
                case AND:
                    return left && right;
                case OR:
                    return left || right;
                case XOR:
                    return left ^ right;
                case IMPLICATION:
                    return !left || right;
                case EQUIVALENCE:
                    return left == right;
                default:
                    throw new IllegalStateException("Unknown type");
            }
        }
    }

    public static final class Constant extends Formula {
        private final boolean value;

        private Constant(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public Formula simplify() {
            return this;
        }

        @Override
        public Formula substitute(String variable, boolean value) {
            return this;
        }

        @Override
        public boolean evaluate(Set<String> trueVariables) {
            return value;
        }

        @Override
        public boolean hasVariable(String name) {
            return false;
        }

        @Override
        void gatherVariables(Set<String> set) {
            // No variables in this leaf
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Constant)) {
                return false;
            }
            return value == ((Constant) object).value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return value ? "TRUE" : "FALSE";
        }
    }

    public static final class Variable extends Formula {
        private final String name;

        private Variable(String name) {
            this.name = Objects.requireNonNull(name);
        }

        public String name() {
            return name;
        }

        @Override
        public Formula simplify() {
            return this;
        }

        @Override
        public Formula substitute(String variable, boolean value) {
            return name.equals(variable) ? constant(value) : this;
        }

        @Override
        public boolean evaluate(Set<String> trueVariables) {
            return trueVariables.contains(name);
        }

        @Override
        public boolean hasVariable(String name) {
            return this.name.equals(name);
        }

        @Override
        void gatherVariables(Set<String> set) {
            set.add(name);
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Variable)) {
                return false;
            }
            return name.equals(((Variable) object).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Not extends Formula {
        private final Formula operand;
        private final int depth;
        private final int hashCode;

        private Not(Formula operand) {
            this.operand = Objects.requireNonNull(operand);
            this.depth = operand.depth() + 1;
            this.hashCode = 31 * operand.hashCode() + 7;
        }

        public Formula operand() {
            return operand;
        }

        @Override
        public Formula simplify() {
            Formula simplified = operand.simplify();
            if (simplified == operand && !(operand instanceof Constant) && !(operand instanceof Not)) {
                return this;
            }
            return negate(simplified);
        }

        @Override
        public Formula substitute(String variable, boolean value) {
            Formula substituted = operand.substitute(variable, value);
            return substituted == operand ? this : new Not(substituted);
        }

        @Override
        public boolean evaluate(Set<String> trueVariables) {
            return !operand.evaluate(trueVariables);
        }

        @Override
        public boolean hasVariable(String name) {
            return operand.hasVariable(name);
        }

        @Override
        void gatherVariables(Set<String> set) {
            operand.gatherVariables(set);
        }

        @Override
        public int depth() {
            return depth;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Not)) {
                return false;
            }
            Not that = (Not) object;
            return hashCode == that.hashCode && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return hashCode;
        }

        @Override
        public String toString() {
            return "!" + operand;
        }
    }

    public static final class Binary extends Formula {
        private final BinaryType type;
        private final Formula left;
        private final Formula right;
        private final int depth;
        private final int hashCode;

        private Binary(BinaryType type, Formula left, Formula right) {
            this.type = Objects.requireNonNull(type);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
            this.depth = Math.max(left.depth(), right.depth()) + 1;
            this.hashCode = (31 * left.hashCode() + right.hashCode()) * 31 + type.hashCode();
        }

        public BinaryType type() {
            return type;
        }

        public Formula left() {
            return left;
        }

        public Formula right() {
            return right;
        }

        @Override
        public Formula simplify() {
            Formula simplifiedLeft = left.simplify();
            Formula simplifiedRight = right.simplify();

            if (simplifiedLeft instanceof Constant && simplifiedRight instanceof Constant) {
                return constant(
                        type.apply(((Constant) simplifiedLeft).value, ((Constant) simplifiedRight).value));
            }
            if (simplifiedLeft instanceof Constant) {
                return foldLeftConstant(((Constant) simplifiedLeft).value, simplifiedRight);
            }
            if (simplifiedRight instanceof Constant) {
                return foldRightConstant(simplifiedLeft, ((Constant) simplifiedRight).value);
            }
            if (simplifiedLeft == left && simplifiedRight == right) {
                return this;
            }
            return new Binary(type, simplifiedLeft, simplifiedRight);
        }

        private Formula foldLeftConstant(boolean constant, Formula other) {
            switch (type) {
                case AND:
                    return constant ? other : FALSE;
                case OR:
                    return constant ? TRUE : other;
                case XOR:
                    return constant ? negate(other) : other;
                case IMPLICATION:
                    return constant ? other : TRUE;
                case EQUIVALENCE:
                    return constant ? other : negate(other);
                default:
                    throw new IllegalStateException("Unknown type");
            }
        }

        private Formula foldRightConstant(Formula other, boolean constant) {
            if (type == BinaryType.IMPLICATION) {
                return constant ? TRUE : negate(other);
            }
            // All remaining operators are symmetric
            return foldLeftConstant(constant, other);
        }

        @Override
        public Formula substitute(String variable, boolean value) {
            Formula substitutedLeft = left.substitute(variable, value);
            Formula substitutedRight = right.substitute(variable, value);
            if (substitutedLeft == left && substitutedRight == right) {
                return this;
            }
            return new Binary(type, substitutedLeft, substitutedRight);
        }

        @Override
        public boolean evaluate(Set<String> trueVariables) {
            return type.apply(left.evaluate(trueVariables), right.evaluate(trueVariables));
        }

        @Override
        public boolean hasVariable(String name) {
            return left.hasVariable(name) || right.hasVariable(name);
        }

        @Override
        void gatherVariables(Set<String> set) {
            left.gatherVariables(set);
            right.gatherVariables(set);
        }

        @Override
        public int depth() {
            return depth;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Binary)) {
                return false;
            }
            Binary that = (Binary) object;
            return hashCode == that.hashCode
                    && type == that.type
                    && left.equals(that.left)
                    && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return hashCode;
        }

        @Override
        public String toString() {
            return "(" + left + " " + type.symbol() + " " + right + ")";
        }
    }
}
