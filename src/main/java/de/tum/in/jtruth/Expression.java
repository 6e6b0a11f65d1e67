/*
 * This file is part of JTruth.
 * Copyright (C) 2023 (See AUTHORS)
 *
 * JTruth is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JTruth is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JTruth. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jtruth;

import java.util.Objects;

/**
 * Immutable syntax tree of a propositional formula.
 *
 * <p>A tree is built from {@link Identifier} leaves, {@link Not} nodes and {@link Binary} nodes
 * carrying one of the {@link BinaryType binary connectives}. There is no constant node kind; the
 * constant functions are encoded by {@link #tautology()} and {@link #contradiction()}.</p>
 *
 * <p>{@link #equals(Object)} is ordered structural equality, i.e. {@code a & b} and {@code b & a}
 * are different trees.</p>
 */
public abstract class Expression {
    static final String TRUE_LITERAL = "true";
    static final String FALSE_LITERAL = "false";

    Expression() {}

    public static Expression identifier(String name) {
        return new Identifier(name);
    }

    public static Expression not(Expression operand) {
        return new Not(operand);
    }

    public static Expression and(Expression left, Expression right) {
        return new Binary(BinaryType.AND, left, right);
    }

    public static Expression or(Expression left, Expression right) {
        return new Binary(BinaryType.OR, left, right);
    }

    public static Expression xor(Expression left, Expression right) {
        return new Binary(BinaryType.XOR, left, right);
    }

    public static Expression implication(Expression left, Expression right) {
        return new Binary(BinaryType.IMPLICATION, left, right);
    }

    /**
     * The canonical always-true tree {@code (true ∨ ¬true)}. Note that {@code true} is an ordinary
     * identifier here, the tree is constant because it is a disjunction of a variable and its
     * negation.
     */
    public static Expression tautology() {
        Expression literal = identifier(TRUE_LITERAL);
        return or(literal, not(literal));
    }

    /**
     * The canonical always-false tree {@code (false ∧ ¬false)}.
     *
     * @see #tautology()
     */
    public static Expression contradiction() {
        Expression literal = identifier(FALSE_LITERAL);
        return and(literal, not(literal));
    }

    /**
     * Evaluates this tree under the given assignment. Variables not mentioned by the assignment are
     * read as {@code false}.
     */
    public abstract boolean evaluate(Assignment assignment);

    public static final class Identifier extends Expression {
        private final String name;

        Identifier(String name) {
            this.name = Objects.requireNonNull(name);
        }

        public String name() {
            return name;
        }

        @Override
        public boolean evaluate(Assignment assignment) {
            return assignment.get(name);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Identifier)) {
                return false;
            }
            return name.equals(((Identifier) object).name);
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

    public static final class Not extends Expression {
        private final Expression operand;

        Not(Expression operand) {
            this.operand = Objects.requireNonNull(operand);
        }

        public Expression operand() {
            return operand;
        }

        @Override
        public boolean evaluate(Assignment assignment) {
            return !operand.evaluate(assignment);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Not)) {
                return false;
            }
            return operand.equals(((Not) object).operand);
        }

        @Override
        public int hashCode() {
            return 31 * operand.hashCode() + 1;
        }

        @Override
        public String toString() {
            return "¬" + operand;
        }
    }

    public static final class Binary extends Expression {
        private final BinaryType type;
        private final Expression left;
        private final Expression right;

        Binary(BinaryType type, Expression left, Expression right) {
            this.type = Objects.requireNonNull(type);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        public BinaryType type() {
            return type;
        }

        public Expression left() {
            return left;
        }

        public Expression right() {
            return right;
        }

        @Override
        public boolean evaluate(Assignment assignment) {
            // Both sides are always evaluated
            boolean leftValue = left.evaluate(assignment);
            boolean rightValue = right.evaluate(assignment);
            return type.apply(leftValue, rightValue);
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
            return type == that.type && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, left, right);
        }

        @Override
        public String toString() {
            return "(" + left + " " + type.symbol() + " " + right + ")";
        }
    }

    public enum BinaryType {
        AND("∧", true),
        OR("∨", true),
        XOR("⊕", true),
        IMPLICATION("→", false);

        private final String symbol;
        private final boolean commutative;

        BinaryType(String symbol, boolean commutative) {
            this.symbol = symbol;
            this.commutative = commutative;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isCommutative() {
            return commutative;
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
                default:
                    throw new IllegalStateException("Unknown type");
            }
        }
    }
}
