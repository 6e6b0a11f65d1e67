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

import java.util.Optional;

final class ExpressionReducer {
    private ExpressionReducer() {}

    static Reduction reduce(Expression expression, Variables variables) {
        if (TruthTables.isConstant(expression, variables, true)) {
            return ImmutableReduction.of(expression, Expression.tautology(), true);
        }
        if (TruthTables.isConstant(expression, variables, false)) {
            return ImmutableReduction.of(expression, Expression.contradiction(), true);
        }

        Optional<Expression> minimized = QuineMcCluskey.of(expression, variables).minimize();
        if (minimized.isEmpty()) {
            return ImmutableReduction.of(expression, expression, false);
        }
        Expression reduced = minimized.get();
        return ImmutableReduction.of(expression, reduced, !isStructurallyEqual(expression, reduced));
    }

    /**
     * Structural comparison where the operands of commutative connectives may be swapped. This is
     * not a logical equivalence check: {@code a & (b & c)} and {@code (a & b) & c} are different.
     */
    static boolean isStructurallyEqual(Expression left, Expression right) {
        if (left instanceof Expression.Identifier && right instanceof Expression.Identifier) {
            return left.equals(right);
        }
        if (left instanceof Expression.Not && right instanceof Expression.Not) {
            return isStructurallyEqual(((Expression.Not) left).operand(), ((Expression.Not) right).operand());
        }
        if (left instanceof Expression.Binary && right instanceof Expression.Binary) {
            Expression.Binary leftBinary = (Expression.Binary) left;
            Expression.Binary rightBinary = (Expression.Binary) right;
            if (leftBinary.type() != rightBinary.type()) {
                return false;
            }
            if (isStructurallyEqual(leftBinary.left(), rightBinary.left())
                    && isStructurallyEqual(leftBinary.right(), rightBinary.right())) {
                return true;
            }
            return leftBinary.type().isCommutative()
                    && isStructurallyEqual(leftBinary.left(), rightBinary.right())
                    && isStructurallyEqual(leftBinary.right(), rightBinary.left());
        }
        return false;
    }
}
