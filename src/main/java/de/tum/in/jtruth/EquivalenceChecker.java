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

import java.util.Iterator;

final class EquivalenceChecker {
    private EquivalenceChecker() {}

    /**
     * Compares both expressions on every assignment of {@code variables}, the union of the variables
     * of both sides. A variable missing on one side reads as {@code false} there, which does not
     * change that side's value since it does not occur in it.
     */
    static EquivalenceCheck check(Expression left, Expression right, Variables variables) {
        ImmutableEquivalenceCheck.Builder builder = ImmutableEquivalenceCheck.builder().variables(variables);

        // With no variables this is the single comparison on the empty assignment
        Iterator<Assignment> assignments = variables.assignments();
        while (assignments.hasNext()) {
            Assignment assignment = assignments.next();
            boolean leftValue = left.evaluate(assignment);
            boolean rightValue = right.evaluate(assignment);
            if (leftValue != rightValue) {
                builder.addDifferences(ImmutableEquivalenceDifference.of(assignment, leftValue, rightValue));
            }
        }
        return builder.build();
    }
}
