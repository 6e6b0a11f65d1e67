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

final class TruthTables {
    private TruthTables() {}

    static TruthTable build(Expression expression, Variables variables) {
        ImmutableTruthTable.Builder builder = ImmutableTruthTable.builder().variables(variables);
        Iterator<Assignment> assignments = variables.assignments();
        while (assignments.hasNext()) {
            Assignment assignment = assignments.next();
            builder.addRows(ImmutableTruthTableRow.of(assignment, expression.evaluate(assignment)));
        }
        return builder.build();
    }

    /**
     * Determines whether the expression evaluates to {@code value} on every row. Returns {@code
     * false} if there are no variables.
     */
    static boolean isConstant(Expression expression, Variables variables, boolean value) {
        if (variables.isEmpty()) {
            return false;
        }
        Iterator<Assignment> assignments = variables.assignments();
        while (assignments.hasNext()) {
            if (expression.evaluate(assignments.next()) != value) {
                return false;
            }
        }
        return true;
    }
}
