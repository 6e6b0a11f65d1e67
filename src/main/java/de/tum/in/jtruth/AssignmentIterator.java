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

import java.util.BitSet;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Enumerates the assignments of a set of variables by binary counting, position {@code 0} being
 * the least significant bit. The {@code i}-th returned element equals {@link
 * Variables#assignment(int) variables.assignment(i)}.
 */
final class AssignmentIterator implements Iterator<Assignment> {
    private final Variables variables;
    private final BitSet valuation;
    private final int rowCount;
    private int row = 0;

    AssignmentIterator(Variables variables) {
        this.variables = variables;
        this.valuation = new BitSet(variables.size());
        this.rowCount = variables.rowCount();
    }

    @Override
    public boolean hasNext() {
        return row < rowCount;
    }

    @Override
    public Assignment next() {
        if (row == rowCount) {
            throw new NoSuchElementException("No next element");
        }

        if (row > 0) {
            for (int position = 0; position < variables.size(); position++) {
                if (valuation.get(position)) {
                    valuation.clear(position);
                } else {
                    valuation.set(position);
                    break;
                }
            }
        }
        row += 1;

        return new Assignment(variables, BitSets.copyOf(valuation));
    }
}
