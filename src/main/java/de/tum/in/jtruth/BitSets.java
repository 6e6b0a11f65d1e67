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

final class BitSets {
    private BitSets() {}

    @SuppressWarnings("UseOfClone")
    static BitSet copyOf(BitSet set) {
        return (BitSet) set.clone();
    }

    /**
     * Returns the valuation of enumeration row {@code row}: bit {@code p} of the row index is the
     * value of the variable at position {@code p}.
     */
    static BitSet ofRow(int row) {
        assert row >= 0;
        return BitSet.valueOf(new long[] {row});
    }

    static int intersectionSize(BitSet set, BitSet other) {
        if (!set.intersects(other)) {
            return 0;
        }
        BitSet copy = copyOf(set);
        copy.and(other);
        return copy.cardinality();
    }
}
