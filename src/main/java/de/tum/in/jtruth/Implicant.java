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
import javax.annotation.Nullable;

/**
 * A product term over a fixed number of variables, stored as a tri-state literal vector together
 * with the set of minterms it covers.
 *
 * <p>The vector is encoded by two bit sets: {@code care} holds the positions carrying a literal and
 * {@code value} (a subset of {@code care}) the positions whose literal is positive. Two implicants
 * are equal iff their vectors are equal; within one minimization the covered minterms are
 * determined by the vector.</p>
 */
final class Implicant {
    enum Literal {
        TRUE, FALSE, DONT_CARE
    }

    private final int length;
    private final BitSet care;
    private final BitSet value;
    private final BitSet covered;

    private Implicant(int length, BitSet care, BitSet value, BitSet covered) {
        assert care.length() <= length;
        assert BitSets.intersectionSize(value, care) == value.cardinality();
        this.length = length;
        this.care = care;
        this.value = value;
        this.covered = covered;
    }

    /**
     * Returns the fully specified implicant of row {@code minterm}, covering only itself.
     */
    static Implicant ofMinterm(int minterm, int length) {
        assert 0 <= minterm && minterm < (1 << length);
        BitSet care = new BitSet(length);
        care.set(0, length);
        BitSet covered = new BitSet();
        covered.set(minterm);
        return new Implicant(length, care, BitSets.ofRow(minterm), covered);
    }

    int length() {
        return length;
    }

    Literal literal(int position) {
        if (position < 0 || position >= length) {
            throw new IndexOutOfBoundsException("Position " + position + " out of " + length);
        }
        if (!care.get(position)) {
            return Literal.DONT_CARE;
        }
        return value.get(position) ? Literal.TRUE : Literal.FALSE;
    }

    int positiveLiteralCount() {
        return value.cardinality();
    }

    int literalCount() {
        return care.cardinality();
    }

    boolean covers(int minterm) {
        return covered.get(minterm);
    }

    BitSet coveredMinterms() {
        return BitSets.copyOf(covered);
    }

    int coverCount(BitSet minterms) {
        return BitSets.intersectionSize(covered, minterms);
    }

    /**
     * Combines two implicants which differ in exactly one literal, the differing position becoming a
     * don't-care. Returns {@code null} if the implicants are not adjacent, i.e. if their lengths or
     * don't-care positions differ or they disagree on zero or more than one literal.
     */
    @Nullable
    Implicant combine(Implicant other) {
        if (length != other.length || !care.equals(other.care)) {
            return null;
        }
        BitSet difference = BitSets.copyOf(value);
        difference.xor(other.value);
        if (difference.cardinality() != 1) {
            return null;
        }

        BitSet combinedCare = BitSets.copyOf(care);
        combinedCare.andNot(difference);
        BitSet combinedValue = BitSets.copyOf(value);
        combinedValue.andNot(difference);
        BitSet combinedCovered = BitSets.copyOf(covered);
        combinedCovered.or(other.covered);
        return new Implicant(length, combinedCare, combinedValue, combinedCovered);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Implicant)) {
            return false;
        }
        Implicant that = (Implicant) object;
        return length == that.length && care.equals(that.care) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * length + care.hashCode()) + value.hashCode();
    }

    /**
     * Renders the vector position {@code 0} first, e.g. {@code 1-0} for {@code x0 & !x2}.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(length);
        for (int position = 0; position < length; position++) {
            switch (literal(position)) {
                case TRUE:
                    builder.append('1');
                    break;
                case FALSE:
                    builder.append('0');
                    break;
                default:
                    builder.append('-');
            }
        }
        return builder.toString();
    }
}
