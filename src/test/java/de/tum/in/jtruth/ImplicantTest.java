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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

import de.tum.in.jtruth.Implicant.Literal;
import java.util.BitSet;
import org.junit.jupiter.api.Test;

public class ImplicantTest {
    @Test
    public void testMinterm() {
        // 6 = 0b110, position 0 is the lowest bit
        Implicant implicant = Implicant.ofMinterm(6, 3);
        assertThat(implicant.literal(0), is(Literal.FALSE));
        assertThat(implicant.literal(1), is(Literal.TRUE));
        assertThat(implicant.literal(2), is(Literal.TRUE));
        assertThat(implicant.positiveLiteralCount(), is(2));
        assertThat(implicant.literalCount(), is(3));
        assertThat(implicant.covers(6), is(true));
        assertThat(implicant.covers(7), is(false));
        assertThat(implicant.toString(), is("011"));
    }

    @Test
    public void testCombineAdjacent() {
        Implicant combined = Implicant.ofMinterm(4, 3).combine(Implicant.ofMinterm(6, 3));
        assertThat(combined, notNullValue());
        assertThat(combined.toString(), is("0-1"));
        assertThat(combined.literal(1), is(Literal.DONT_CARE));
        assertThat(combined.literalCount(), is(2));
        assertThat(combined.positiveLiteralCount(), is(1));
        assertThat(combined.coveredMinterms(), is(BitSet.valueOf(new long[] {0b1010000})));
    }

    @Test
    public void testCombineRequiresSingleDifference() {
        assertThat(Implicant.ofMinterm(1, 3).combine(Implicant.ofMinterm(2, 3)), nullValue());
        assertThat(Implicant.ofMinterm(5, 3).combine(Implicant.ofMinterm(5, 3)), nullValue());
        assertThat(Implicant.ofMinterm(1, 3).combine(Implicant.ofMinterm(1, 4)), nullValue());
    }

    @Test
    public void testCombineRequiresMatchingDontCares() {
        Implicant first = Implicant.ofMinterm(0, 3).combine(Implicant.ofMinterm(1, 3));
        Implicant second = Implicant.ofMinterm(2, 3).combine(Implicant.ofMinterm(6, 3));
        Implicant third = Implicant.ofMinterm(2, 3).combine(Implicant.ofMinterm(3, 3));
        assertThat(first.toString(), is("-00"));
        assertThat(second.toString(), is("01-"));
        assertThat(third.toString(), is("-10"));

        assertThat(first.combine(second), nullValue());
        Implicant quad = first.combine(third);
        assertThat(quad, notNullValue());
        assertThat(quad.toString(), is("--0"));
        assertThat(quad.coveredMinterms().cardinality(), is(4));
    }

    @Test
    public void testEqualityByLiterals() {
        Implicant viaOne = Implicant.ofMinterm(0, 2).combine(Implicant.ofMinterm(1, 2));
        Implicant viaOther = Implicant.ofMinterm(1, 2).combine(Implicant.ofMinterm(0, 2));
        assertThat(viaOne, is(viaOther));
        assertThat(viaOne.hashCode(), is(viaOther.hashCode()));
    }

    @Test
    public void testCoverCount() {
        Implicant implicant = Implicant.ofMinterm(0, 2).combine(Implicant.ofMinterm(2, 2));
        BitSet minterms = new BitSet();
        minterms.set(2);
        minterms.set(3);
        assertThat(implicant.coverCount(minterms), is(1));
        minterms.clear(2);
        assertThat(implicant.coverCount(minterms), is(0));
    }
}
