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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Second phase of Quine-McCluskey: choosing prime implicants which together cover the ON-set.
 *
 * <p>Essential implicants are selected first; this part is exact. The remaining minterms are
 * covered greedily by repeatedly taking the candidate covering the most uncovered minterms, the
 * earliest candidate winning ties. Since minimum set cover is NP-hard, the greedy part is an
 * approximation and the result is not guaranteed to be a smallest cover.</p>
 */
final class CoverSelector {
    private CoverSelector() {}

    /**
     * Selects a cover of {@code minterms} from the given implicants.
     *
     * @param primes The candidate implicants, in generation order.
     * @param minterms The minterms to be covered, each of which is covered by some candidate.
     * @return The selected implicants in selection order.
     */
    static List<Implicant> select(List<Implicant> primes, BitSet minterms) {
        BitSet uncovered = BitSets.copyOf(minterms);
        List<Implicant> candidates = new ArrayList<>(primes);
        List<Implicant> selected = new ArrayList<>();

        boolean found = true;
        while (found && !uncovered.isEmpty()) {
            found = false;
            for (int minterm = uncovered.nextSetBit(0); minterm >= 0; minterm = uncovered.nextSetBit(minterm + 1)) {
                Implicant essential = soleCandidate(candidates, minterm);
                if (essential != null) {
                    selected.add(essential);
                    uncovered.andNot(essential.coveredMinterms());
                    candidates.remove(essential);
                    found = true;
                }
            }
        }

        while (!uncovered.isEmpty() && !candidates.isEmpty()) {
            int bestIndex = 0;
            int bestCount = candidates.get(0).coverCount(uncovered);
            for (int i = 1; i < candidates.size(); i++) {
                int count = candidates.get(i).coverCount(uncovered);
                if (count > bestCount) {
                    bestIndex = i;
                    bestCount = count;
                }
            }
            Implicant best = candidates.remove(bestIndex);
            selected.add(best);
            uncovered.andNot(best.coveredMinterms());
        }

        assert uncovered.isEmpty() : "Candidates do not cover " + uncovered;
        return selected;
    }

    @Nullable
    private static Implicant soleCandidate(List<Implicant> candidates, int minterm) {
        Implicant candidate = null;
        for (Implicant implicant : candidates) {
            if (implicant.covers(minterm)) {
                if (candidate != null) {
                    return null;
                }
                candidate = implicant;
            }
        }
        return candidate;
    }
}
