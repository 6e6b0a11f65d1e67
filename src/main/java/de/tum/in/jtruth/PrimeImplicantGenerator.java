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
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * First phase of Quine-McCluskey: iterated combination of adjacent implicants.
 *
 * <p>Each round partitions the current implicants by their number of positive literals and
 * combines every pair from neighbouring groups which differs in exactly one literal. Implicants
 * which took part in no combination are prime. Every combination adds a don't-care position, so
 * there are at most {@code n + 1} rounds.</p>
 */
final class PrimeImplicantGenerator {
    private static final Logger logger = Logger.getLogger(PrimeImplicantGenerator.class.getName());

    private PrimeImplicantGenerator() {}

    static List<Implicant> generate(Collection<Implicant> seeds) {
        List<Implicant> primes = new ArrayList<>();
        List<Implicant> current = new ArrayList<>(new LinkedHashSet<>(seeds));

        int round = 0;
        while (!current.isEmpty()) {
            boolean[] used = new boolean[current.size()];

            SortedMap<Integer, List<Integer>> groups = new TreeMap<>();
            for (int i = 0; i < current.size(); i++) {
                groups.computeIfAbsent(current.get(i).positiveLiteralCount(), k -> new ArrayList<>()).add(i);
            }

            // Insertion ordered, duplicates are dropped
            Set<Implicant> next = new LinkedHashSet<>();
            for (Map.Entry<Integer, List<Integer>> group : groups.entrySet()) {
                List<Integer> upper = groups.get(group.getKey() + 1);
                if (upper == null) {
                    continue;
                }
                for (int i : group.getValue()) {
                    for (int j : upper) {
                        Implicant combined = current.get(i).combine(current.get(j));
                        if (combined != null) {
                            next.add(combined);
                            used[i] = true;
                            used[j] = true;
                        }
                    }
                }
            }

            int primeCount = primes.size();
            for (int i = 0; i < current.size(); i++) {
                if (!used[i]) {
                    primes.add(current.get(i));
                }
            }

            logger.log(Level.FINEST, "Round {0}: {1} implicants in {2} groups, {3} new primes, {4} combined",
                    new Object[] {round, current.size(), groups.size(), primes.size() - primeCount, next.size()});
            current = new ArrayList<>(next);
            round += 1;
        }
        return primes;
    }
}
