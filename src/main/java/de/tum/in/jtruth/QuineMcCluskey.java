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
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Two-level minimization of a single expression.
 *
 * <p>The ON-set is computed with the canonical enumeration order of {@link Variables}, so minterm
 * {@code i} is the {@code i}-th row of the truth table and literal position {@code p} refers to the
 * variable at position {@code p}.</p>
 */
final class QuineMcCluskey {
    private static final Logger logger = Logger.getLogger(QuineMcCluskey.class.getName());

    private final Variables variables;
    private final BitSet onSet;

    private QuineMcCluskey(Variables variables, BitSet onSet) {
        this.variables = variables;
        this.onSet = onSet;
    }

    static QuineMcCluskey of(Expression expression, Variables variables) {
        BitSet onSet = new BitSet(variables.rowCount());
        Iterator<Assignment> assignments = variables.assignments();
        int row = 0;
        while (assignments.hasNext()) {
            if (expression.evaluate(assignments.next())) {
                onSet.set(row);
            }
            row += 1;
        }
        return new QuineMcCluskey(variables, onSet);
    }

    BitSet onSet() {
        return BitSets.copyOf(onSet);
    }

    /**
     * Computes a sum-of-products form of the expression. An empty ON-set yields {@link
     * Expression#contradiction()}; without variables there is nothing to minimize and the result is
     * empty.
     */
    Optional<Expression> minimize() {
        if (onSet.isEmpty()) {
            return Optional.of(Expression.contradiction());
        }
        if (variables.isEmpty()) {
            return Optional.empty();
        }

        List<Implicant> seeds = new ArrayList<>(onSet.cardinality());
        for (int minterm = onSet.nextSetBit(0); minterm >= 0; minterm = onSet.nextSetBit(minterm + 1)) {
            seeds.add(Implicant.ofMinterm(minterm, variables.size()));
        }
        List<Implicant> primes = PrimeImplicantGenerator.generate(seeds);
        List<Implicant> cover = CoverSelector.select(primes, onSet);

        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "{0} minterms over {1} variables: {2} prime implicants, {3} selected",
                    new Object[] {seeds.size(), variables.size(), primes.size(), cover.size()});
        }
        return Optional.of(reconstruct(cover));
    }

    /**
     * Builds the disjunction of the given implicants in the given order, each implicant being the
     * conjunction of its literals in position order. Both are nested to the left.
     */
    Expression reconstruct(List<Implicant> implicants) {
        assert !implicants.isEmpty();
        Expression result = null;
        for (Implicant implicant : implicants) {
            Expression term = term(implicant);
            if (term == null) {
                // No literals, the function is constant true
                return Expression.tautology();
            }
            result = result == null ? term : Expression.or(result, term);
        }
        return result;
    }

    @Nullable
    private Expression term(Implicant implicant) {
        Expression term = null;
        for (int position = 0; position < implicant.length(); position++) {
            Expression literal;
            switch (implicant.literal(position)) {
                case TRUE:
                    literal = Expression.identifier(variables.name(position));
                    break;
                case FALSE:
                    literal = Expression.not(Expression.identifier(variables.name(position)));
                    break;
                default:
                    continue;
            }
            term = term == null ? literal : Expression.and(term, literal);
        }
        return term;
    }
}
