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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the library: truth tables, equivalence checks and simplification of {@link
 * Expression expressions}.
 *
 * <p>All operations first collect and validate the variables of their arguments and fail with an
 * {@link EvaluationException} if a name is invalid or there are more variables than {@link
 * EngineConfiguration#maxVariables()}. Afterwards they enumerate all {@code 2^n} assignments, so the
 * cost of every operation is exponential in the number of variables. Operations are pure functions
 * of their arguments; instances hold no mutable state and may be shared between threads.</p>
 */
public final class Evaluator {
    private static final Logger logger = Logger.getLogger(Evaluator.class.getName());

    private final EngineConfiguration configuration;
    private final VariableCollector collector;

    private Evaluator(EngineConfiguration configuration) {
        this.configuration = configuration;
        this.collector = new VariableCollector(configuration);
    }

    public static Evaluator create() {
        return create(ImmutableEngineConfiguration.builder().build());
    }

    public static Evaluator create(EngineConfiguration configuration) {
        return new Evaluator(configuration);
    }

    public EngineConfiguration configuration() {
        return configuration;
    }

    /**
     * Collects the validated variables of the given expression.
     *
     * @throws EvaluationException.InvalidVariableName If some identifier is not a valid name.
     * @throws EvaluationException.TooManyVariables If the expression has too many variables.
     */
    public Variables variables(Expression expression) throws EvaluationException {
        return collector.collect(expression);
    }

    /**
     * Computes the truth table of the given expression. The table has {@code 2^n} rows for
     * {@code n} variables, ordered as described in {@link Variables}.
     */
    public TruthTable truthTable(Expression expression) throws EvaluationException {
        Variables variables = collector.collect(expression);
        TruthTable table = TruthTables.build(expression, variables);
        logger.log(Level.FINE, "Built truth table of {0} with {1} rows", new Object[] {expression, table.rows().size()});
        return table;
    }

    /**
     * Checks whether the two expressions are logically equivalent, listing every assignment of the
     * union of their variables on which they differ.
     *
     * @throws EvaluationException.TooManyVariables If either side or the union of both sides has
     *     too many variables.
     */
    public EquivalenceCheck equivalence(Expression left, Expression right) throws EvaluationException {
        Variables leftVariables = collector.collect(left);
        Variables rightVariables = collector.collect(right);
        Variables variables = collector.union(leftVariables, rightVariables);
        EquivalenceCheck check = EquivalenceChecker.check(left, right, variables);
        logger.log(Level.FINE, "Compared {0} and {1}: {2} differences",
                new Object[] {left, right, check.differences().size()});
        return check;
    }

    /**
     * Simplifies the given expression.
     *
     * <p>Tautologies and contradictions are replaced by {@link Expression#tautology()} and {@link
     * Expression#contradiction()}, respectively. Otherwise, the expression is brought into a
     * sum-of-products form by the Quine-McCluskey method. The cover of the prime implicants is
     * partly chosen greedily, hence the result is simplified but not necessarily minimal. The
     * result is always logically equivalent to the input.</p>
     */
    public Reduction reduce(Expression expression) throws EvaluationException {
        Variables variables = collector.collect(expression);
        Reduction reduction = ExpressionReducer.reduce(expression, variables);
        logger.log(Level.FINE, "Reduced {0} to {1} (simplified: {2})",
                new Object[] {expression, reduction.reduced(), reduction.simplified()});
        return reduction;
    }
}
