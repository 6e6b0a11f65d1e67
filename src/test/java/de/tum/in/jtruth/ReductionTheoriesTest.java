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
import static org.hamcrest.Matchers.*;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks invariants of truth tables, equivalence and reduction on random expressions.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class ReductionTheoriesTest {
    private static final int seed = 42;
    private static final int variableCount = 5;
    private static final int treeDepth = 5;
    private static final int expressionCount = 150;

    private final Evaluator evaluator = Evaluator.create();

    private static Stream<Expression> expressions() {
        return ExpressionGenerator.generate(seed, variableCount, treeDepth, expressionCount).stream();
    }

    private static boolean isSentinel(Expression expression) {
        return expression.equals(Expression.tautology()) || expression.equals(Expression.contradiction());
    }

    private static boolean isLiteral(Expression expression) {
        return expression instanceof Expression.Identifier
                || (expression instanceof Expression.Not
                        && ((Expression.Not) expression).operand() instanceof Expression.Identifier);
    }

    private static boolean isProduct(Expression expression) {
        if (expression instanceof Expression.Binary
                && ((Expression.Binary) expression).type() == Expression.BinaryType.AND) {
            Expression.Binary binary = (Expression.Binary) expression;
            return isProduct(binary.left()) && isLiteral(binary.right());
        }
        return isLiteral(expression);
    }

    private static boolean isSumOfProducts(Expression expression) {
        if (expression instanceof Expression.Binary
                && ((Expression.Binary) expression).type() == Expression.BinaryType.OR) {
            Expression.Binary binary = (Expression.Binary) expression;
            return isSumOfProducts(binary.left()) && isProduct(binary.right());
        }
        return isProduct(expression);
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testTruthTableMatchesEvaluation(Expression expression) throws EvaluationException {
        TruthTable table = evaluator.truthTable(expression);
        Variables variables = table.variables();
        assertThat(table.rows(), hasSize(1 << variables.size()));
        for (int row = 0; row < table.rows().size(); row++) {
            TruthTableRow tableRow = table.rows().get(row);
            assertThat(tableRow.assignment(), is(variables.assignment(row)));
            assertThat(tableRow.result(), is(expression.evaluate(tableRow.assignment())));
        }
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testSelfEquivalence(Expression expression) throws EvaluationException {
        EquivalenceCheck check = evaluator.equivalence(expression, expression);
        assertThat(check.equivalent(), is(true));
        assertThat(check.differences(), empty());
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testNegationDiffersEverywhere(Expression expression) throws EvaluationException {
        EquivalenceCheck check = evaluator.equivalence(expression, Expression.not(expression));
        assertThat(check.equivalent(), is(false));
        assertThat(check.differences(), hasSize(check.variables().rowCount()));
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testReductionPreservesSemantics(Expression expression) throws EvaluationException {
        Reduction reduction = evaluator.reduce(expression);
        assertThat(reduction.original(), is(expression));
        EquivalenceCheck check = evaluator.equivalence(expression, reduction.reduced());
        assertThat(check.differences(), empty());
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testReductionShape(Expression expression) throws EvaluationException {
        Reduction reduction = evaluator.reduce(expression);
        Expression reduced = reduction.reduced();
        if (isSentinel(reduced)) {
            assertThat(reduction.simplified(), is(true));
            return;
        }
        assertThat(isSumOfProducts(reduced), is(true));

        List<String> originalNames = evaluator.variables(expression).names();
        assertThat(originalNames, hasItems(evaluator.variables(reduced).names().toArray(new String[0])));
        if (!reduction.simplified()) {
            assertThat(ExpressionReducer.isStructurallyEqual(expression, reduced), is(true));
        }
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testReductionIsDeterministic(Expression expression) throws EvaluationException {
        Reduction first = evaluator.reduce(expression);
        Reduction second = evaluator.reduce(expression);
        assertThat(second, is(first));
        assertThat(second.reduced().toString(), is(first.reduced().toString()));
    }
}
