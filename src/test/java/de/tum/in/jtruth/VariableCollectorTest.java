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

import static de.tum.in.jtruth.Expression.and;
import static de.tum.in.jtruth.Expression.identifier;
import static de.tum.in.jtruth.Expression.or;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class VariableCollectorTest {
    private final Evaluator evaluator = Evaluator.create();

    static Expression disjunction(int count) {
        return disjunction("v", count);
    }

    static Expression disjunction(String prefix, int count) {
        Expression expression = identifier(String.format("%s%02d", prefix, 0));
        for (int i = 1; i < count; i++) {
            expression = or(expression, identifier(String.format("%s%02d", prefix, i)));
        }
        return expression;
    }

    @Test
    public void testSortedAndDistinct() throws EvaluationException {
        Variables variables = evaluator.variables(
                or(and(identifier("c"), identifier("a")), and(identifier("b"), identifier("a"))));
        assertThat(variables.names(), contains("a", "b", "c"));
        assertThat(variables.position("a"), is(0));
        assertThat(variables.position("c"), is(2));
        assertThat(variables.position("d"), is(-1));
        assertThat(variables.rowCount(), is(8));
    }

    @Test
    public void testMaximumVariables() throws EvaluationException {
        assertThat(evaluator.variables(disjunction(20)).size(), is(20));

        EvaluationException.TooManyVariables exception = assertThrows(
                EvaluationException.TooManyVariables.class, () -> evaluator.variables(disjunction(21)));
        assertThat(exception.count(), is(21));
        assertThat(exception.max(), is(20));
    }

    @Test
    public void testRepeatedNamesDoNotCount() throws EvaluationException {
        Expression expression = disjunction(20);
        for (int i = 0; i < 20; i++) {
            expression = and(expression, identifier(String.format("v%02d", i)));
        }
        assertThat(evaluator.variables(expression).size(), is(20));
    }

    @Test
    public void testCountCheckStopsTraversal() {
        // The invalid name is never reached
        Expression expression = or(disjunction(21), identifier("a-b"));
        assertThrows(EvaluationException.TooManyVariables.class, () -> evaluator.variables(expression));

        Expression invalidFirst = or(identifier("a-b"), disjunction(21));
        assertThrows(EvaluationException.InvalidVariableName.class, () -> evaluator.variables(invalidFirst));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a-b", "", "a b", "a.b", "x!"})
    public void testInvalidNames(String name) {
        EvaluationException.InvalidVariableName exception = assertThrows(
                EvaluationException.InvalidVariableName.class,
                () -> evaluator.variables(and(identifier("ok"), identifier(name))));
        assertThat(exception.name(), is(name));
    }

    @Test
    public void testNameLength() throws EvaluationException {
        String longest = "a".repeat(50);
        assertThat(evaluator.variables(identifier(longest)).names(), contains(longest));
        assertThrows(EvaluationException.InvalidVariableName.class,
                () -> evaluator.variables(identifier("a".repeat(51))));
    }

    @Test
    public void testValidNames() throws EvaluationException {
        Variables variables = evaluator.variables(
                or(identifier("x_1"), or(identifier("_"), or(identifier("42"), identifier("ä")))));
        assertThat(variables.names(), contains("42", "_", "x_1", "ä"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"x²", "Ⅻ", "𝑥", "x₁", "٣"})
    public void testUnicodeNames(String name) throws EvaluationException {
        assertThat(evaluator.variables(identifier(name)).names(), contains(name));
    }

    @Test
    public void testSupplementaryNameLength() throws EvaluationException {
        String longest = "𝑥".repeat(50);
        assertThat(evaluator.variables(identifier(longest)).size(), is(1));
        assertThrows(EvaluationException.InvalidVariableName.class,
                () -> evaluator.variables(identifier("𝑥".repeat(51))));
    }

    @Test
    public void testConfiguredLimits() throws EvaluationException {
        Evaluator restricted = Evaluator.create(ImmutableEngineConfiguration.builder()
                .maxVariables(2)
                .maxVariableNameLength(3)
                .build());
        assertThat(restricted.variables(disjunction(2)).size(), is(2));

        EvaluationException.TooManyVariables tooMany = assertThrows(
                EvaluationException.TooManyVariables.class, () -> restricted.variables(disjunction(3)));
        assertThat(tooMany.count(), is(3));
        assertThat(tooMany.max(), is(2));

        EvaluationException.InvalidVariableName invalid = assertThrows(
                EvaluationException.InvalidVariableName.class, () -> restricted.variables(identifier("abcd")));
        assertThat(invalid.maxLength(), is(3));
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalStateException.class,
                () -> ImmutableEngineConfiguration.builder().maxVariables(31).build());
        assertThrows(IllegalStateException.class,
                () -> ImmutableEngineConfiguration.builder().maxVariableNameLength(0).build());
    }

    @Test
    public void testUnion() throws EvaluationException {
        Variables left = evaluator.variables(and(identifier("b"), identifier("d")));
        Variables right = evaluator.variables(and(identifier("c"), identifier("a")));
        assertThat(left.union(right).names(), is(List.of("a", "b", "c", "d")));
        assertThat(left.union(left), is(left));
    }
}
