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

import java.util.HashSet;
import java.util.Set;

/**
 * Collects and validates the variables of an expression.
 *
 * <p>The tree is traversed in pre-order. Each identifier is validated before it is added and the
 * count limit is checked right after each addition, so collection stops at the first offending
 * identifier and the remainder of the tree is never visited.</p>
 */
final class VariableCollector {
    private final int maxVariables;
    private final int maxNameLength;

    VariableCollector(EngineConfiguration configuration) {
        this.maxVariables = configuration.maxVariables();
        this.maxNameLength = configuration.maxVariableNameLength();
    }

    Variables collect(Expression expression) throws EvaluationException {
        Set<String> names = new HashSet<>();
        collectRecursive(expression, names);
        return Variables.of(names);
    }

    private void collectRecursive(Expression expression, Set<String> names) throws EvaluationException {
        if (expression instanceof Expression.Identifier) {
            String name = ((Expression.Identifier) expression).name();
            if (!isValidName(name)) {
                throw new EvaluationException.InvalidVariableName(name, maxNameLength);
            }
            if (names.add(name) && names.size() > maxVariables) {
                throw new EvaluationException.TooManyVariables(names.size(), maxVariables);
            }
        } else if (expression instanceof Expression.Not) {
            collectRecursive(((Expression.Not) expression).operand(), names);
        } else if (expression instanceof Expression.Binary) {
            Expression.Binary binary = (Expression.Binary) expression;
            collectRecursive(binary.left(), names);
            collectRecursive(binary.right(), names);
        } else {
            throw new IllegalArgumentException(
                    "Unknown type " + expression.getClass().getSimpleName());
        }
    }

    /**
     * Joins two collected variable sets, applying the count limit to the result.
     */
    Variables union(Variables left, Variables right) throws EvaluationException {
        Variables union = left.union(right);
        if (union.size() > maxVariables) {
            throw new EvaluationException.TooManyVariables(union.size(), maxVariables);
        }
        return union;
    }

    boolean isValidName(String name) {
        if (name.isEmpty() || name.codePointCount(0, name.length()) > maxNameLength) {
            return false;
        }
        return name.codePoints().allMatch(VariableCollector::isNameCharacter);
    }

    /**
     * Underscores, alphabetic code points and all numeric code points, including letter numbers
     * like {@code Ⅻ} and other numbers like {@code ²}.
     */
    static boolean isNameCharacter(int codePoint) {
        if (codePoint == '_' || Character.isAlphabetic(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.DECIMAL_DIGIT_NUMBER
                || type == Character.LETTER_NUMBER
                || type == Character.OTHER_NUMBER;
    }
}
