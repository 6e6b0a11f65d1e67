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

/**
 * Signals that an expression cannot be evaluated with the configured limits. Raised only while
 * collecting the variables of an expression, i.e. before any enumeration takes place.
 */
public abstract class EvaluationException extends Exception {
    private static final long serialVersionUID = 1L;

    EvaluationException(String message) {
        super(message);
    }

    public static final class InvalidVariableName extends EvaluationException {
        private static final long serialVersionUID = 1L;

        private final String name;
        private final int maxLength;

        public InvalidVariableName(String name, int maxLength) {
            super(String.format("Invalid variable name '%s'. Variable names must be non-empty, "
                    + "alphanumeric (with underscores), and at most %d characters long.", name, maxLength));
            this.name = name;
            this.maxLength = maxLength;
        }

        public String name() {
            return name;
        }

        public int maxLength() {
            return maxLength;
        }
    }

    public static final class TooManyVariables extends EvaluationException {
        private static final long serialVersionUID = 1L;

        private final int count;
        private final int max;

        public TooManyVariables(int count, int max) {
            super(String.format("Expression has too many variables (%d > %d). "
                    + "Consider simplifying the expression.", count, max));
            this.count = count;
            this.max = max;
        }

        public int count() {
            return count;
        }

        public int max() {
            return max;
        }
    }
}
