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

import com.google.common.base.Preconditions;
import org.immutables.value.Value;

/**
 * Limits of the evaluation engine. Instances are obtained through the generated
 * {@code ImmutableEngineConfiguration.builder()}.
 */
@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class EngineConfiguration {
    public static final int MAX_VARIABLES = 20;
    public static final int MAX_VARIABLE_NAME_LENGTH = 50;

    // Row indices are ints
    static final int VARIABLE_LIMIT = 30;

    /**
     * The maximal number of distinct variables of a single expression. Every operation enumerates
     * {@code 2^n} rows, so this bounds the cost of all operations.
     */
    @Value.Default
    public int maxVariables() {
        return MAX_VARIABLES;
    }

    /**
     * The maximal length of a variable name, counted in code points.
     */
    @Value.Default
    public int maxVariableNameLength() {
        return MAX_VARIABLE_NAME_LENGTH;
    }

    @Value.Check
    protected void check() {
        Preconditions.checkState(0 <= maxVariables() && maxVariables() <= VARIABLE_LIMIT,
                "maxVariables must be between 0 and %s, got %s", VARIABLE_LIMIT, maxVariables());
        Preconditions.checkState(maxVariableNameLength() >= 1,
                "maxVariableNameLength must be positive, got %s", maxVariableNameLength());
    }
}
