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

import org.immutables.value.Value;

/**
 * The result of simplifying an expression.
 *
 * <p>{@link #simplified()} is a structural statement: it is {@code true} iff the reduced tree
 * differs from the original, where the operands of commutative connectives may appear in either
 * order. It does not state that the reduced tree is smaller, nor that it is minimal.</p>
 */
@Value.Immutable
public abstract class Reduction {
    @Value.Parameter
    public abstract Expression original();

    @Value.Parameter
    public abstract Expression reduced();

    @Value.Parameter
    public abstract boolean simplified();
}
