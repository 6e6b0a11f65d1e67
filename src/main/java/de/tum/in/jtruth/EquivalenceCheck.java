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

import java.util.List;
import org.immutables.value.Value;

/**
 * The outcome of comparing two expressions over the union of their variables.
 */
@Value.Immutable
public abstract class EquivalenceCheck {
    /**
     * The sorted union of the variables of both sides, over which the comparison was enumerated.
     */
    public abstract Variables variables();

    /**
     * All assignments on which the two sides disagree, in enumeration order.
     */
    public abstract List<EquivalenceDifference> differences();

    @Value.Derived
    public boolean equivalent() {
        return differences().isEmpty();
    }
}
