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
import java.util.List;
import org.immutables.value.Value;

/**
 * The truth table of an expression: one row per assignment of its variables, in enumeration order
 * (see {@link Variables}).
 */
@Value.Immutable
public abstract class TruthTable {
    public abstract Variables variables();

    public abstract List<TruthTableRow> rows();

    public boolean result(int row) {
        return rows().get(row).result();
    }

    @Value.Check
    protected void check() {
        Preconditions.checkState(rows().size() == variables().rowCount(),
                "Expected %s rows for %s variables, got %s",
                variables().rowCount(), variables().size(), rows().size());
    }
}
