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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * The distinct variables of an expression in their canonical order.
 *
 * <p>Names are sorted by their natural order and the sort position of a variable is its bit
 * position in all enumerations: in row {@code i} the variable at position {@code p} has the value
 * {@code (i >> p) & 1}. Truth tables, equivalence checks and the minimizer all rely on this
 * mapping.</p>
 */
public final class Variables implements Iterable<String> {
    private final ImmutableList<String> names;
    private final ImmutableMap<String, Integer> positions;

    private Variables(ImmutableList<String> names) {
        this.names = names;
        ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builderWithExpectedSize(names.size());
        for (int i = 0; i < names.size(); i++) {
            builder.put(names.get(i), i);
        }
        this.positions = builder.build();
    }

    static Variables of(Collection<String> names) {
        return new Variables(ImmutableSortedSet.copyOf(names).asList());
    }

    public int size() {
        return names.size();
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public String name(int position) {
        return names.get(position);
    }

    /**
     * Returns the bit position of the given variable or {@code -1} if it is not contained.
     */
    public int position(String name) {
        Integer position = positions.get(name);
        return position == null ? -1 : position;
    }

    public boolean contains(String name) {
        return positions.containsKey(name);
    }

    public List<String> names() {
        return names;
    }

    public Variables union(Variables other) {
        if (other.names.equals(names) || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return new Variables(ImmutableSortedSet.<String>naturalOrder()
                .addAll(names)
                .addAll(other.names)
                .build()
                .asList());
    }

    /**
     * Returns the number of enumerated rows, {@code 2^size()}. Note that this is {@code 1} for an
     * empty set of variables.
     */
    public int rowCount() {
        Preconditions.checkState(names.size() <= EngineConfiguration.VARIABLE_LIMIT,
                "Too many variables to enumerate: %s", names.size());
        return 1 << names.size();
    }

    public Assignment assignment(int row) {
        Preconditions.checkElementIndex(row, rowCount(), "row");
        return new Assignment(this, BitSets.ofRow(row));
    }

    /**
     * Iterates all {@link #rowCount()} assignments, row {@code 0} first.
     */
    public Iterator<Assignment> assignments() {
        return new AssignmentIterator(this);
    }

    @Override
    public Iterator<String> iterator() {
        return names.iterator();
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Variables)) {
            return false;
        }
        return names.equals(((Variables) object).names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
