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

import com.google.common.collect.ImmutableSortedMap;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

/**
 * A truth assignment of variable names. Names without a value read as {@code false}.
 */
public final class Assignment {
    private final Variables variables;
    private final BitSet values;

    Assignment(Variables variables, BitSet values) {
        assert values.length() <= variables.size();
        this.variables = variables;
        this.values = values;
    }

    public static Assignment empty() {
        return new Assignment(Variables.of(List.of()), new BitSet());
    }

    public static Assignment of(Map<String, Boolean> values) {
        Variables variables = Variables.of(values.keySet());
        BitSet bits = new BitSet(variables.size());
        values.forEach((name, value) -> {
            if (value) {
                bits.set(variables.position(name));
            }
        });
        return new Assignment(variables, bits);
    }

    public boolean get(String name) {
        int position = variables.position(name);
        return position >= 0 && values.get(position);
    }

    public Variables variables() {
        return variables;
    }

    public Map<String, Boolean> asMap() {
        ImmutableSortedMap.Builder<String, Boolean> builder = ImmutableSortedMap.naturalOrder();
        for (int position = 0; position < variables.size(); position++) {
            builder.put(variables.name(position), values.get(position));
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Assignment)) {
            return false;
        }
        Assignment that = (Assignment) object;
        return variables.equals(that.variables) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return 31 * variables.hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
