/*
 * This file is part of JFTA.
 * Copyright (c) 2023 The JFTA authors.
 *
 * JFTA is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JFTA is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JFTA. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jfta;

import org.immutables.value.Value;

/**
 * One row of a sub-tree page. Depending on its id, a row either describes a base event or refers
 * to another sub-tree.
 */
@Value.Immutable
public abstract class TreeRow {
    public abstract int id();

    @Value.Default
    public double probability() {
        return 0.0d;
    }

    @Value.Default
    public String label() {
        return "";
    }

    @Value.Default
    public String description() {
        return "";
    }

    @Value.Default
    public String guidance() {
        return "";
    }

    public static TreeRow base(int id, double probability, String label) {
        return ImmutableTreeRow.builder().id(id).probability(probability).label(label).build();
    }

    public static TreeRow reference(int subTreeId) {
        return ImmutableTreeRow.builder().id(subTreeId).build();
    }
}
