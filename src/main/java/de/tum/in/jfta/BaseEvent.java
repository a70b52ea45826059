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
 * A leaf failure mode of the fault tree. The id doubles as the variable of the diagram, so ids
 * define the variable order.
 */
@Value.Immutable
public abstract class BaseEvent {
    public abstract int id();

    public abstract double probability();

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

    @Value.Check
    protected void check() {
        Util.checkArgument(id() >= 0, "Negative base event id %d", id());
        Util.checkArgument(
                0.0d <= probability() && probability() <= 1.0d,
                "Probability %f of base event %d is not in [0, 1]",
                probability(),
                id());
    }

    public static BaseEvent of(int id, double probability) {
        return ImmutableBaseEvent.builder().id(id).probability(probability).build();
    }
}
