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

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class DiagramConfiguration {
    public static final int DEFAULT_CACHE_COMBINE_DIVIDER = 4;
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final double DEFAULT_NODE_TABLE_GROWTH_FACTOR = 1.5d;

    @Value.Default
    public int cacheCombineDivider() {
        return DEFAULT_CACHE_COMBINE_DIVIDER;
    }

    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_NODE_TABLE_GROWTH_FACTOR;
    }

    /**
     * Whether {@link FaultTreeDiagram#combine(int, int, Gate)} uses an explicit stack instead of
     * recursion. Needed for very deep diagrams.
     */
    @Value.Default
    public boolean iterative() {
        return false;
    }

    @Value.Default
    public boolean logStatistics() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(cacheCombineDivider() > 0, "Cache divider must be positive, got %d", cacheCombineDivider());
        Util.checkArgument(initialSize() > 0, "Initial size must be positive, got %d", initialSize());
        Util.checkArgument(growthFactor() > 1.0, "Growth factor must be larger than 1, got %f", growthFactor());
    }
}
