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

import java.util.List;
import org.immutables.value.Value;

/**
 * The input describing one sub-tree: its parameters and its member rows.
 */
@Value.Immutable
public abstract class SubTreePage {
    public abstract int id();

    public abstract String treeName();

    /**
     * The gate code, {@code 0} for AND and {@code 1} for OR.
     */
    public abstract int logicalType();

    @Value.Default
    public String logicalTypeDescription() {
        return Gate.ofLogicalType(logicalType()).map(Gate::name).orElse("");
    }

    @Value.Default
    public String description() {
        return "";
    }

    public abstract List<TreeRow> rows();
}
