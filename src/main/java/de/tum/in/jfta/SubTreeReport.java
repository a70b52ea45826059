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
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The analysis result of one sub-tree: its identity, the probability of its top event and the
 * importance of every base event it depends on.
 */
@Value.Immutable
public abstract class SubTreeReport {
    public abstract int id();

    public abstract String treeName();

    public abstract String description();

    public abstract int logicalType();

    public abstract String logicalTypeDescription();

    public abstract double systemProbability();

    public abstract List<BaseImportance> importances();

    public Optional<BaseImportance> importanceOf(int baseId) {
        return importances().stream().filter(importance -> importance.baseId() == baseId).findFirst();
    }
}
