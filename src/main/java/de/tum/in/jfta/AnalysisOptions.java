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

import java.util.HashSet;
import java.util.Set;
import org.immutables.value.Value;

/**
 * Options of a {@link FaultTreeAnalysis} batch.
 */
@Value.Immutable
public abstract class AnalysisOptions {
    /**
     * Labels of base events known to work, analyzed with probability 0.
     */
    public abstract Set<String> goodElements();

    /**
     * Labels of base events known to have failed, analyzed with probability 1.
     */
    public abstract Set<String> badElements();

    /**
     * Names of the sub-trees to report. If empty, all sub-trees are reported.
     */
    public abstract Set<String> selectedTrees();

    /**
     * Whether to write the structure of each combined diagram to the diagnostic output.
     */
    @Value.Default
    public boolean verbose() {
        return false;
    }

    @Value.Default
    public int baseEventThreshold() {
        return FaultTreeLoader.DEFAULT_BASE_EVENT_THRESHOLD;
    }

    @Value.Default
    public DiagramConfiguration diagramConfiguration() {
        return ImmutableDiagramConfiguration.builder().build();
    }

    public boolean isSelected(String treeName) {
        return selectedTrees().isEmpty() || selectedTrees().contains(treeName);
    }

    @Value.Check
    protected void check() {
        Set<String> both = new HashSet<>(goodElements());
        both.retainAll(badElements());
        Util.checkArgument(both.isEmpty(), "Elements %s are marked both good and bad", both);
        Util.checkArgument(baseEventThreshold() >= 0, "Negative base event threshold %d", baseEventThreshold());
    }
}
