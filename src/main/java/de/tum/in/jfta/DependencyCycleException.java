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
import java.util.Set;

/**
 * The sub-trees depend on each other cyclically.
 */
public class DependencyCycleException extends FaultTreeException {
    private static final long serialVersionUID = 1L;

    private final List<String> cycle;
    private final Set<String> blockedTrees;

    public DependencyCycleException(List<String> cycle, Set<String> blockedTrees) {
        super(String.format(
                "Dependency cycle %s -> %s, unable to compute sub-trees %s",
                String.join(" -> ", cycle),
                cycle.get(0),
                blockedTrees));
        this.cycle = List.copyOf(cycle);
        this.blockedTrees = Set.copyOf(blockedTrees);
    }

    /**
     * Names of the sub-trees forming the cycle, each depending on the next and the last one on the
     * first.
     */
    public List<String> cycle() {
        return cycle;
    }

    /**
     * Names of all sub-trees which could not be computed, including the cycle.
     */
    public Set<String> blockedTrees() {
        return blockedTrees;
    }
}
