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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A loaded forest of sub-trees, sharing one diagram and one base event table.
 */
public final class FaultTree {
    private final FaultTreeDiagram diagram;
    private final BaseEventStore baseEvents;
    private final Map<Integer, SubTree> subTrees;

    FaultTree(FaultTreeDiagram diagram, BaseEventStore baseEvents, List<SubTree> subTrees) {
        this.diagram = diagram;
        this.baseEvents = baseEvents;
        Map<Integer, SubTree> byId = new LinkedHashMap<>();
        for (SubTree subTree : subTrees) {
            byId.put(subTree.id(), subTree);
        }
        this.subTrees = Collections.unmodifiableMap(byId);
    }

    public FaultTreeDiagram diagram() {
        return diagram;
    }

    public BaseEventStore baseEvents() {
        return baseEvents;
    }

    /**
     * Returns all sub-trees in page order.
     */
    public List<SubTree> subTrees() {
        return List.copyOf(subTrees.values());
    }

    @Nullable
    public SubTree subTree(int id) {
        return subTrees.get(id);
    }

    public Optional<SubTree> subTreeNamed(String name) {
        return subTrees.values().stream().filter(tree -> tree.name().equals(name)).findFirst();
    }

    /**
     * Resolves a member of a sub-tree to its node. Referenced sub-trees must be computed already.
     */
    int nodeOf(SubTree.Member member) {
        if (member.isBase()) {
            return diagram.baseNode(member.id());
        }
        SubTree referenced = subTrees.get(member.id());
        Util.checkState(referenced != null, "Unknown sub-tree %d", member.id());
        return referenced.root();
    }
}
