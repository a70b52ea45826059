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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assembles pages into a {@link FaultTree}. Row ids above the base event threshold are base
 * events, all other ids refer to the sub-tree with that id. Sub-trees consisting only of base
 * events are combined right away.
 */
public final class FaultTreeLoader {
    public static final int DEFAULT_BASE_EVENT_THRESHOLD = 1000;

    private static final Logger logger = Logger.getLogger(FaultTreeLoader.class.getName());

    private final FaultTreeDiagram diagram;
    private final int baseEventThreshold;

    public FaultTreeLoader(FaultTreeDiagram diagram) {
        this(diagram, DEFAULT_BASE_EVENT_THRESHOLD);
    }

    public FaultTreeLoader(FaultTreeDiagram diagram, int baseEventThreshold) {
        Util.checkArgument(baseEventThreshold >= 0, "Negative base event threshold %d", baseEventThreshold);
        this.diagram = diagram;
        this.baseEventThreshold = baseEventThreshold;
    }

    public boolean isBaseEventId(int id) {
        return id > baseEventThreshold;
    }

    public FaultTree load(List<SubTreePage> pages) throws FaultTreeException {
        BaseEventStore baseEvents = new BaseEventStore();
        List<SubTree> subTrees = new ArrayList<>(pages.size());
        Set<Integer> subTreeIds = new HashSet<>();

        for (SubTreePage page : pages) {
            if (page.rows().isEmpty()) {
                logger.log(Level.FINE, "Skipping empty page {0}", page.treeName());
                continue;
            }
            if (page.id() < 0 || isBaseEventId(page.id())) {
                throw new IdOutOfRangeException(String.format(
                        "Sub-tree %s has id %d outside of [0, %d]", page.treeName(), page.id(), baseEventThreshold));
            }
            if (!subTreeIds.add(page.id())) {
                throw new FaultTreeException(
                        String.format("Duplicate sub-tree id %d (sub-tree %s)", page.id(), page.treeName()));
            }
            Gate gate = gateOf(page);

            List<SubTree.Member> members = new ArrayList<>(page.rows().size());
            for (TreeRow row : page.rows()) {
                if (row.id() < 0) {
                    throw new IdOutOfRangeException(
                            String.format("Negative row id %d in sub-tree %s", row.id(), page.treeName()));
                }
                if (isBaseEventId(row.id())) {
                    BaseEvent event = ImmutableBaseEvent.builder()
                            .id(row.id())
                            .probability(row.probability())
                            .label(row.label())
                            .description(row.description())
                            .guidance(row.guidance())
                            .build();
                    baseEvents.register(event);
                    members.add(SubTree.Member.base(row.id()));
                } else {
                    members.add(SubTree.Member.reference(row.id()));
                }
            }

            SubTree subTree = new SubTree(page, gate, members);
            if (subTree.isAllBase()) {
                List<Integer> nodes = new ArrayList<>(members.size());
                for (SubTree.Member member : members) {
                    nodes.add(diagram.baseNode(member.id()));
                }
                subTree.markReady();
                subTree.setRoot(diagram.combineAll(nodes, gate));
                logger.log(Level.FINE, "Combined base sub-tree {0}", subTree);
            }
            subTrees.add(subTree);
        }

        logger.log(Level.FINE, "Loaded {0} sub-trees with {1} base events", new Object[] {
            subTrees.size(), baseEvents.size()
        });
        return new FaultTree(diagram, baseEvents, subTrees);
    }

    private static Gate gateOf(SubTreePage page) throws InconsistentGateException {
        Optional<Gate> declared = Gate.ofLogicalType(page.logicalType());
        if (declared.isEmpty()) {
            throw new InconsistentGateException(
                    String.format("Sub-tree %s has unknown logical type %d", page.treeName(), page.logicalType()));
        }
        Gate gate = declared.get();
        Optional<Gate> described = Gate.ofDescription(page.logicalTypeDescription());
        if (described.isPresent() && described.get() != gate) {
            throw new InconsistentGateException(String.format(
                    "Sub-tree %s declares logical type %s but is described as %s",
                    page.treeName(), gate, page.logicalTypeDescription()));
        }
        return gate;
    }
}
