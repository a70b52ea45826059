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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Combines the sub-trees of a fault tree in dependency order.
 *
 * <p>Scheduling proceeds in passes (Kahn's algorithm): every pass combines all sub-trees whose
 * referenced sub-trees are computed at the start of the pass. Hence, {@code n} sub-trees need at
 * most {@code n} passes. If a pass finds no ready sub-tree while some remain, the remaining ones
 * depend on a cycle and a {@link DependencyCycleException} is thrown.</p>
 */
public final class DependencyScheduler {
    private static final Logger logger = Logger.getLogger(DependencyScheduler.class.getName());

    /**
     * The result of scheduling: all sub-trees in the order they were computed.
     */
    public static final class Schedule {
        private final List<SubTree> order;
        private final int passes;

        Schedule(List<SubTree> order, int passes) {
            this.order = List.copyOf(order);
            this.passes = passes;
        }

        /**
         * Sub-trees combined while loading first, then the sub-trees of each pass.
         */
        public List<SubTree> order() {
            return order;
        }

        /**
         * The number of passes needed, not counting sub-trees combined while loading.
         */
        public int passes() {
            return passes;
        }
    }

    public Schedule schedule(FaultTree faultTree) throws FaultTreeException {
        FaultTreeDiagram diagram = faultTree.diagram();
        List<SubTree> subTrees = faultTree.subTrees();
        List<SubTree> order = new ArrayList<>(subTrees.size());

        // Number of distinct uncomputed sub-trees each sub-tree waits for
        Map<SubTree, Integer> waitingFor = new HashMap<>();
        Map<SubTree, List<SubTree>> dependents = new HashMap<>();
        Map<SubTree, List<SubTree>> dependencies = new HashMap<>();
        Set<SubTree> pending = new LinkedHashSet<>();

        for (SubTree subTree : subTrees) {
            Set<SubTree> referenced = new LinkedHashSet<>();
            List<SubTree.Member> members = subTree.members();
            for (int index = 0; index < members.size(); index++) {
                SubTree.Member member = members.get(index);
                if (member.isBase()) {
                    continue;
                }
                SubTree target = faultTree.subTree(member.id());
                if (target == null) {
                    throw new UnresolvedDependencyException(subTree.name(), index, member.id());
                }
                referenced.add(target);
            }
            if (subTree.isComputed()) {
                order.add(subTree);
                continue;
            }
            pending.add(subTree);
            dependencies.put(subTree, new ArrayList<>(referenced));
            int count = 0;
            for (SubTree target : referenced) {
                if (!target.isComputed()) {
                    dependents.computeIfAbsent(target, key -> new ArrayList<>()).add(subTree);
                    count += 1;
                }
            }
            waitingFor.put(subTree, count);
        }

        int passes = 0;
        while (!pending.isEmpty()) {
            List<SubTree> ready = new ArrayList<>();
            for (SubTree subTree : pending) {
                if (waitingFor.get(subTree) == 0) {
                    ready.add(subTree);
                }
            }
            if (ready.isEmpty()) {
                throw cycleError(pending, dependencies);
            }

            passes += 1;
            logger.log(Level.FINE, "Pass {0}: combining {1} sub-trees", new Object[] {passes, ready.size()});
            for (SubTree subTree : ready) {
                subTree.markReady();
            }
            for (SubTree subTree : ready) {
                List<Integer> nodes = new ArrayList<>(subTree.members().size());
                for (SubTree.Member member : subTree.members()) {
                    nodes.add(faultTree.nodeOf(member));
                }
                subTree.setRoot(diagram.combineAll(nodes, subTree.gate()));
                pending.remove(subTree);
                order.add(subTree);
                for (SubTree dependent : dependents.getOrDefault(subTree, List.of())) {
                    waitingFor.merge(dependent, -1, Integer::sum);
                }
            }
        }
        assert passes <= subTrees.size();
        return new Schedule(order, passes);
    }

    private static DependencyCycleException cycleError(
            Set<SubTree> pending, Map<SubTree, List<SubTree>> dependencies) {
        // Every pending sub-tree waits for some pending sub-tree, so following these edges has to
        // revisit a sub-tree eventually
        Map<SubTree, Integer> path = new LinkedHashMap<>();
        SubTree current = pending.iterator().next();
        while (!path.containsKey(current)) {
            path.put(current, path.size());
            SubTree next = null;
            for (SubTree dependency : dependencies.get(current)) {
                if (pending.contains(dependency)) {
                    next = dependency;
                    break;
                }
            }
            assert next != null;
            current = next;
        }
        List<String> cycle = new ArrayList<>();
        int start = path.get(current);
        for (Map.Entry<SubTree, Integer> entry : path.entrySet()) {
            if (entry.getValue() >= start) {
                cycle.add(entry.getKey().name());
            }
        }
        Set<String> blocked = new LinkedHashSet<>();
        for (SubTree subTree : pending) {
            blocked.add(subTree.name());
        }
        return new DependencyCycleException(cycle, blocked);
    }
}
