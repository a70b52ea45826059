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
import java.util.function.IntConsumer;
import java.util.function.IntPredicate;

/**
 * A binary decision diagram over base events, specialised to the AND/OR gates of fault trees.
 *
 * <p>Nodes are plain {@code int} handles into an arena owned by the diagram. There are four kinds
 * of nodes:</p>
 * <ul>
 *   <li>the constant {@link #trueNode() true} (the event certainly occurs),</li>
 *   <li>the constant {@link #falseNode() false} (the event never occurs),</li>
 *   <li>a <b>base terminal</b>, representing exactly one base event, and</li>
 *   <li>an <b>internal</b> node testing a base event with a then- and an else-branch.</li>
 * </ul>
 *
 * <p>Variables are the ids of base events, hence the variable order is the natural order of the
 * ids. Along any path, variables strictly increase. A base terminal {@code b} is the canonical
 * form of "if {@code b} then true else false" and answers {@link #thenBranch(int)} and
 * {@link #elseBranch(int)} accordingly. Nodes are shared (hash-consed), so two nodes representing
 * the same function built in the same diagram are identical.</p>
 *
 * <p>Note that for the sake of performance, most required properties of the arguments are only
 * checked though {@code assert} statements. Diagrams are not thread safe.</p>
 */
public interface FaultTreeDiagram {
    int trueNode();

    int falseNode();

    /**
     * Returns the terminal node of the base event with the given {@code baseId}, creating it if
     * necessary.
     *
     * @throws IllegalArgumentException if the id is negative or too large.
     */
    int baseNode(int baseId);

    /**
     * Determines whether the given {@code node} is one of the two constants.
     */
    boolean isConstant(int node);

    /**
     * Determines whether the given {@code node} is a base terminal.
     */
    boolean isBase(int node);

    default boolean isInternal(int node) {
        return !isConstant(node) && !isBase(node);
    }

    /**
     * Gets the base event id tested by the given {@code node} or {@code -1} for a constant.
     */
    int variableOf(int node);

    /**
     * Returns the successor of {@code node} if its variable failed. This is {@link #trueNode()} for
     * a base terminal.
     */
    int thenBranch(int node);

    /**
     * Returns the successor of {@code node} if its variable did not fail. This is
     * {@link #falseNode()} for a base terminal.
     */
    int elseBranch(int node);

    /**
     * Returns the node testing {@code variable} with the given successors, reducing redundant tests
     * and mapping "then true, else false" to the base terminal.
     */
    int makeNode(int variable, int thenNode, int elseNode);

    /**
     * Combines two nodes under the given gate.
     *
     * @return The node representing {@code node1 gate node2}.
     */
    int combine(int node1, int node2, Gate gate);

    default int and(int node1, int node2) {
        return combine(node1, node2, Gate.AND);
    }

    default int or(int node1, int node2) {
        return combine(node1, node2, Gate.OR);
    }

    /**
     * Folds the given nodes left to right under {@code gate}: the first two are combined, then each
     * remaining node is combined with the accumulated result.
     *
     * @throws IllegalArgumentException if {@code nodes} is empty.
     */
    default int combineAll(List<Integer> nodes, Gate gate) {
        Util.checkArgument(!nodes.isEmpty(), "Cannot combine an empty list of nodes under %s", gate);
        int result = nodes.get(0);
        for (int i = 1; i < nodes.size(); i++) {
            result = combine(result, nodes.get(i), gate);
        }
        return result;
    }

    /**
     * Checks whether the top event represented by {@code node} occurs if exactly the base events
     * accepted by {@code failed} occur.
     */
    default boolean evaluate(int node, IntPredicate failed) {
        int current = node;
        while (!isConstant(current)) {
            current = failed.test(variableOf(current)) ? thenBranch(current) : elseBranch(current);
        }
        return current == trueNode();
    }

    /**
     * Calls {@code action} once for every base event occurring in the diagram below {@code node}, in
     * depth-first pre-order with then-branches visited before else-branches.
     */
    void forEachBaseEvent(int node, IntConsumer action);

    /**
     * Counts the non-constant nodes reachable from {@code node}.
     */
    int nodeCount(int node);

    /**
     * Returns the number of nodes allocated in this diagram.
     */
    int activeNodeCount();

    /**
     * Returns a string containing some statistics about the diagram. The content and formatting of
     * this string may change drastically and are only intended as human-readable output.
     */
    String statistics();
}
