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

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Computes the probability of the top event represented by a node. The traversal uses an explicit
 * stack, shared sub-diagrams are evaluated once per call.
 */
public final class ProbabilityEvaluator {
    private final FaultTreeDiagram diagram;

    public ProbabilityEvaluator(FaultTreeDiagram diagram) {
        this.diagram = diagram;
    }

    public FaultTreeDiagram diagram() {
        return diagram;
    }

    /**
     * Returns the probability that the top event represented by {@code root} occurs if each base
     * event fails independently with the probability given by {@code assignment}.
     */
    public double evaluate(int root, ProbabilityAssignment assignment) {
        if (diagram.isConstant(root)) {
            return constantValue(root);
        }

        Map<Integer, Double> values = new HashMap<>();
        int[] stack = new int[32];
        int stackIndex = 0;
        stack[stackIndex++] = root;

        while (stackIndex > 0) {
            int current = stack[stackIndex - 1];
            if (values.containsKey(current)) {
                stackIndex -= 1;
                continue;
            }
            int thenNode = diagram.thenBranch(current);
            int elseNode = diagram.elseBranch(current);
            boolean thenDone = isResolved(thenNode, values);
            boolean elseDone = isResolved(elseNode, values);

            if (thenDone && elseDone) {
                stackIndex -= 1;
                double probability = assignment.probability(diagram.variableOf(current));
                double value = probability * valueOf(thenNode, values) + (1.0d - probability) * valueOf(elseNode, values);
                values.put(current, value);
                continue;
            }
            if (stackIndex + 2 > stack.length) {
                stack = Arrays.copyOf(stack, stack.length * 2);
            }
            if (!elseDone) {
                stack[stackIndex++] = elseNode;
            }
            if (!thenDone) {
                stack[stackIndex++] = thenNode;
            }
        }
        return values.get(root);
    }

    private boolean isResolved(int node, Map<Integer, Double> values) {
        return diagram.isConstant(node) || values.containsKey(node);
    }

    private double valueOf(int node, Map<Integer, Double> values) {
        return diagram.isConstant(node) ? constantValue(node) : values.get(node);
    }

    private double constantValue(int node) {
        return node == diagram.trueNode() ? 1.0d : 0.0d;
    }
}
