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

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

/**
 * Writes the structure of a diagram for diagnostic purposes. For each node, one line holds its
 * variable and the next line the variables of its then- and else-successor, where the constants
 * true and false are written as {@code 1} and {@code 0}. Nodes are listed in pre-order, each once.
 */
public final class DiagramPrinter {
    private DiagramPrinter() {}

    public static void print(FaultTreeDiagram diagram, int root, Appendable output) throws IOException {
        if (diagram.isConstant(root)) {
            output.append(label(diagram, root)).append(System.lineSeparator());
            return;
        }
        BitSet visited = new BitSet();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            int node = stack.pop();
            if (diagram.isConstant(node) || visited.get(node)) {
                continue;
            }
            visited.set(node);
            int thenNode = diagram.thenBranch(node);
            int elseNode = diagram.elseBranch(node);
            output.append(Integer.toString(diagram.variableOf(node))).append(System.lineSeparator());
            output.append(label(diagram, thenNode))
                    .append(' ')
                    .append(label(diagram, elseNode))
                    .append(System.lineSeparator());
            stack.push(elseNode);
            stack.push(thenNode);
        }
    }

    private static String label(FaultTreeDiagram diagram, int node) {
        if (node == diagram.trueNode()) {
            return "1";
        }
        if (node == diagram.falseNode()) {
            return "0";
        }
        return Integer.toString(diagram.variableOf(node));
    }
}
