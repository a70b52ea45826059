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
import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;
import java.util.function.IntConsumer;

/* Implementation notes:
 * - The recursive and iterative variants of combine follow exactly the same case distinction, the
 *   iterative one just manages the branch stack explicitly.
 * - A base terminal is stored like an internal node with successors true and false, marked by the
 *   terminal flag. This way the apply algorithm needs no special case for it.
 */
@SuppressWarnings({
    "PMD.AvoidReassigningParameters",
    "PMD.AssignmentInOperand",
    "ReassignedVariable",
    "AssignmentToMethodParameter",
    "ValueOfIncrementOrDecrementUsed",
    "NestedAssignment"
})
final class DiagramImpl extends NodeArena {
    private static final int[] EMPTY_INT_ARRAY = new int[0];

    private static final int TRUE_NODE = -1;
    private static final int FALSE_NODE = -2;

    private final CombineCache cache;

    /* Else and then successors of each node */
    private int[] tree;

    // Iterative stack
    private final boolean iterative;
    private int[] cacheStackHash = EMPTY_INT_ARRAY;
    private int[] cacheStackLeft = EMPTY_INT_ARRAY;
    private int[] cacheStackRight = EMPTY_INT_ARRAY;
    private int[] branchStackParentVar = EMPTY_INT_ARRAY;
    private int[] branchStackLeft = EMPTY_INT_ARRAY;
    private int[] branchStackRight = EMPTY_INT_ARRAY;
    private int[] elseResultStack = EMPTY_INT_ARRAY;

    private int hashLookupThen = NOT_A_NODE;
    private int hashLookupElse = NOT_A_NODE;

    DiagramImpl(DiagramConfiguration configuration) {
        super(configuration.initialSize(), configuration.growthFactor());
        this.iterative = configuration.iterative();

        tree = new int[2 * tableSize()];
        cache = new CombineCache(this, configuration);
    }

    boolean isIterative() {
        return iterative;
    }

    @Override
    protected boolean checkLookupChildrenMatch(int lookup) {
        int[] tree = this.tree;
        return tree[lookup * 2] == hashLookupElse && tree[lookup * 2 + 1] == hashLookupThen;
    }

    @Override
    protected void onTableResize(int newSize) {
        tree = Arrays.copyOf(tree, newSize * 2);
        cache.invalidate();
    }

    @Override
    protected int hashCode(int node, int variable) {
        return hashCode(variable, tree[2 * node + 1], tree[2 * node]);
    }

    private static int hashCode(int variable, int thenNode, int elseNode) {
        return variable + thenNode * 31 + elseNode;
    }

    @Override
    public int trueNode() {
        return TRUE_NODE;
    }

    @Override
    public int falseNode() {
        return FALSE_NODE;
    }

    @Override
    public boolean isConstant(int node) {
        assert FALSE_NODE <= node && node < tableSize();
        return node < 0;
    }

    @Override
    public int thenBranch(int node) {
        assert isNodeValid(node);
        return tree[2 * node + 1];
    }

    @Override
    public int elseBranch(int node) {
        assert isNodeValid(node);
        return tree[2 * node];
    }

    @Override
    public int baseNode(int baseId) {
        Util.checkArgument(0 <= baseId && baseId <= MAXIMAL_VARIABLE, "Base id %d out of range", baseId);
        return makeNode(baseId, TRUE_NODE, FALSE_NODE);
    }

    @Override
    public int makeNode(int variable, int thenNode, int elseNode) {
        assert 0 <= variable;
        assert isNodeValidOrConstant(thenNode) && isNodeValidOrConstant(elseNode);
        assert isConstant(thenNode) || variable < variableOf(thenNode);
        assert isConstant(elseNode) || variable < variableOf(elseNode);

        if (thenNode == elseNode) {
            return thenNode;
        }

        hashLookupThen = thenNode;
        hashLookupElse = elseNode;
        boolean terminal = thenNode == TRUE_NODE && elseNode == FALSE_NODE;
        int freeNode = findOrCreateNode(variable, terminal, hashCode(variable, thenNode, elseNode));

        this.tree[2 * freeNode] = elseNode;
        this.tree[2 * freeNode + 1] = thenNode;
        assert hashCode(variable, thenNode, elseNode) == hashCode(freeNode, variable);
        return freeNode;
    }

    // Combination

    @Override
    public int combine(int node1, int node2, Gate gate) {
        assert isNodeValidOrConstant(node1) && isNodeValidOrConstant(node2);
        return iterative ? combineIterative(node1, node2, gate) : combineRecursive(node1, node2, gate);
    }

    /**
     * Resolves the cases where the result is determined without descending, i.e. equal operands or
     * at least one constant operand.
     *
     * @return The result or {@link #NOT_A_NODE} if both operands are distinct non-constants.
     */
    private static int terminalCase(int node1, int node2, Gate gate) {
        if (node1 == node2) {
            return node1;
        }
        int absorbing = gate == Gate.AND ? FALSE_NODE : TRUE_NODE;
        int identity = gate == Gate.AND ? TRUE_NODE : FALSE_NODE;
        if (node1 == absorbing || node2 == absorbing) {
            return absorbing;
        }
        if (node1 == identity) {
            return node2;
        }
        if (node2 == identity) {
            return node1;
        }
        return NOT_A_NODE;
    }

    private int combineRecursive(int node1, int node2, Gate gate) {
        int terminal = terminalCase(node1, node2, gate);
        if (terminal != NOT_A_NODE) {
            return terminal;
        }

        int node1var = variableOf(node1);
        int node2var = variableOf(node2);

        if (node2var < node1var || (node2var == node1var && node2 < node1)) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;

            int varSwap = node1var;
            node1var = node2var;
            node2var = varSwap;
        }

        if (cache.lookup(gate, node1, node2)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        int thenNode;
        int elseNode;
        if (node1var == node2var) {
            thenNode = combineRecursive(thenBranch(node1), thenBranch(node2), gate);
            elseNode = combineRecursive(elseBranch(node1), elseBranch(node2), gate);
        } else { // node1var < node2var
            thenNode = combineRecursive(thenBranch(node1), node2, gate);
            elseNode = combineRecursive(elseBranch(node1), node2, gate);
        }
        int resultNode = makeNode(node1var, thenNode, elseNode);
        cache.put(gate, hash, node1, node2, resultNode);
        return resultNode;
    }

    private int combineIterative(int node1, int node2, Gate gate) {
        int stackIndex = 0;
        int current1 = node1;
        int current2 = node2;

        while (true) {
            assert stackIndex >= 0;

            int result;
            while (true) {
                result = terminalCase(current1, current2, gate);
                if (result != NOT_A_NODE) {
                    break;
                }
                int node1var = variableOf(current1);
                int node2var = variableOf(current2);

                if (node2var < node1var || (node2var == node1var && current2 < current1)) {
                    int nodeSwap = current1;
                    current1 = current2;
                    current2 = nodeSwap;

                    int varSwap = node1var;
                    node1var = node2var;
                    node2var = varSwap;
                }

                if (cache.lookup(gate, current1, current2)) {
                    result = cache.lookupResult();
                    break;
                }
                ensureStackSize(stackIndex);

                cacheStackHash[stackIndex] = cache.lookupHash();
                cacheStackLeft[stackIndex] = current1;
                cacheStackRight[stackIndex] = current2;
                branchStackParentVar[stackIndex] = node1var;
                branchStackLeft[stackIndex] = thenBranch(current1);
                if (node1var == node2var) {
                    branchStackRight[stackIndex] = thenBranch(current2);
                    current2 = elseBranch(current2);
                } else {
                    branchStackRight[stackIndex] = current2;
                }
                current1 = elseBranch(current1);

                stackIndex += 1;
            }

            if (stackIndex == 0) {
                return result;
            }

            // Negative parent variables mark entries whose else-branch is already done
            int parentVar;
            while ((parentVar = branchStackParentVar[--stackIndex]) < 0) {
                int variable = -parentVar - 1;
                result = makeNode(variable, result, elseResultStack[stackIndex]);
                cache.put(gate, cacheStackHash[stackIndex], cacheStackLeft[stackIndex], cacheStackRight[stackIndex], result);

                if (stackIndex == 0) {
                    return result;
                }
            }
            branchStackParentVar[stackIndex] = -(parentVar + 1);
            elseResultStack[stackIndex] = result;

            current1 = branchStackLeft[stackIndex];
            current2 = branchStackRight[stackIndex];
            stackIndex += 1;
        }
    }

    private void ensureStackSize(int index) {
        if (index < branchStackParentVar.length) {
            return;
        }
        int newSize = Math.max(32, branchStackParentVar.length * 2);
        cacheStackHash = Arrays.copyOf(cacheStackHash, newSize);
        cacheStackLeft = Arrays.copyOf(cacheStackLeft, newSize);
        cacheStackRight = Arrays.copyOf(cacheStackRight, newSize);
        branchStackParentVar = Arrays.copyOf(branchStackParentVar, newSize);
        branchStackLeft = Arrays.copyOf(branchStackLeft, newSize);
        branchStackRight = Arrays.copyOf(branchStackRight, newSize);
        elseResultStack = Arrays.copyOf(elseResultStack, newSize);
    }

    // Traversal

    @Override
    public void forEachBaseEvent(int node, IntConsumer action) {
        assert isNodeValidOrConstant(node);
        if (isConstant(node)) {
            return;
        }
        BitSet visited = new BitSet(activeNodeCount() + FIRST_NODE);
        Set<Integer> seenVariables = new HashSet<>();
        int[] stack = new int[32];
        int stackIndex = 0;
        stack[stackIndex++] = node;

        while (stackIndex > 0) {
            int current = stack[--stackIndex];
            if (isConstant(current) || visited.get(current)) {
                continue;
            }
            visited.set(current);
            int variable = variableOf(current);
            if (seenVariables.add(variable)) {
                action.accept(variable);
            }
            if (stackIndex + 2 > stack.length) {
                stack = Arrays.copyOf(stack, stack.length * 2);
            }
            // Else first, so that the then-branch is popped next
            stack[stackIndex++] = elseBranch(current);
            stack[stackIndex++] = thenBranch(current);
        }
    }

    @Override
    public int nodeCount(int node) {
        assert isNodeValidOrConstant(node);
        if (isConstant(node)) {
            return 0;
        }
        BitSet visited = new BitSet(activeNodeCount() + FIRST_NODE);
        int[] stack = new int[32];
        int stackIndex = 0;
        stack[stackIndex++] = node;
        int count = 0;

        while (stackIndex > 0) {
            int current = stack[--stackIndex];
            if (isConstant(current) || visited.get(current)) {
                continue;
            }
            visited.set(current);
            count += 1;
            if (stackIndex + 2 > stack.length) {
                stack = Arrays.copyOf(stack, stack.length * 2);
            }
            stack[stackIndex++] = elseBranch(current);
            stack[stackIndex++] = thenBranch(current);
        }
        return count;
    }

    @Override
    public String statistics() {
        return super.statistics() + System.lineSeparator() + cache.statistics();
    }

    @Override
    public String toString() {
        return String.format("DiagramImpl@%x(%s)", System.identityHashCode(this), iterative ? "iterative" : "recursive");
    }
}
