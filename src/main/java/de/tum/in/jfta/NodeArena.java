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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The arena holding all nodes of a diagram, together with the unique table used to share nodes.
 * Nodes are never freed individually; the arena is dropped as a whole.
 */
public abstract class NodeArena implements FaultTreeDiagram {
    private static final Logger logger = Logger.getLogger(NodeArena.class.getName());

    /* Bit marking a base terminal */
    private static final int TERMINAL_MASK = 1;
    private static final int VARIABLE_OFFSET = 1;
    /* Largest variable which fits into the metadata */
    static final int MAXIMAL_VARIABLE = Integer.MAX_VALUE >>> VARIABLE_OFFSET;

    static int dataMake(int variable, boolean terminal) {
        assert 0 <= variable && variable <= MAXIMAL_VARIABLE;
        return (variable << VARIABLE_OFFSET) | (terminal ? TERMINAL_MASK : 0);
    }

    static int dataGetVariable(int metadata) {
        return metadata >>> VARIABLE_OFFSET;
    }

    static boolean dataIsTerminal(int metadata) {
        return (metadata & TERMINAL_MASK) != 0;
    }

    // Use 0 as "not a node" to make re-allocations slightly more efficient
    protected static final int NOT_A_NODE = 0;
    protected static final int FIRST_NODE = 1;

    private static final int MINIMUM_NODE_TABLE_SIZE = Util.nextPrime(1_000);
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    private final double growthFactor;

    /* Nodes are allocated sequentially, so every index below this one is a valid node. */
    private int nextFreeNode;

    /* Stores the variable of each node and whether it is a base terminal.
     *
     * Layout: <---VAR---><TERMINAL> */
    private int[] nodes;

    /* Hash map for existing nodes. When a node with a certain hash is created, we add it to the
     * front of the corresponding chain, obtainable by hashToChainStart. The chain is traversed by
     * repeatedly accessing hashChain. */
    private int[] hashToChainStart;
    private int[] hashChain;

    // Statistics
    private long createdNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;

    protected NodeArena(int initialSize, double growthFactor) {
        this.growthFactor = growthFactor;
        int tableSize = Math.max(Util.nextPrime(initialSize), MINIMUM_NODE_TABLE_SIZE);

        nodes = new int[tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];
        nextFreeNode = FIRST_NODE;
    }

    public boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node < nextFreeNode;
    }

    /**
     * Determines if the given {@code node} is either a constant or valid. For most operations it is
     * required that this is the case.
     */
    public boolean isNodeValidOrConstant(int node) {
        return isConstant(node) || isNodeValid(node);
    }

    @Override
    public int variableOf(int node) {
        assert isNodeValidOrConstant(node);
        return isConstant(node) ? -1 : dataGetVariable(nodes[node]);
    }

    @Override
    public boolean isBase(int node) {
        assert isNodeValidOrConstant(node);
        return !isConstant(node) && dataIsTerminal(nodes[node]);
    }

    @Override
    public int activeNodeCount() {
        return nextFreeNode - FIRST_NODE;
    }

    public int tableSize() {
        return nodes.length;
    }

    protected abstract boolean checkLookupChildrenMatch(int lookup);

    protected abstract int hashCode(int node, int variable);

    protected abstract void onTableResize(int newSize);

    protected int findOrCreateNode(int variable, boolean terminal, int hashCode) {
        int metadata = dataMake(variable, terminal);
        int[] nodes = this.nodes;
        int[] hashChain = this.hashChain;

        // Search for the node in the hash chain
        int currentLookupNode = hashToChainStart[hashToTable(hashCode)];
        int chainLookups = 1;
        this.hashChainLookups += 1;
        while (currentLookupNode != NOT_A_NODE) {
            if (nodes[currentLookupNode] == metadata && checkLookupChildrenMatch(currentLookupNode)) {
                this.hashChainLookupLength += chainLookups;
                this.hashChainLookupHit += 1;
                return currentLookupNode;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        this.hashChainLookupLength += chainLookups;

        if (nextFreeNode == tableSize()) {
            grow();
        }

        int freeNode = nextFreeNode;
        nextFreeNode += 1;
        createdNodes += 1;
        this.nodes[freeNode] = metadata;
        connectHashList(freeNode, hashCode);
        return freeNode;
    }

    private void grow() {
        int oldSize = tableSize();
        if (oldSize >= MAXIMAL_NODE_COUNT) {
            throw new DiagramCapacityException(String.format("Node table of %s exhausted with %d nodes", this, oldSize));
        }

        growCount += 1;
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = Math.min(MAXIMAL_NODE_COUNT, Util.nextPrime((int) Math.ceil(oldSize * growthFactor)));
        assert oldSize < newSize : "Got new size " + newSize + " with old size " + oldSize;

        logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});

        nodes = Arrays.copyOf(this.nodes, newSize); // NOPMD
        hashChain = new int[newSize];
        // We need to re-build hashToChainStart completely
        hashToChainStart = new int[newSize];
        onTableResize(newSize);

        for (int node = nextFreeNode - 1; node >= FIRST_NODE; node--) {
            connectHashList(node, hashCode(node, dataGetVariable(nodes[node])));
        }

        assert check();
        logger.log(Level.FINE, "Finished growing the table");
    }

    private void connectHashList(int node, int hashCode) {
        assert isNodeValid(node);
        int position = hashToTable(hashCode);
        hashChain[node] = hashToChainStart[position];
        hashToChainStart[position] = node;
    }

    private int hashToTable(int hashCode) {
        int mod = hashCode % nodes.length;
        return hashCode < 0 ? mod + nodes.length : mod;
    }

    /**
     * Checks the integrity of the arena: each node is reachable through its hash chain, no two
     * nodes are equal and the variable order holds for all successors.
     */
    boolean check() {
        logger.log(Level.FINER, "Running integrity check");
        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            int variable = dataGetVariable(nodes[node]);
            int chain = hashToChainStart[hashToTable(hashCode(node, variable))];
            boolean found = false;
            while (chain != NOT_A_NODE) {
                if (chain == node) {
                    found = true;
                } else if (nodes[chain] == nodes[node] && hashCode(chain, variable) == hashCode(node, variable)) {
                    Util.checkState(!checkChildrenEqual(chain, node), "Duplicate nodes %d and %d", chain, node);
                }
                chain = hashChain[chain];
            }
            Util.checkState(found, "Node %d is not contained in its hash chain", node);

            int thenNode = thenBranch(node);
            int elseNode = elseBranch(node);
            Util.checkState(
                    isConstant(thenNode) || variable < variableOf(thenNode),
                    "Then successor %d of node %d violates the variable order",
                    thenNode,
                    node);
            Util.checkState(
                    isConstant(elseNode) || variable < variableOf(elseNode),
                    "Else successor %d of node %d violates the variable order",
                    elseNode,
                    node);
            Util.checkState(thenNode != elseNode, "Node %d is redundant", node);
            Util.checkState(
                    dataIsTerminal(nodes[node]) == (thenNode == trueNode() && elseNode == falseNode()),
                    "Node %d has a wrong terminal flag",
                    node);
        }
        return true;
    }

    private boolean checkChildrenEqual(int node, int other) {
        return thenBranch(node) == thenBranch(other) && elseBranch(node) == elseBranch(other);
    }

    @Override
    public String statistics() {
        return String.format(
                "Node table: %d nodes, table size %d, %d grows%n"
                        + "Unique table: %d created nodes, %d lookups, %d hits, average chain length %.2f",
                activeNodeCount(),
                tableSize(),
                growCount,
                createdNodes,
                hashChainLookups,
                hashChainLookupHit,
                hashChainLookups == 0 ? 0.0d : (double) hashChainLookupLength / (double) hashChainLookups);
    }
}
