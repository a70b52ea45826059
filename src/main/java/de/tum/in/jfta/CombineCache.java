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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Direct-mapped memo table for {@link FaultTreeDiagram#combine(int, int, Gate)}. Each bin stores
 * the gate, both (ordered) operands and the result; colliding entries are overwritten.
 */
final class CombineCache {
    private static final Logger logger = Logger.getLogger(CombineCache.class.getName());

    private static final byte NOT_AN_OPERATION = 0;
    private static final int PRIME = 0x1000193;

    private static final int[] EMPTY_INT_ARRAY = new int[0];
    private static final byte[] EMPTY_BYTE_ARRAY = new byte[0];

    private final NodeArena associatedDiagram;
    private final int divider;

    private int keyCount = 0;
    private byte[] operations = EMPTY_BYTE_ARRAY;
    private int[] cache = EMPTY_INT_ARRAY;

    private int lookupHash = -1;
    private int lookupResult = NodeArena.NOT_A_NODE;

    // Statistics
    private long lookupCount = 0;
    private long hitCount = 0;
    private long putCount = 0;
    private long invalidationCount = 0;

    CombineCache(NodeArena associatedDiagram, DiagramConfiguration configuration) {
        this.associatedDiagram = associatedDiagram;
        this.divider = configuration.cacheCombineDivider();
        reallocate();
    }

    private static byte operationOf(Gate gate) {
        return (byte) (gate.ordinal() + 1);
    }

    private static int hash(byte operation, int firstKey, int secondKey) {
        return (PRIME * operation) + firstKey * 31 + secondKey;
    }

    private static int mod(int value, int modulus) {
        int val = value % modulus;
        return val < 0 ? val + modulus : val;
    }

    boolean wellOrdered(int node1, int node2) {
        int node1var = associatedDiagram.variableOf(node1);
        int node2var = associatedDiagram.variableOf(node2);
        return node1var < node2var || (node1var == node2var && node1 < node2);
    }

    int lookupHash() {
        return lookupHash;
    }

    int lookupResult() {
        return lookupResult;
    }

    boolean lookup(Gate gate, int inputNode1, int inputNode2) {
        assert wellOrdered(inputNode1, inputNode2);
        byte operation = operationOf(gate);
        int hash = hash(operation, inputNode1, inputNode2);
        lookupHash = hash;
        lookupCount += 1;

        int position = mod(hash, keyCount);
        int binStart = 3 * position;
        if (operations[position] == operation
                && cache[binStart] == inputNode1
                && cache[binStart + 1] == inputNode2) {
            lookupResult = cache[binStart + 2];
            assert associatedDiagram.isNodeValidOrConstant(lookupResult);
            hitCount += 1;
            return true;
        }
        return false;
    }

    void put(Gate gate, int hash, int inputNode1, int inputNode2, int resultNode) {
        assert wellOrdered(inputNode1, inputNode2);
        assert hash == hash(operationOf(gate), inputNode1, inputNode2);
        putCount += 1;

        int position = mod(hash, keyCount);
        int binStart = 3 * position;
        operations[position] = operationOf(gate);
        cache[binStart] = inputNode1;
        cache[binStart + 1] = inputNode2;
        cache[binStart + 2] = resultNode;
    }

    /**
     * Resizes the cache to match the current size of the node table. All entries are dropped.
     */
    void invalidate() {
        logger.log(Level.FINER, "Invalidating combine cache");
        invalidationCount += 1;
        reallocate();
    }

    private void reallocate() {
        keyCount = Util.nextPrime(Math.max(associatedDiagram.tableSize() / divider, 1));
        operations = new byte[keyCount];
        cache = new int[3 * keyCount];
        assert operations[0] == NOT_AN_OPERATION;
    }

    private float loadFactor() {
        int loadedBins = 0;
        for (byte operation : operations) {
            if (operation != NOT_AN_OPERATION) {
                loadedBins++;
            }
        }
        return (float) loadedBins / (float) keyCount;
    }

    String statistics() {
        return String.format(
                "Combine cache: size %d, load %.2f, %d lookups, %d hits (%.1f%%), %d puts, %d invalidations",
                keyCount,
                loadFactor(),
                lookupCount,
                hitCount,
                lookupCount == 0 ? 0.0d : 100.0d * hitCount / lookupCount,
                putCount,
                invalidationCount);
    }
}
