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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import java.io.IOException;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Tests the combination of diagrams against brute force evaluation and checks the structural
 * invariants of the node arena.
 */
@SuppressWarnings({"checkstyle:javadoc", "NewClassNamingConvention"})
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class DiagramTheoriesTest {
    private static final Logger logger = Logger.getLogger(DiagramTheoriesTest.class.getName());

    private static final int FIRST_BASE = 1001;
    private static final int BASE_COUNT = 8;
    private static final int FORMULA_COUNT = 200;
    private static final int FORMULA_DEPTH = 4;

    private final List<FaultFormula> formulas = new ArrayList<>(FORMULA_COUNT);

    private final List<FaultTreeDiagram> diagrams;

    public DiagramTheoriesTest() {
        DiagramConfiguration configuration =
                ImmutableDiagramConfiguration.builder().initialSize(16).build();
        diagrams = List.of(
                DiagramFactory.buildDiagramRecursive(configuration),
                DiagramFactory.buildDiagramIterative(configuration));
        Random random = new Random(0L);
        for (int i = 0; i < FORMULA_COUNT; i++) {
            formulas.add(FaultFormula.random(random, FIRST_BASE, BASE_COUNT, FORMULA_DEPTH));
        }
    }

    Stream<FaultTreeDiagram> diagrams() {
        return diagrams.stream();
    }

    Stream<Arguments> formulaPairs() {
        Random random = new Random(1L);
        List<Arguments> arguments = new ArrayList<>();
        for (FaultTreeDiagram diagram : diagrams) {
            for (int i = 0; i < 50; i++) {
                arguments.add(Arguments.of(
                        diagram,
                        formulas.get(random.nextInt(formulas.size())),
                        formulas.get(random.nextInt(formulas.size()))));
            }
        }
        return arguments.stream();
    }

    private static List<BitSet> valuations() {
        List<BitSet> valuations = new ArrayList<>(1 << BASE_COUNT);
        for (int mask = 0; mask < (1 << BASE_COUNT); mask++) {
            BitSet failed = new BitSet();
            for (int i = 0; i < BASE_COUNT; i++) {
                if ((mask & (1 << i)) != 0) {
                    failed.set(FIRST_BASE + i);
                }
            }
            valuations.add(failed);
        }
        return valuations;
    }

    @ParameterizedTest
    @MethodSource("diagrams")
    public void testCombineMatchesFormula(FaultTreeDiagram diagram) {
        List<BitSet> valuations = valuations();
        for (FaultFormula formula : formulas) {
            int node = formula.toNode(diagram);
            for (BitSet failed : valuations) {
                assertThat(formula + " under " + failed, diagram.evaluate(node, failed::get), is(formula.evaluate(failed)));
            }
        }
        assertThat(((NodeArena) diagram).check(), is(true));
        logger.log(Level.FINE, "{0} holds {1} nodes", new Object[] {diagram, diagram.activeNodeCount()});
    }

    @ParameterizedTest
    @MethodSource("formulaPairs")
    public void testCommutative(FaultTreeDiagram diagram, FaultFormula left, FaultFormula right) {
        int leftNode = left.toNode(diagram);
        int rightNode = right.toNode(diagram);
        for (Gate gate : Gate.values()) {
            assertThat(diagram.combine(leftNode, rightNode, gate), is(diagram.combine(rightNode, leftNode, gate)));
        }
    }

    @ParameterizedTest
    @MethodSource("formulaPairs")
    public void testIdempotentAndAbsorbing(FaultTreeDiagram diagram, FaultFormula left, FaultFormula right) {
        int node = left.toNode(diagram);
        assertThat(diagram.and(node, node), is(node));
        assertThat(diagram.or(node, node), is(node));
        assertThat(diagram.and(node, diagram.falseNode()), is(diagram.falseNode()));
        assertThat(diagram.and(node, diagram.trueNode()), is(node));
        assertThat(diagram.or(node, diagram.trueNode()), is(diagram.trueNode()));
        assertThat(diagram.or(node, diagram.falseNode()), is(node));

        // Absorption: x or (x and y) = x
        int other = right.toNode(diagram);
        assertThat(diagram.or(node, diagram.and(node, other)), is(node));
        assertThat(diagram.and(node, diagram.or(node, other)), is(node));
    }

    @ParameterizedTest
    @MethodSource("diagrams")
    public void testBaseNodes(FaultTreeDiagram diagram) {
        int base = diagram.baseNode(FIRST_BASE);
        assertThat(diagram.isBase(base), is(true));
        assertThat(diagram.isInternal(base), is(false));
        assertThat(diagram.baseNode(FIRST_BASE), is(base));
        assertThat(diagram.thenBranch(base), is(diagram.trueNode()));
        assertThat(diagram.elseBranch(base), is(diagram.falseNode()));
        assertThat(diagram.makeNode(FIRST_BASE, diagram.trueNode(), diagram.falseNode()), is(base));

        int combined = diagram.and(base, diagram.baseNode(FIRST_BASE + 1));
        assertThat(diagram.isBase(combined), is(false));
        assertThat(diagram.isInternal(combined), is(true));
        assertThat(diagram.variableOf(combined), is(FIRST_BASE));
        assertThat(diagram.nodeCount(combined), is(2));
    }

    @ParameterizedTest
    @MethodSource("diagrams")
    public void testReduction(FaultTreeDiagram diagram) {
        int base = diagram.baseNode(FIRST_BASE + 1);
        assertThat(diagram.makeNode(FIRST_BASE, base, base), is(base));
        assertThat(diagram.isConstant(diagram.trueNode()), is(true));
        assertThat(diagram.isConstant(diagram.falseNode()), is(true));
        assertThat(diagram.trueNode(), not(diagram.falseNode()));
    }

    @Test
    public void testRecursiveAndIterativeAgree() throws IOException {
        DiagramConfiguration configuration = ImmutableDiagramConfiguration.builder().build();
        FaultTreeDiagram recursive = DiagramFactory.buildDiagramRecursive(configuration);
        FaultTreeDiagram iterative = DiagramFactory.buildDiagramIterative(configuration);

        for (FaultFormula formula : formulas) {
            StringBuilder recursiveStructure = new StringBuilder();
            StringBuilder iterativeStructure = new StringBuilder();
            DiagramPrinter.print(recursive, formula.toNode(recursive), recursiveStructure);
            DiagramPrinter.print(iterative, formula.toNode(iterative), iterativeStructure);
            assertThat(formula.toString(), iterativeStructure.toString(), is(recursiveStructure.toString()));
        }
        assertThat(iterative.activeNodeCount(), is(recursive.activeNodeCount()));
    }

    @Test
    public void testTableGrowth() {
        FaultTreeDiagram diagram = DiagramFactory.buildDiagram(
                ImmutableDiagramConfiguration.builder().initialSize(2).build());
        int result = diagram.falseNode();
        for (int i = 0; i < 500; i++) {
            result = diagram.or(result, diagram.and(diagram.baseNode(2 * i), diagram.baseNode(2 * i + 1)));
        }
        assertThat(((NodeArena) diagram).check(), is(true));
        assertThat(diagram.nodeCount(result), is(1000));
        assertThat(diagram.evaluate(result, id -> id == 600 || id == 601), is(true));
        assertThat(diagram.evaluate(result, id -> id == 601 || id == 602), is(false));
    }
}
