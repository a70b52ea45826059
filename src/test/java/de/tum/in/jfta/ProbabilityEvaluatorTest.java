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
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class ProbabilityEvaluatorTest {
    private static final double EPSILON = 1.0e-12;

    private static ProbabilityAssignment assignment(Map<Integer, Double> probabilities) {
        return ProbabilityAssignment.of(probabilities);
    }

    @Test
    public void testConstants() {
        FaultTreeDiagram diagram = DiagramFactory.buildDiagram();
        ProbabilityEvaluator evaluator = new ProbabilityEvaluator(diagram);
        ProbabilityAssignment none = assignment(Map.of());
        assertThat(evaluator.evaluate(diagram.trueNode(), none), is(1.0d));
        assertThat(evaluator.evaluate(diagram.falseNode(), none), is(0.0d));
    }

    @Test
    public void testBaseArithmetic() {
        FaultTreeDiagram diagram = DiagramFactory.buildDiagram();
        ProbabilityEvaluator evaluator = new ProbabilityEvaluator(diagram);
        Random random = new Random(0L);
        int first = diagram.baseNode(1001);
        int second = diagram.baseNode(1002);
        int and = diagram.and(first, second);
        int or = diagram.or(first, second);

        for (int i = 0; i < 100; i++) {
            double p = random.nextDouble();
            double q = random.nextDouble();
            ProbabilityAssignment probabilities = assignment(Map.of(1001, p, 1002, q));
            assertThat(evaluator.evaluate(first, probabilities), closeTo(p, EPSILON));
            assertThat(evaluator.evaluate(and, probabilities), closeTo(p * q, EPSILON));
            assertThat(evaluator.evaluate(or, probabilities), closeTo(p + q - p * q, EPSILON));
        }
    }

    @Test
    public void testSmallTree() {
        FaultTreeDiagram diagram = DiagramFactory.buildDiagram();
        int root = diagram.or(diagram.baseNode(1001), diagram.and(diagram.baseNode(1002), diagram.baseNode(1003)));
        ProbabilityAssignment probabilities = assignment(Map.of(1001, 0.1, 1002, 0.2, 1003, 0.3));
        assertThat(new ProbabilityEvaluator(diagram).evaluate(root, probabilities), closeTo(0.154, EPSILON));
    }

    @Test
    public void testOverridesDoNotLeak() {
        FaultTreeDiagram diagram = DiagramFactory.buildDiagram();
        ProbabilityEvaluator evaluator = new ProbabilityEvaluator(diagram);
        int root = diagram.and(diagram.baseNode(1001), diagram.baseNode(1002));
        ProbabilityAssignment probabilities = assignment(Map.of(1001, 0.5, 1002, 0.5));

        assertThat(evaluator.evaluate(root, probabilities.with(1001, 1.0d)), closeTo(0.5, EPSILON));
        assertThat(evaluator.evaluate(root, probabilities.overriding(Map.of(1001, 0.0d))), is(0.0d));
        assertThat(evaluator.evaluate(root, probabilities), closeTo(0.25, EPSILON));
        assertThrows(IllegalArgumentException.class, () -> probabilities.with(1001, 1.5d));
    }

    @Test
    public void testRandomFormulas() {
        FaultTreeDiagram diagram = DiagramFactory.buildDiagram();
        ProbabilityEvaluator evaluator = new ProbabilityEvaluator(diagram);
        Random random = new Random(42L);
        ImmutableMap.Builder<Integer, Double> probabilities = ImmutableMap.builder();
        for (int id = 1001; id < 1011; id++) {
            probabilities.put(id, random.nextDouble());
        }
        ProbabilityAssignment assignment = assignment(probabilities.build());

        for (int i = 0; i < 100; i++) {
            FaultFormula formula = FaultFormula.random(random, 1001, 10, 4);
            double expected = formula.bruteForceProbability(assignment);
            assertThat(formula.toString(), evaluator.evaluate(formula.toNode(diagram), assignment), closeTo(expected, 1.0e-9));
        }
    }

    @Test
    public void testDeepChain() {
        int depth = 20_000;
        FaultTreeDiagram diagram = DiagramFactory.buildDiagram(
                ImmutableDiagramConfiguration.builder().iterative(true).build());

        // Built from the last variable, so each step only adds one node on top
        int chain = diagram.falseNode();
        for (int id = depth; id > 0; id--) {
            chain = diagram.or(diagram.baseNode(id), chain);
        }
        // Descends through the whole chain
        int root = diagram.and(chain, diagram.baseNode(depth + 1));
        assertThat(diagram.nodeCount(root), is(depth + 1));

        ProbabilityAssignment assignment = id -> id == depth + 1 ? 0.5d : 0.0d;
        assertThat(new ProbabilityEvaluator(diagram).evaluate(root, assignment), is(0.0d));
        ProbabilityAssignment lastFails = id -> id == depth || id == depth + 1 ? 0.5d : 0.0d;
        assertThat(new ProbabilityEvaluator(diagram).evaluate(root, lastFails), closeTo(0.25, EPSILON));
    }
}
