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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class SensitivityAnalyzerTest {
    private static final double EPSILON = 1.0e-9;

    private final FaultTreeDiagram diagram = DiagramFactory.buildDiagram();
    private final BaseEventStore baseEvents = new BaseEventStore();
    private final SensitivityAnalyzer analyzer =
            new SensitivityAnalyzer(new ProbabilityEvaluator(diagram), baseEvents);

    private int base(int id, double probability, String label) {
        baseEvents.register(ImmutableBaseEvent.builder().id(id).probability(probability).label(label).build());
        return diagram.baseNode(id);
    }

    @Test
    public void testSmallTree() {
        int root = diagram.or(base(1001, 0.1, "pump"), diagram.and(base(1002, 0.2, "valve"), base(1003, 0.3, "pipe")));
        List<BaseImportance> importances = analyzer.analyze(root, baseEvents);

        assertThat(
                importances.stream().map(BaseImportance::baseId).collect(Collectors.toList()),
                contains(1001, 1002, 1003));
        BaseImportance pump = importances.get(0);
        assertThat(pump.label(), is("pump"));
        assertThat(pump.probability(), is(0.1));
        assertThat(pump.ps(), closeTo(1.0, EPSILON));
        assertThat(pump.pes(), closeTo(0.06, EPSILON));
        assertThat(pump.marginalImportance(), closeTo(0.94, EPSILON));
        assertThat(pump.diagnosticImportance(), closeTo(0.1 + 0.1 * 0.9 * 0.94 / 0.154, EPSILON));

        BaseImportance valve = importances.get(1);
        // Pr[top | valve] = 0.1 + 0.9 * 0.3, Pr[top | no valve] = 0.1
        assertThat(valve.marginalImportance(), closeTo(0.27, EPSILON));

        // Analysis leaves the base events untouched
        assertThat(baseEvents.probability(1001), is(0.1));
    }

    @Test
    public void testZeroSystemProbability() {
        int root = diagram.and(base(1001, 0.0, "a"), base(1002, 0.4, "b"));
        List<BaseImportance> importances = analyzer.analyze(root, baseEvents);

        BaseImportance b = importances.get(1);
        assertThat(b.baseId(), is(1002));
        assertThat(b.diagnosticImportance(), is(0.4));
        assertThat(b.marginalImportance(), is(0.0));
        assertThat(importances.get(0).marginalImportance(), closeTo(0.4, EPSILON));
    }

    @Test
    public void testConstantRootHasNoImportances() {
        assertThat(analyzer.analyze(diagram.trueNode(), baseEvents), is(empty()));
        assertThat(analyzer.baseEventsOf(diagram.falseNode()), is(empty()));
    }

    @Test
    public void testForcedAssignment() {
        int root = diagram.or(base(1001, 0.1, "a"), base(1002, 0.2, "b"));
        ProbabilityAssignment forced = baseEvents.overriding(Map.of(1002, 1.0d));
        List<BaseImportance> importances = analyzer.analyze(root, forced);

        assertThat(importances.get(0).marginalImportance(), is(0.0));
        assertThat(importances.get(1).probability(), is(1.0));
        assertThat(importances.get(1).diagnosticImportance(), is(1.0));
    }

    @Test
    public void testMarginalImportanceMatchesBruteForce() {
        Random random = new Random(7L);
        for (int id = 1001; id <= 1010; id++) {
            base(id, random.nextDouble(), "b" + id);
        }
        for (int i = 0; i < 50; i++) {
            FaultFormula formula = FaultFormula.random(random, 1001, 10, 4);
            int root = formula.toNode(diagram);
            double system = formula.bruteForceProbability(baseEvents);

            for (BaseImportance importance : analyzer.analyze(root, baseEvents)) {
                int id = importance.baseId();
                double failed = formula.bruteForceProbability(baseEvents.with(id, 1.0d));
                double working = formula.bruteForceProbability(baseEvents.with(id, 0.0d));
                assertThat(formula + " at " + id, importance.marginalImportance(), closeTo(failed - working, EPSILON));

                double p = importance.probability();
                double expected = system == 0.0d ? p : p + p * (1.0d - p) * (failed - working) / system;
                assertThat(formula + " at " + id, importance.diagnosticImportance(), closeTo(expected, 1.0e-6));
            }
        }
    }
}
