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
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the marginal (MIF) and diagnostic (DIF) importance factors of the base events of a
 * diagram. Perturbed probabilities are passed as overriding assignments, base events are never
 * modified.
 */
public final class SensitivityAnalyzer {
    private static final Logger logger = Logger.getLogger(SensitivityAnalyzer.class.getName());

    private final ProbabilityEvaluator evaluator;
    private final BaseEventStore baseEvents;

    public SensitivityAnalyzer(ProbabilityEvaluator evaluator, BaseEventStore baseEvents) {
        this.evaluator = evaluator;
        this.baseEvents = baseEvents;
    }

    /**
     * Returns the base events below {@code root} in discovery order.
     */
    public List<Integer> baseEventsOf(int root) {
        List<Integer> ids = new ArrayList<>();
        evaluator.diagram().forEachBaseEvent(root, ids::add);
        return ids;
    }

    public List<BaseImportance> analyze(int root, ProbabilityAssignment assignment) {
        double systemProbability = evaluator.evaluate(root, assignment);
        List<Integer> ids = baseEventsOf(root);
        List<BaseImportance> importances = new ArrayList<>(ids.size());

        for (int id : ids) {
            double probability = assignment.probability(id);
            double ps = evaluator.evaluate(root, assignment.with(id, 1.0d));
            double pes = evaluator.evaluate(root, assignment.with(id, 0.0d));
            double marginal = ps - pes;
            // Without any chance of the top event, the base event tells nothing about it
            double diagnostic = systemProbability == 0.0d
                    ? probability
                    : probability + probability * (1.0d - probability) * marginal / systemProbability;

            BaseEvent event = baseEvents.require(id);
            importances.add(ImmutableBaseImportance.builder()
                    .baseId(id)
                    .label(event.label())
                    .probability(probability)
                    .diagnosticImportance(diagnostic)
                    .marginalImportance(marginal)
                    .ps(ps)
                    .pes(pes)
                    .description(event.description())
                    .guidance(event.guidance())
                    .build());

            if (logger.isLoggable(Level.FINER)) {
                logger.log(
                        Level.FINER,
                        String.format(
                                "Base %d: prob=%.6f, ps=%.6f, pes=%.6f, MIF=%.6f, DIF=%.6f",
                                id, probability, ps, pes, marginal, diagnostic));
            }
        }
        return importances;
    }

    public SubTreeReport analyze(SubTree subTree, ProbabilityAssignment assignment) {
        int root = subTree.root();
        SubTreePage page = subTree.page();
        return ImmutableSubTreeReport.builder()
                .id(page.id())
                .treeName(page.treeName())
                .description(page.description())
                .logicalType(page.logicalType())
                .logicalTypeDescription(page.logicalTypeDescription())
                .systemProbability(evaluator.evaluate(root, assignment))
                .importances(analyze(root, assignment))
                .build();
    }
}
