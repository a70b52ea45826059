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
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Runs a complete analysis batch: loads the pages, combines all sub-trees in dependency order and
 * computes the importance measures of the selected sub-trees.
 */
public final class FaultTreeAnalysis {
    private static final Logger logger = Logger.getLogger(FaultTreeAnalysis.class.getName());

    private final AnalysisOptions options;
    @Nullable
    private final Appendable diagnostics;

    public FaultTreeAnalysis(AnalysisOptions options) {
        this(options, null);
    }

    /**
     * @param diagnostics Receives the structure dumps of verbose runs, may be {@code null} if
     *     {@link AnalysisOptions#verbose()} is not set.
     */
    public FaultTreeAnalysis(AnalysisOptions options, @Nullable Appendable diagnostics) {
        Util.checkArgument(!options.verbose() || diagnostics != null, "Verbose analysis needs a diagnostic output");
        this.options = options;
        this.diagnostics = diagnostics;
    }

    public List<SubTreeReport> run(List<SubTreePage> pages) throws FaultTreeException {
        FaultTreeDiagram diagram = DiagramFactory.buildDiagram(options.diagramConfiguration());
        try {
            FaultTree faultTree = new FaultTreeLoader(diagram, options.baseEventThreshold()).load(pages);
            logger.log(Level.INFO, "Total bases: {0}, total sub-trees: {1}", new Object[] {
                faultTree.baseEvents().size(), faultTree.subTrees().size()
            });
            ProbabilityAssignment assignment = forcedAssignment(faultTree.baseEvents());
            DependencyScheduler.Schedule schedule = new DependencyScheduler().schedule(faultTree);

            SensitivityAnalyzer analyzer =
                    new SensitivityAnalyzer(new ProbabilityEvaluator(diagram), faultTree.baseEvents());
            List<SubTreeReport> reports = new ArrayList<>();
            for (SubTree subTree : schedule.order()) {
                if (options.verbose()) {
                    dump(diagram, subTree);
                }
                if (options.isSelected(subTree.name())) {
                    logger.log(Level.FINE, "Analyzing sub-tree {0} with {1} nodes", new Object[] {
                        subTree, diagram.nodeCount(subTree.root())
                    });
                    reports.add(analyzer.analyze(subTree, assignment));
                }
            }
            for (String selected : options.selectedTrees()) {
                if (faultTree.subTreeNamed(selected).isEmpty()) {
                    logger.log(Level.WARNING, "Selected sub-tree {0} does not exist", selected);
                }
            }
            return reports;
        } catch (DiagramCapacityException e) {
            throw new FaultTreeException("Diagram too large: " + e.getMessage(), e);
        } finally {
            if (options.diagramConfiguration().logStatistics()) {
                logger.info(diagram.statistics());
            }
        }
    }

    private ProbabilityAssignment forcedAssignment(BaseEventStore baseEvents) {
        Map<Integer, Double> overrides = new HashMap<>();
        force(baseEvents, options.goodElements(), 0.0d, overrides);
        force(baseEvents, options.badElements(), 1.0d, overrides);
        return baseEvents.overriding(overrides);
    }

    private static void force(
            BaseEventStore baseEvents, Set<String> labels, double probability, Map<Integer, Double> overrides) {
        for (String label : labels) {
            Optional<BaseEvent> event = baseEvents.findByLabel(label);
            if (event.isPresent()) {
                overrides.put(event.get().id(), probability);
            } else {
                logger.log(Level.WARNING, "No base event labelled {0}", label);
            }
        }
    }

    private void dump(FaultTreeDiagram diagram, SubTree subTree) {
        assert diagnostics != null;
        try {
            diagnostics.append(String.format(
                    "%nSub-tree Name: %s, ID: %d, ITE Structure:%n", subTree.name(), subTree.id()));
            DiagramPrinter.print(diagram, subTree.root(), diagnostics);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
