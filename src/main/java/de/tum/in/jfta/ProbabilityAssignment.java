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

import java.util.Map;

/**
 * Assigns a failure probability to every base event id. Implementations must be pure, so that
 * evaluations under different assignments never interfere.
 */
@FunctionalInterface
public interface ProbabilityAssignment {
    double probability(int baseId);

    /**
     * Returns an assignment which agrees with this one except for {@code baseId}, which is assigned
     * {@code probability}.
     */
    default ProbabilityAssignment with(int baseId, double probability) {
        checkProbability(probability);
        return id -> id == baseId ? probability : this.probability(id);
    }

    /**
     * Returns an assignment which agrees with this one except for the ids contained in
     * {@code overrides}.
     */
    default ProbabilityAssignment overriding(Map<Integer, Double> overrides) {
        if (overrides.isEmpty()) {
            return this;
        }
        overrides.values().forEach(ProbabilityAssignment::checkProbability);
        Map<Integer, Double> copy = Map.copyOf(overrides);
        return id -> {
            Double override = copy.get(id);
            return override == null ? this.probability(id) : override;
        };
    }

    static ProbabilityAssignment of(Map<Integer, Double> probabilities) {
        probabilities.values().forEach(ProbabilityAssignment::checkProbability);
        Map<Integer, Double> copy = Map.copyOf(probabilities);
        return id -> {
            Double probability = copy.get(id);
            if (probability == null) {
                throw new IllegalArgumentException("No probability assigned to base event " + id);
            }
            return probability;
        };
    }

    static void checkProbability(double probability) {
        Util.checkArgument(0.0d <= probability && probability <= 1.0d, "Invalid probability %f", probability);
    }
}
