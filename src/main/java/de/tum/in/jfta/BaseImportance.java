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

import org.immutables.value.Value;

/**
 * Importance measures of one base event with respect to the top event of one sub-tree.
 */
@Value.Immutable
public abstract class BaseImportance {
    public abstract int baseId();

    public abstract String label();

    /**
     * The probability of the base event used in the analysis.
     */
    public abstract double probability();

    /**
     * Diagnostic importance factor, the probability that the base event failed given that the top
     * event occurred.
     */
    public abstract double diagnosticImportance();

    /**
     * Marginal importance factor, {@code ps - pes}.
     */
    public abstract double marginalImportance();

    /**
     * Probability of the top event if the base event certainly fails.
     */
    public abstract double ps();

    /**
     * Probability of the top event if the base event certainly does not fail.
     */
    public abstract double pes();

    public abstract String description();

    public abstract String guidance();
}
