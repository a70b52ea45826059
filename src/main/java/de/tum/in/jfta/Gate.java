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

import java.util.Locale;
import java.util.Optional;

/**
 * The logical gate combining the members of a sub-tree.
 */
public enum Gate {
    AND(0),
    OR(1);

    private final int logicalType;

    Gate(int logicalType) {
        this.logicalType = logicalType;
    }

    /**
     * Returns the numeric code used for this gate in the {@code LogicalType} parameter of a page.
     */
    public int logicalType() {
        return logicalType;
    }

    /**
     * Returns the value which, as one operand, determines the result of the gate regardless of the
     * other operand ({@code false} for AND, {@code true} for OR).
     */
    public boolean absorbingValue() {
        return this == OR;
    }

    public static Optional<Gate> ofLogicalType(int logicalType) {
        for (Gate gate : values()) {
            if (gate.logicalType == logicalType) {
                return Optional.of(gate);
            }
        }
        return Optional.empty();
    }

    /**
     * Tries to interpret a free-text gate description such as {@code "AND gate"} or {@code "or"}.
     * Descriptions mentioning neither or both gate names are not recognized.
     */
    public static Optional<Gate> ofDescription(String description) {
        String normalized = description.toUpperCase(Locale.ROOT);
        boolean and = normalized.matches(".*\\bAND\\b.*");
        boolean or = normalized.matches(".*\\bOR\\b.*");
        if (and == or) {
            return Optional.empty();
        }
        return Optional.of(and ? AND : OR);
    }
}
