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

public final class DiagramFactory {
    private DiagramFactory() {}

    public static FaultTreeDiagram buildDiagram() {
        return buildDiagram(ImmutableDiagramConfiguration.builder().build());
    }

    public static FaultTreeDiagram buildDiagram(DiagramConfiguration configuration) {
        return new DiagramImpl(configuration);
    }

    public static FaultTreeDiagram buildDiagramRecursive(DiagramConfiguration configuration) {
        return buildDiagram(false, configuration);
    }

    public static FaultTreeDiagram buildDiagramIterative(DiagramConfiguration configuration) {
        return buildDiagram(true, configuration);
    }

    public static FaultTreeDiagram buildDiagram(boolean iterative, DiagramConfiguration configuration) {
        return new DiagramImpl(ImmutableDiagramConfiguration.builder()
                .from(configuration)
                .iterative(iterative)
                .build());
    }
}
