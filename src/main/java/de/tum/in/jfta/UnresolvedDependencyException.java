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

/**
 * A sub-tree member refers to a sub-tree id which no page defines.
 */
public class UnresolvedDependencyException extends FaultTreeException {
    private static final long serialVersionUID = 1L;

    private final String treeName;
    private final int memberIndex;
    private final int referencedId;

    public UnresolvedDependencyException(String treeName, int memberIndex, int referencedId) {
        super(String.format(
                "No sub-tree found for member %d (id %d) of sub-tree %s", memberIndex, referencedId, treeName));
        this.treeName = treeName;
        this.memberIndex = memberIndex;
        this.referencedId = referencedId;
    }

    public String treeName() {
        return treeName;
    }

    public int memberIndex() {
        return memberIndex;
    }

    public int referencedId() {
        return referencedId;
    }
}
