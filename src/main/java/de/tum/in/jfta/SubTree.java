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

import java.util.List;

/**
 * A gate of the fault tree over base events and other sub-trees, together with its diagram once
 * it has been combined.
 */
public final class SubTree {
    public enum State {
        /* Some referenced sub-tree is not computed yet */
        PENDING,
        /* All referenced sub-trees are computed */
        READY,
        COMPUTED
    }

    /**
     * A member of a sub-tree, either a base event or a reference to another sub-tree.
     */
    public static final class Member {
        private final int id;
        private final boolean base;

        private Member(int id, boolean base) {
            this.id = id;
            this.base = base;
        }

        public static Member base(int baseId) {
            return new Member(baseId, true);
        }

        public static Member reference(int subTreeId) {
            return new Member(subTreeId, false);
        }

        public int id() {
            return id;
        }

        public boolean isBase() {
            return base;
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Member)) {
                return false;
            }
            Member other = (Member) object;
            return id == other.id && base == other.base;
        }

        @Override
        public int hashCode() {
            return 31 * id + (base ? 1 : 0);
        }

        @Override
        public String toString() {
            return (base ? "base " : "tree ") + id;
        }
    }

    private final SubTreePage page;
    private final Gate gate;
    private final List<Member> members;
    private State state = State.PENDING;
    private int root;

    SubTree(SubTreePage page, Gate gate, List<Member> members) {
        Util.checkArgument(!members.isEmpty(), "Sub-tree %s has no members", page.treeName());
        this.page = page;
        this.gate = gate;
        this.members = List.copyOf(members);
    }

    public int id() {
        return page.id();
    }

    public String name() {
        return page.treeName();
    }

    public SubTreePage page() {
        return page;
    }

    public Gate gate() {
        return gate;
    }

    public List<Member> members() {
        return members;
    }

    public boolean isAllBase() {
        return members.stream().allMatch(Member::isBase);
    }

    public State state() {
        return state;
    }

    public boolean isComputed() {
        return state == State.COMPUTED;
    }

    /**
     * Returns the combined diagram of this sub-tree.
     *
     * @throws IllegalStateException if the sub-tree is not computed yet.
     */
    public int root() {
        Util.checkState(isComputed(), "Sub-tree %s is not computed", name());
        return root;
    }

    void markReady() {
        Util.checkState(state == State.PENDING, "Sub-tree %s is %s", name(), state);
        state = State.READY;
    }

    void setRoot(int root) {
        Util.checkState(state == State.READY, "Sub-tree %s is %s", name(), state);
        this.root = root;
        this.state = State.COMPUTED;
    }

    @Override
    public String toString() {
        return String.format("%s (%d, %s, %s)", name(), id(), gate, state);
    }
}
