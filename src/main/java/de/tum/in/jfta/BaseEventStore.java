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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * The table of all base events of a fault tree, unique by id. The first registered event with a
 * given id is canonical, later registrations return it.
 */
public final class BaseEventStore implements ProbabilityAssignment {
    private static final Logger logger = Logger.getLogger(BaseEventStore.class.getName());

    private final Map<Integer, BaseEvent> events = new LinkedHashMap<>();

    /**
     * Registers the given event unless an event with the same id is already known.
     *
     * @return The canonical event with the id of {@code event}.
     */
    public BaseEvent register(BaseEvent event) {
        BaseEvent existing = events.putIfAbsent(event.id(), event);
        if (existing == null) {
            return event;
        }
        if (Double.compare(existing.probability(), event.probability()) != 0) {
            logger.log(Level.WARNING, "Base event {0} redefined with probability {1}, keeping {2}", new Object[] {
                event.id(), event.probability(), existing.probability()
            });
        }
        return existing;
    }

    @Nullable
    public BaseEvent get(int id) {
        return events.get(id);
    }

    public BaseEvent require(int id) {
        BaseEvent event = events.get(id);
        if (event == null) {
            throw new IllegalArgumentException("Unknown base event " + id);
        }
        return event;
    }

    public Optional<BaseEvent> findByLabel(String label) {
        return events.values().stream()
                .filter(event -> event.label().equals(label))
                .findFirst();
    }

    public Collection<BaseEvent> events() {
        return Collections.unmodifiableCollection(events.values());
    }

    public int size() {
        return events.size();
    }

    @Override
    public double probability(int baseId) {
        return require(baseId).probability();
    }
}
