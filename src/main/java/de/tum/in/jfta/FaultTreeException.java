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
 * Signals that a fault tree cannot be analyzed. No results are produced for a batch which failed
 * with this exception.
 */
public class FaultTreeException extends Exception {
    private static final long serialVersionUID = 1L;

    public FaultTreeException(String message) {
        super(message);
    }

    public FaultTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
