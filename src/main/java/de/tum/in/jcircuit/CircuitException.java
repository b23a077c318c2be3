/*
 * This file is part of JCircuit.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JCircuit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JCircuit is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JCircuit. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jcircuit;

/**
 * Base class of all errors raised when a circuit is built or evaluated incorrectly. Each of these
 * signals a programming error of the caller, a failed call never leaves partial changes behind.
 */
public class CircuitException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public CircuitException(String message) {
        super(message);
    }

    /**
     * A gate is designated as input or output gate, but its operation is not the identity.
     */
    public static final class InvalidRole extends CircuitException {
        private static final long serialVersionUID = 1L;

        public InvalidRole(String message) {
            super(message);
        }
    }

    /**
     * An output gate is used as input of another gate.
     */
    public static final class DanglingOutputReuse extends CircuitException {
        private static final long serialVersionUID = 1L;

        public DanglingOutputReuse(String message) {
            super(message);
        }
    }

    /**
     * The number of gate inputs does not match the operation arity, or the length of a bit
     * vector does not match what a circuit or signature expects.
     */
    public static final class ArityMismatch extends CircuitException {
        private static final long serialVersionUID = 1L;

        public ArityMismatch(String message) {
            super(message);
        }
    }

    /**
     * A value is not a well-formed (possibly grouped) bit vector.
     */
    public static final class ShapeMismatch extends CircuitException {
        private static final long serialVersionUID = 1L;

        public ShapeMismatch(String message) {
            super(message);
        }
    }
}
