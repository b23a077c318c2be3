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

import org.immutables.value.Value;

@Value.Immutable
public class CircuitConfiguration {
    /**
     * The signature a new circuit starts with.
     */
    @Value.Default
    public Signature signature() {
        return Signature.flat();
    }

    /**
     * Whether to run the (expensive) integrity check of the gate collection after each
     * canonicalization.
     */
    @Value.Default
    public boolean checkIntegrity() {
        return false;
    }

    @Value.Default
    public boolean logStatistics() {
        return false;
    }
}
