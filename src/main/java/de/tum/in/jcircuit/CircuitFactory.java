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

public final class CircuitFactory {
    private CircuitFactory() {}

    public static Circuit buildCircuit() {
        return buildCircuit(ImmutableCircuitConfiguration.builder().build());
    }

    public static Circuit buildCircuit(Signature signature) {
        return buildCircuit(ImmutableCircuitConfiguration.builder().signature(signature).build());
    }

    public static Circuit buildCircuit(CircuitConfiguration configuration) {
        return new CircuitImpl(configuration);
    }
}
