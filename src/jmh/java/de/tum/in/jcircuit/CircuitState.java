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

import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class CircuitState {
    @Param({"16"})
    private int inputCount;

    @Param({"10000", "100000"})
    private int gateCount;

    @Param({"false", "true"})
    private boolean checkIntegrity;

    @SuppressWarnings("NotNullFieldNotInitialized")
    private Circuit circuit;

    @Setup(Level.Iteration)
    public void setUpCircuit() {
        circuit = CircuitFactory.buildCircuit(ImmutableCircuitConfiguration.builder()
                .checkIntegrity(checkIntegrity)
                .build());
        CircuitGenerator.generate(circuit, new CircuitGenerator.Parameters(0L, inputCount, gateCount, 8));
    }

    public Circuit circuit() {
        return circuit;
    }

    public int inputCount() {
        return inputCount;
    }
}
