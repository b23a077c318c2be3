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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.infra.Blackhole;

public class CircuitBenchmark extends BaseCircuitBenchmark {
    private static final int EVALUATIONS = 1000;

    @Benchmark
    public static void prune(CircuitState state, Blackhole bh) {
        Circuit circuit = state.circuit();
        circuit.pruneAndTopologicallySortStable();
        bh.consume(circuit.count());
    }

    @Benchmark
    public static void depth(CircuitState state, Blackhole bh) {
        bh.consume(state.circuit().depth());
    }

    @Benchmark
    public static void evaluate(CircuitState state, Blackhole bh) {
        Circuit circuit = state.circuit();
        Random random = new Random(0L);
        List<Integer> input = new ArrayList<>(state.inputCount());
        for (int i = 0; i < EVALUATIONS; i++) {
            input.clear();
            for (int j = 0; j < state.inputCount(); j++) {
                input.add(random.nextInt(2));
            }
            bh.consume(circuit.evaluate(input));
        }
    }

    @Benchmark
    public static void pruneAndEvaluate(CircuitState state, Blackhole bh) {
        state.circuit().pruneAndTopologicallySortStable();
        evaluate(state, bh);
    }
}
