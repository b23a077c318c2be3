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
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.infra.Blackhole;

public class SyntheticBenchmark extends BaseCircuitBenchmark {
    private static final int ADDER_BITS = 1024;

    /**
     * Builds a ripple-carry adder of two numbers with the given number of bits, most significant
     * bit first.
     */
    static Circuit makeAdder(int bits) {
        Circuit circuit = CircuitFactory.buildCircuit(Signature.of(List.of(bits, bits), List.of(bits + 1)));
        List<Gate> left = new ArrayList<>(bits);
        List<Gate> right = new ArrayList<>(bits);
        for (int i = 0; i < bits; i++) {
            left.add(circuit.addInput());
        }
        for (int i = 0; i < bits; i++) {
            right.add(circuit.addInput());
        }

        Gate[] sum = new Gate[bits];
        Gate carry = circuit.addGate(Operation.FALSE);
        for (int i = bits - 1; i >= 0; i--) {
            Gate half = circuit.addGate(Operation.XOR, left.get(i), right.get(i));
            sum[i] = circuit.addGate(Operation.XOR, half, carry);
            carry = circuit.addGate(Operation.OR,
                    circuit.addGate(Operation.AND, left.get(i), right.get(i)),
                    circuit.addGate(Operation.AND, half, carry));
        }
        circuit.addOutput(carry);
        for (Gate gate : sum) {
            circuit.addOutput(gate);
        }
        return circuit;
    }

    @Benchmark
    public static void binaryAdder(Blackhole bh) {
        Circuit circuit = makeAdder(ADDER_BITS);
        circuit.pruneAndTopologicallySortStable();
        bh.consume(circuit.depth());
    }

    @Benchmark
    public static void binaryAdderEvaluation(Blackhole bh) {
        Circuit circuit = makeAdder(ADDER_BITS);
        List<Integer> operand = new ArrayList<>(ADDER_BITS);
        for (int i = 0; i < ADDER_BITS; i++) {
            operand.add(i % 2);
        }
        bh.consume(circuit.evaluate(List.of(operand, operand)));
    }
}
