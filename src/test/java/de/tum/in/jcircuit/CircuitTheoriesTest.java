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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks the structural and semantic properties of pruning, marking and evaluation on random
 * circuits.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class CircuitTheoriesTest {
    private static final Logger logger = Logger.getLogger(CircuitTheoriesTest.class.getName());
    private static final int instanceCount = 40;
    private static final int maxInputs = 7;

    public static Stream<CircuitGenerator.Parameters> parameters() {
        return IntStream.range(0, instanceCount).mapToObj(seed -> new CircuitGenerator.Parameters(
                seed, seed % (maxInputs + 1), 10 + 7 * seed, 1 + seed % 3));
    }

    private static List<List<?>> evaluateAll(Circuit circuit, int inputCount) {
        List<List<?>> results = new ArrayList<>(1 << inputCount);
        PowerIterator iterator = new PowerIterator(inputCount);
        while (iterator.hasNext()) {
            int[] bits = iterator.next();
            results.add(circuit.evaluate(IntStream.of(bits).boxed().collect(Collectors.toList())));
        }
        return results;
    }

    private static Set<Gate> reachable(Iterable<Gate> roots) {
        Set<Gate> reached = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Gate> queue = new ArrayDeque<>();
        for (Gate root : roots) {
            if (reached.add(root)) {
                queue.add(root);
            }
        }
        while (!queue.isEmpty()) {
            for (Gate input : queue.poll().inputs()) {
                if (reached.add(input)) {
                    queue.add(input);
                }
            }
        }
        return reached;
    }

    @ParameterizedTest
    @MethodSource("parameters")
    public void testEvaluationMatchesReference(CircuitGenerator.Parameters parameters) {
        CircuitGenerator.Instance instance = CircuitGenerator.generate(parameters);
        PowerIterator iterator = new PowerIterator(parameters.inputCount);
        while (iterator.hasNext()) {
            int[] bits = iterator.next();
            List<?> expected = instance.reference(bits);
            List<Integer> input = IntStream.of(bits).boxed().collect(Collectors.toList());
            assertThat(instance.circuit.evaluate(input), is(expected));
        }
    }

    @ParameterizedTest
    @MethodSource("parameters")
    public void testPrunePreservesSemantics(CircuitGenerator.Parameters parameters) {
        CircuitGenerator.Instance instance = CircuitGenerator.generate(parameters);
        Circuit circuit = instance.circuit;
        List<List<?>> before = evaluateAll(circuit, parameters.inputCount);
        int sizeBefore = circuit.count();

        circuit.pruneAndTopologicallySortStable();
        logger.log(Level.FINE, "Pruned {0} to {1} of {2} gates",
                new Object[] {parameters, circuit.count(), sizeBefore});
        assertThat(evaluateAll(circuit, parameters.inputCount), is(before));
        assertThat(circuit.count(Gate::isInput), is(parameters.inputCount));
        assertThat(circuit.count(Gate::isOutput), is(parameters.outputCount));

        circuit.pruneAndTopologicallySortStable();
        assertThat(evaluateAll(circuit, parameters.inputCount), is(before));
    }

    @ParameterizedTest
    @MethodSource("parameters")
    public void testPruneKeepsExactlyInputsAndReachableGates(CircuitGenerator.Parameters parameters) {
        CircuitGenerator.Instance instance = CircuitGenerator.generate(parameters);
        Set<Gate> expected = reachable(instance.outputs);
        expected.addAll(instance.inputs);

        instance.circuit.pruneAndTopologicallySortStable();
        Set<Gate> survivors = Collections.newSetFromMap(new IdentityHashMap<>());
        instance.circuit.gates().forEach(survivors::add);
        assertThat(survivors, is(expected));
        assertThat(instance.circuit.count(), is(expected.size()));
    }

    @ParameterizedTest
    @MethodSource("parameters")
    public void testPruneIsStableAndSorted(CircuitGenerator.Parameters parameters) {
        CircuitGenerator.Instance instance = CircuitGenerator.generate(parameters);
        GateCollection gates = instance.circuit.gates();
        List<Gate> original = gates.stream().collect(Collectors.toList());

        instance.circuit.pruneAndTopologicallySortStable();
        assertThat(gates.check(), is(true));

        int inputs = instance.inputs.size();
        int size = gates.size();
        for (int i = 0; i < inputs; i++) {
            assertThat(gates.get(i), sameInstance(instance.inputs.get(i)));
        }
        // Pass-through gates stay with the inputs
        List<Gate> outputs = instance.outputs.stream().filter(gate -> !gate.isInput()).collect(Collectors.toList());
        for (int i = 0; i < outputs.size(); i++) {
            Gate output = gates.get(size - outputs.size() + i);
            assertThat(output, sameInstance(outputs.get(i)));
            assertThat(output.outputs().isEmpty(), is(true));
        }

        // Interior gates keep their relative order
        int previous = -1;
        for (int i = inputs; i < size - outputs.size(); i++) {
            int originalIndex = original.indexOf(gates.get(i));
            assertThat(previous < originalIndex, is(true));
            previous = originalIndex;
        }
    }

    @ParameterizedTest
    @MethodSource("parameters")
    public void testPruneIsIdempotent(CircuitGenerator.Parameters parameters) {
        Circuit circuit = CircuitGenerator.generate(parameters).circuit;
        circuit.pruneAndTopologicallySortStable();
        List<List<Object>> pruned = circuit.gates().toCanonical();
        circuit.pruneAndTopologicallySortStable();
        assertThat(circuit.gates().toCanonical(), is(pruned));
    }

    @ParameterizedTest
    @MethodSource("parameters")
    public void testMarkCountsReachableGates(CircuitGenerator.Parameters parameters) {
        CircuitGenerator.Instance instance = CircuitGenerator.generate(parameters);
        GateCollection gates = instance.circuit.gates();
        Gate output = instance.outputs.get(0);

        gates.unmarkAll();
        Set<Gate> expected = reachable(List.of(output));
        assertThat(GateCollection.mark(output), is(expected.size()));
        assertThat(GateCollection.mark(output), is(0));
        for (Gate gate : gates) {
            assertThat(gate.isMarked(), is(expected.contains(gate)));
        }
        gates.unmarkAll();
        assertThat(gates.stream().noneMatch(Gate::isMarked), is(true));
    }

    @ParameterizedTest
    @MethodSource("parameters")
    public void testDepthDoesNotIncrease(CircuitGenerator.Parameters parameters) {
        Circuit circuit = CircuitGenerator.generate(parameters).circuit;
        int depth = circuit.depth();
        int xorDepth = circuit.depth(gate -> gate.operation().equals(Operation.XOR));
        circuit.pruneAndTopologicallySortStable();
        assertThat(circuit.depth(), lessThanOrEqualTo(depth));
        assertThat(circuit.depth(gate -> gate.operation().equals(Operation.XOR)), lessThanOrEqualTo(xorDepth));
    }

    @ParameterizedTest
    @MethodSource("parameters")
    public void testToOperationMatchesReference(CircuitGenerator.Parameters parameters) {
        assumeTrue(parameters.outputCount == 1);
        CircuitGenerator.Instance instance = CircuitGenerator.generate(parameters);
        Operation operation = instance.circuit.toOperation();
        assertThat(operation.arity(), is(parameters.inputCount));

        PowerIterator iterator = new PowerIterator(parameters.inputCount);
        while (iterator.hasNext()) {
            int[] bits = iterator.next();
            assertThat(operation.apply(bits), is(instance.reference(bits).get(0)));
        }
    }
}
