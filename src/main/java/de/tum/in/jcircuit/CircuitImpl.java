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

import static de.tum.in.jcircuit.Util.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

final class CircuitImpl implements Circuit {
    private static final Logger logger = Logger.getLogger(CircuitImpl.class.getName());

    private final GateCollection gates = new GateCollection();
    // Input and output gates in order of creation, these are never pruned
    private final List<Gate> inputGates = new ArrayList<>();
    private final List<Gate> outputGates = new ArrayList<>();
    private final boolean checkIntegrity;
    private final boolean logStatistics;
    private Signature signature;

    CircuitImpl(CircuitConfiguration configuration) {
        this.signature = configuration.signature();
        this.checkIntegrity = configuration.checkIntegrity();
        this.logStatistics = configuration.logStatistics();
    }

    @Override
    public GateCollection gates() {
        return gates;
    }

    @Override
    public Signature signature() {
        return signature;
    }

    @Override
    public void setSignature(Signature signature) {
        this.signature = Objects.requireNonNull(signature);
    }

    @Override
    public Gate addGate(Operation operation, @Nullable List<Gate> inputs, boolean isInput, boolean isOutput) {
        if (inputs != null) {
            for (Gate input : inputs) {
                if (input == null) {
                    throw new CircuitException.ArityMismatch("circuit gate inputs must be explicitly identified gates");
                }
                if (!gates.contains(input)) {
                    throw new CircuitException("circuit gate input " + input + " is not a gate of this circuit");
                }
            }
        }

        if (isInput) {
            if (inputs != null && !inputs.isEmpty()) {
                throw new CircuitException.ArityMismatch("input gates cannot have inputs");
            }
        } else {
            if (inputs == null && operation.arity() > 0) {
                throw new CircuitException.ArityMismatch("non-input circuit gate must have its inputs specified");
            }
            if (inputs != null && inputs.size() != operation.arity()) {
                throw new CircuitException.ArityMismatch(String.format(
                        "number of circuit gate inputs must match arity of gate operation (%d for %s)",
                        inputs.size(), operation));
            }
        }

        Gate gate = gates.addGate(operation, inputs, isInput, isOutput);
        if (isInput) {
            inputGates.add(gate);
        }
        if (isOutput) {
            outputGates.add(gate);
        }
        return gate;
    }

    @Override
    public int count(Predicate<Gate> predicate) {
        return (int) gates.stream().filter(predicate).count();
    }

    @Override
    public int depth(Predicate<Gate> predicate) {
        int[] depths = new int[gates.size()];
        int depth = 0;
        for (int index = 0; index < depths.length; index++) {
            Gate gate = gates.get(index);
            int inputDepth = 0;
            for (Gate input : gate.inputs()) {
                assert input.position() < index;
                inputDepth = Math.max(inputDepth, depths[input.position()]);
            }
            depths[index] = (predicate.test(gate) ? 1 : 0) + inputDepth;
            depth = Math.max(depth, depths[index]);
        }
        return depth;
    }

    @Override
    public void pruneAndTopologicallySortStable() {
        gates.pruneAndTopologicallySortStable();
        if (checkIntegrity) {
            gates.check();
        }
        if (logStatistics && logger.isLoggable(Level.INFO)) {
            logger.info(statistics());
        }
    }

    @Override
    public List<?> evaluate(List<?> input) {
        return signature.output(evaluate(signature.input(input)));
    }

    /**
     * Evaluates the circuit on a flat input. The bits are assigned to the input gates in the order
     * they were added, the output bits are those of the output gates in the order they were added.
     */
    int[] evaluate(int[] input) {
        if (input.length != inputGates.size()) {
            throw new CircuitException.ArityMismatch(String.format(
                    "input of %d bits does not match the %d input gates", input.length, inputGates.size()));
        }

        int size = gates.size();
        int[] wire = new int[size];
        for (int i = 0; i < input.length; i++) {
            wire[inputGates.get(i).position()] = input[i];
        }
        for (int index = 0; index < size; index++) {
            Gate gate = gates.get(index);
            if (gate.isInput() || !gate.isComputed()) {
                continue;
            }
            List<Gate> inputs = gate.inputs();
            int[] arguments = new int[inputs.size()];
            for (int i = 0; i < arguments.length; i++) {
                arguments[i] = wire[inputs.get(i).position()];
            }
            wire[index] = gate.operation().apply(arguments);
        }

        int[] output = new int[outputGates.size()];
        for (int i = 0; i < output.length; i++) {
            output[i] = wire[outputGates.get(i).position()];
        }
        return output;
    }

    @Override
    public Operation toOperation() {
        if (outputGates.size() != 1) {
            throw new CircuitException.ArityMismatch("circuit must have exactly one output gate");
        }
        int inputs = inputGates.size();
        checkState(inputs < Integer.SIZE - 1, "Too many inputs (%d) for a truth table", inputs);

        int[] table = new int[1 << inputs];
        PowerIterator iterator = new PowerIterator(inputs);
        for (int row = 0; row < table.length; row++) {
            // Rows are grouped like a regular input, which fails if the signature does not fit
            int[] bits = signature.input(signature.formatInput(iterator.next()));
            table[row] = evaluate(bits)[0];
        }
        return Operation.of(table);
    }

    @Override
    public String statistics() {
        return String.format("Gates: %d (%d inputs, %d outputs, %d constants), depth: %d",
                gates.size(),
                count(Gate::isInput),
                count(Gate::isOutput),
                count(gate -> gate.operation().isNullary()),
                depth());
    }

    @Override
    public String toString() {
        return "Circuit" + gates;
    }
}
