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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import javax.annotation.Nullable;

/**
 * A gate graph together with a {@link Signature}.
 *
 * <p>Every input and every output of a circuit is represented by a dedicated identity gate. This
 * way, the number and order of inputs and outputs is always well-defined, even if no signature is
 * given. Output gates cannot be used as inputs of other gates.</p>
 *
 * <p>A typical life cycle is: add gates, call {@link #pruneAndTopologicallySortStable()} once, then
 * {@link #evaluate(List) evaluate} arbitrarily often. Implementations are not thread-safe.</p>
 */
public interface Circuit {
    /**
     * The gates of this circuit. The collection must not be modified directly.
     */
    GateCollection gates();

    Signature signature();

    /**
     * Replaces the signature. This only affects how subsequent evaluations interpret their input
     * and format their output.
     */
    void setSignature(Signature signature);

    /**
     * Adds a gate to this circuit.
     *
     * @param operation The operation of the gate.
     * @param inputs The input gates, which have to be gates of this circuit. Must match the
     *     operation's arity unless the gate is an input gate, in which case it has to be empty or
     *     {@code null}. May be {@code null} for nullary operations.
     * @param isInput Whether this is an input gate.
     * @param isOutput Whether this is an output gate.
     * @return The new gate.
     * @throws CircuitException If the gate is invalid. Nothing is changed in this case.
     */
    Gate addGate(Operation operation, @Nullable List<Gate> inputs, boolean isInput, boolean isOutput);

    default Gate addGate(Operation operation, Gate... inputs) {
        return addGate(operation, Arrays.asList(inputs), false, false);
    }

    default Gate addInput() {
        return addGate(Operation.IDENTITY, null, true, false);
    }

    default Gate addOutput(Gate gate) {
        return addGate(Operation.IDENTITY, Collections.singletonList(gate), false, true);
    }

    /**
     * Counts the gates satisfying the given predicate.
     */
    int count(Predicate<Gate> predicate);

    default int count() {
        return count(gate -> true);
    }

    /**
     * Computes the maximal number of gates satisfying {@code predicate} on any path through the
     * circuit. For example, {@code depth(gate -> gate.operation().equals(Operation.AND))} yields
     * the AND-depth.
     */
    int depth(Predicate<Gate> predicate);

    /**
     * Computes the length of the longest path, counting every gate (including input, output and
     * constant gates).
     */
    default int depth() {
        return depth(gate -> true);
    }

    /**
     * Removes every interior gate from which no output gate is reachable and sorts the gates
     * topologically, inputs first and outputs last. The relative order of input gates and of output
     * gates is retained, so signatures stay valid. A gate which is both an input and an output gate
     * stays with the inputs.
     */
    void pruneAndTopologicallySortStable();

    /**
     * Evaluates this circuit. Input bits are assigned to the input gates and output bits are read
     * from the output gates, both in the order in which the gates were added.
     *
     * @param input The input, formatted according to the input format of the signature.
     * @return The output, formatted according to the output format of the signature.
     * @throws CircuitException If the input does not match the signature or the number of input
     *     gates.
     */
    List<?> evaluate(List<?> input);

    /**
     * Computes the boolean function of this circuit. The running time is exponential in the number
     * of input gates.
     *
     * @throws CircuitException.ArityMismatch If the circuit does not have exactly one output gate.
     */
    Operation toOperation();

    /**
     * Returns a string containing some statistics about the circuit. The content and formatting of
     * this string may change and are only intended as human-readable output.
     */
    String statistics();
}
