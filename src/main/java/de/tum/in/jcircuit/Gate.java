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
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A single node of a gate graph. Gates are created through {@link GateCollection#addGate} (or
 * {@link Circuit#addGate}) and can only refer to gates which already exist, hence every gate graph
 * is acyclic by construction.
 *
 * <p>The list of outputs is derived: whenever a gate is created, it is appended to the outputs of
 * each of its inputs. The position and the mark are bookkeeping of the owning collection.</p>
 */
public final class Gate {
    private final Operation operation;
    private final List<Gate> inputs;
    private final List<Gate> outputs = new ArrayList<>();
    private final boolean isInput;
    private final boolean isOutput;
    private int position = -1;
    /* Scratch flag of a marking pass, only meaningful between unmarkAll() and the end of the pass */
    private boolean marked = false;

    private Gate(Operation operation, List<Gate> inputs, boolean isInput, boolean isOutput) {
        this.operation = operation;
        this.inputs = inputs;
        this.isInput = isInput;
        this.isOutput = isOutput;
    }

    /**
     * Validates the local invariants and creates the gate. Nothing is changed if validation fails,
     * in particular the gate is not yet registered with its inputs.
     */
    static Gate create(Operation operation, @Nullable List<Gate> inputs, boolean isInput, boolean isOutput) {
        if (isInput && !operation.isIdentity()) {
            throw new CircuitException.InvalidRole("input gates must correspond to the identity operation");
        }
        if (isOutput && !operation.isIdentity()) {
            throw new CircuitException.InvalidRole("output gates must correspond to the identity operation");
        }
        List<Gate> gateInputs;
        if (inputs == null) {
            gateInputs = List.of();
        } else {
            for (Gate input : inputs) {
                if (input != null && input.isOutput) {
                    throw new CircuitException.DanglingOutputReuse(
                            "output gates cannot be designated as inputs into other gates");
                }
            }
            if (!inputs.isEmpty() && inputs.size() != operation.arity()) {
                throw new CircuitException.ArityMismatch(String.format(
                        "number of inputs must equal operation arity or zero (got %d for %s)",
                        inputs.size(), operation));
            }
            // May contain null placeholders, so List.copyOf is not an option
            gateInputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        }
        return new Gate(operation, gateInputs, isInput, isOutput);
    }

    /**
     * Registers this gate as output of each of its inputs.
     */
    void connect() {
        for (Gate input : inputs) {
            if (input != null) {
                input.addOutput(this);
            }
        }
    }

    /**
     * Designates {@code other} as an output of this gate. Adding the same gate twice has no effect.
     */
    void addOutput(Gate other) {
        for (Gate output : outputs) {
            if (output == other) {
                return;
            }
        }
        outputs.add(other);
    }

    void clearOutputs() {
        outputs.clear();
    }

    public Operation operation() {
        return operation;
    }

    /**
     * The input gates, in argument order. Entries may be {@code null} for placeholder inputs of
     * gates which are not part of a circuit.
     */
    public List<Gate> inputs() {
        return inputs;
    }

    /**
     * The gates which use this gate as input, in the order they were created.
     */
    public List<Gate> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    public boolean isInput() {
        return isInput;
    }

    public boolean isOutput() {
        return isOutput;
    }

    /**
     * Whether this gate has to be computed during circuit evaluation, i.e. it either has inputs or
     * is a constant.
     */
    public boolean isComputed() {
        return !inputs.isEmpty() || operation.isNullary();
    }

    /**
     * The index of this gate in its owning collection, or {@code -1} if it has not been added yet.
     */
    public int position() {
        return position;
    }

    void setPosition(int position) {
        this.position = position;
    }

    public boolean isMarked() {
        return marked;
    }

    /**
     * Sets the mark and returns whether it was previously unset.
     */
    boolean mark() {
        if (marked) {
            return false;
        }
        marked = true;
        return true;
    }

    void unmark() {
        marked = false;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(16);
        builder.append(position).append(':').append(operation.name());
        if (isInput) {
            builder.append("[in]");
        }
        if (isOutput) {
            builder.append("[out]");
        }
        return builder.toString();
    }
}
