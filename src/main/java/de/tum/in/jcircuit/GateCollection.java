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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import javax.annotation.Nullable;

/**
 * An ordered collection of gates.
 *
 * <p>A collection created through the constructor <em>owns</em> its gates: gates are only added
 * through {@link #addGate}, and the {@link Gate#position() position} of each gate always equals
 * its index. A <em>selection</em> created by {@link #of(Iterable)} groups gates of some other
 * collection, e.g. to evaluate only a part of a circuit, and leaves their positions untouched.</p>
 *
 * <p>Gates of a standalone collection may use {@code null} as placeholder input. Such a wire is
 * read from the input when the collection is {@link #evaluate(Iterator) evaluated}.</p>
 */
public final class GateCollection implements Iterable<Gate> {
    private static final Logger logger = Logger.getLogger(GateCollection.class.getName());

    private List<Gate> gates;
    @Nullable
    private final Map<Gate, Integer> selectionIndex;

    public GateCollection() {
        this.gates = new ArrayList<>();
        this.selectionIndex = null;
    }

    private GateCollection(List<Gate> gates, Map<Gate, Integer> selectionIndex) {
        this.gates = gates;
        this.selectionIndex = selectionIndex;
    }

    /**
     * Creates a selection of existing gates, in the given order.
     */
    public static GateCollection of(Iterable<Gate> gates) {
        List<Gate> list = new ArrayList<>();
        Map<Gate, Integer> index = new IdentityHashMap<>();
        for (Gate gate : gates) {
            if (!index.containsKey(gate)) {
                index.put(gate, list.size());
                list.add(gate);
            }
        }
        return new GateCollection(list, index);
    }

    public static GateCollection of(Gate... gates) {
        return of(Arrays.asList(gates));
    }

    // Construction

    /**
     * Adds a new gate to this collection.
     *
     * @param operation The operation of the gate.
     * @param inputs The input gates, either empty, {@code null} or exactly as many as the arity of
     *     the operation. Entries may be {@code null} placeholders.
     * @param isInput Whether the gate is an input gate of a circuit.
     * @param isOutput Whether the gate is an output gate of a circuit.
     * @return The created gate.
     * @throws CircuitException If the gate violates the invariants. In this case, nothing changes.
     */
    public Gate addGate(Operation operation, @Nullable List<Gate> inputs, boolean isInput, boolean isOutput) {
        checkState(isOwning(), "Cannot add gates to a selection");
        Gate gate = Gate.create(operation, inputs, isInput, isOutput);
        gate.setPosition(gates.size());
        gates.add(gate);
        gate.connect();
        return gate;
    }

    public Gate addGate(Operation operation, Gate... inputs) {
        return addGate(operation, Arrays.asList(inputs), false, false);
    }

    // Access

    public boolean isOwning() {
        return selectionIndex == null;
    }

    public int size() {
        return gates.size();
    }

    public boolean isEmpty() {
        return gates.isEmpty();
    }

    public Gate get(int index) {
        return gates.get(index);
    }

    /**
     * Returns the index of the given gate in this collection or {@code -1} if it is not a member.
     * Membership is decided by identity.
     */
    public int indexOf(@Nullable Gate gate) {
        if (gate == null) {
            return -1;
        }
        if (selectionIndex != null) {
            return selectionIndex.getOrDefault(gate, -1);
        }
        int position = gate.position();
        return position >= 0 && position < gates.size() && gates.get(position) == gate ? position : -1;
    }

    public boolean contains(@Nullable Gate gate) {
        return indexOf(gate) >= 0;
    }

    @Override
    public Iterator<Gate> iterator() {
        return Collections.unmodifiableList(gates).iterator();
    }

    public Stream<Gate> stream() {
        return gates.stream();
    }

    // Marking

    /**
     * Marks the given gate and every gate reachable from it through input references. Gates which
     * already are marked are not descended into, hence all gates below a marked gate have to be
     * marked, too. This always holds after {@link #unmarkAll()} was called.
     *
     * @param gate The gate from which to start.
     * @return The number of newly marked gates.
     */
    public static int mark(Gate gate) {
        if (!gate.mark()) {
            return 0;
        }
        int count = 1;
        Deque<Gate> workStack = new ArrayDeque<>();
        workStack.push(gate);
        while (!workStack.isEmpty()) {
            Gate current = workStack.pop();
            for (Gate input : current.inputs()) {
                if (input != null && input.mark()) {
                    count += 1;
                    workStack.push(input);
                }
            }
        }
        return count;
    }

    public void unmarkAll() {
        for (Gate gate : gates) {
            gate.unmark();
        }
    }

    // Pruning

    /**
     * Removes every gate from which no output gate can be reached and sorts the remaining gates
     * topologically. Input gates come first and output gates last, each block in its original
     * order. The interior gates keep their relative order, too.
     *
     * <p>Input gates and output gates are never removed. The outputs of each output gate are
     * cleared, making them sinks. A gate which is both an input and an output gate is placed in
     * the input block only, so every remaining gate occurs exactly once.</p>
     */
    public void pruneAndTopologicallySortStable() {
        checkState(isOwning(), "Cannot sort a selection");
        int previousSize = gates.size();

        List<Gate> effectiveOutputs = new ArrayList<>();
        for (Gate gate : gates) {
            if (gate.outputs().isEmpty() && gate.operation().isIdentity() && gate.isOutput()) {
                effectiveOutputs.add(gate);
            }
        }

        unmarkAll();
        for (Gate output : effectiveOutputs) {
            mark(output);
        }

        List<Gate> sorted = new ArrayList<>(previousSize);
        for (Gate gate : gates) {
            if (gate.inputs().isEmpty() && gate.isInput()) {
                sorted.add(gate);
            }
        }
        for (Gate gate : gates) {
            if (gate.isComputed()
                    && !gate.outputs().isEmpty()
                    && !gate.isInput()
                    && !gate.isOutput()
                    && gate.isMarked()) {
                sorted.add(gate);
            }
        }
        for (Gate output : effectiveOutputs) {
            output.clearOutputs();
            // Pass-through gates already are in the input block
            if (!(output.inputs().isEmpty() && output.isInput())) {
                sorted.add(output);
            }
        }

        for (int i = 0; i < sorted.size(); i++) {
            sorted.get(i).setPosition(i);
        }
        gates = sorted;

        logger.log(Level.FINE, "Pruned {0} of {1} gates", new Object[] {previousSize - sorted.size(), previousSize});
        assert check();
    }

    // Evaluation

    /**
     * Evaluates the gates in the order of this collection. A gate without inputs reads as many bits
     * from {@code input} as its operation's arity. A gate with inputs uses the value of each input
     * which belongs to this collection and has already been evaluated, all other inputs (including
     * placeholders) are read from {@code input}.
     *
     * <p>The result contains the value of each gate which has no outputs inside this
     * collection.</p>
     *
     * @param input The source of input bits.
     * @return The output bits.
     */
    public List<Integer> evaluate(Iterator<Integer> input) {
        Map<Gate, Integer> wire = new IdentityHashMap<>();
        for (Gate gate : gates) {
            Operation operation = gate.operation();
            List<Gate> inputs = gate.inputs();
            assert inputs.isEmpty() || inputs.size() == operation.arity();

            int[] arguments = new int[operation.arity()];
            for (int i = 0; i < arguments.length; i++) {
                Integer value = null;
                if (!inputs.isEmpty() && inputs.get(i) != null) {
                    value = wire.get(inputs.get(i));
                }
                arguments[i] = value == null ? nextBit(input) : value;
            }
            wire.put(gate, operation.apply(arguments));
        }

        List<Integer> output = new ArrayList<>();
        for (Gate gate : gates) {
            if (gate.outputs().stream().noneMatch(this::contains)) {
                output.add(wire.get(gate));
            }
        }
        return output;
    }

    public List<Integer> evaluate(List<Integer> input) {
        return evaluate(input.iterator());
    }

    public List<Integer> evaluate(int... input) {
        return evaluate(Arrays.stream(input).boxed().iterator());
    }

    private static int nextBit(Iterator<Integer> input) {
        if (!input.hasNext()) {
            throw new CircuitException.ArityMismatch("input has fewer bits than the gates consume");
        }
        Integer bit = input.next();
        if (bit == null) {
            throw new CircuitException.ShapeMismatch("each bit must be represented by 0 or 1");
        }
        return bit;
    }

    /**
     * Computes the boolean function of this collection. The running time is exponential in the
     * number of consumed input bits.
     *
     * @return The function as operation.
     * @throws CircuitException.ArityMismatch If this collection does not have exactly one output.
     */
    public Operation toOperation() {
        ZeroIterator zeros = new ZeroIterator();
        List<Integer> output = evaluate(zeros);
        if (output.size() != 1) {
            throw new CircuitException.ArityMismatch("gate collection must have exactly one output when evaluated");
        }

        int length = zeros.count;
        checkState(length < Integer.SIZE - 1, "Too many inputs (%d) for a truth table", length);
        int[] table = new int[1 << length];
        table[0] = output.get(0);
        PowerIterator iterator = new PowerIterator(length);
        iterator.next();
        for (int row = 1; row < table.length; row++) {
            table[row] = evaluate(iterator.next()).get(0);
        }
        return Operation.of(table);
    }

    // Structure

    /**
     * Returns all input wires which are not provided by gates of this collection. Each entry is
     * either empty for a placeholder or the foreign gate providing the wire. A gate without any
     * inputs contributes one placeholder per argument. Duplicates are kept.
     */
    public List<Optional<Gate>> inputs() {
        List<Optional<Gate>> inputs = new ArrayList<>();
        for (Gate gate : gates) {
            int arity = gate.operation().arity();
            if (gate.inputs().size() == arity) {
                for (Gate input : gate.inputs()) {
                    if (input == null) {
                        inputs.add(Optional.empty());
                    } else if (!contains(input)) {
                        inputs.add(Optional.of(input));
                    }
                }
            } else {
                for (int i = 0; i < arity; i++) {
                    inputs.add(Optional.empty());
                }
            }
        }
        return inputs;
    }

    /**
     * Returns all gates outside of this collection which use a member as input. Duplicates are
     * kept.
     */
    public List<Gate> outputs() {
        List<Gate> outputs = new ArrayList<>();
        for (Gate gate : gates) {
            for (Gate output : gate.outputs()) {
                if (!contains(output)) {
                    outputs.add(output);
                }
            }
        }
        return outputs;
    }

    /**
     * Returns the members which have no inputs or at least one input which is a placeholder or a
     * gate outside of this collection.
     */
    public List<Gate> sources() {
        List<Gate> sources = new ArrayList<>();
        for (Gate gate : gates) {
            if (gate.inputs().isEmpty() || gate.inputs().stream().anyMatch(input -> !contains(input))) {
                sources.add(gate);
            }
        }
        return sources;
    }

    /**
     * Returns the members which are not used as input by any other member.
     */
    public List<Gate> sinks() {
        Set<Gate> used = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Gate gate : gates) {
            for (Gate input : gate.inputs()) {
                if (input != null) {
                    used.add(input);
                }
            }
        }
        List<Gate> sinks = new ArrayList<>();
        for (Gate gate : gates) {
            if (!used.contains(gate)) {
                sinks.add(gate);
            }
        }
        return sinks;
    }

    // Representations

    /**
     * Returns a human-readable representation: for each gate the name of its operation followed by
     * the indices of its inputs, {@code null} denoting a placeholder.
     */
    public List<List<Object>> toLegible() {
        List<List<Object>> legible = new ArrayList<>(gates.size());
        for (Gate gate : gates) {
            legible.add(describe(gate, gate.operation().name(), true));
        }
        return legible;
    }

    /**
     * Returns a canonical representation: for each gate its operation followed by the indices of its
     * inputs. Structurally identical collections have equal representations.
     */
    public List<List<Object>> toCanonical() {
        List<List<Object>> canonical = new ArrayList<>(gates.size());
        for (Gate gate : gates) {
            canonical.add(describe(gate, gate.operation(), true));
        }
        return canonical;
    }

    private List<Object> describe(Gate gate, Object head, boolean strict) {
        List<Object> entry = new ArrayList<>(1 + gate.inputs().size());
        entry.add(head);
        for (Gate input : gate.inputs()) {
            if (input == null) {
                entry.add(null);
            } else {
                int index = indexOf(input);
                if (index >= 0) {
                    entry.add(index);
                } else {
                    checkState(!strict, "Input %s of %s is not part of this collection", input, gate);
                    entry.add("?");
                }
            }
        }
        return Collections.unmodifiableList(entry);
    }

    // Integrity checks

    /**
     * Performs some integrity / invariant checks.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     */
    public boolean check() {
        logger.log(Level.FINER, "Running integrity check");
        for (int index = 0; index < gates.size(); index++) {
            Gate gate = gates.get(index);
            if (isOwning()) {
                checkState(gate.position() == index, "Gate %s has position %d but index %d", gate, gate.position(), index);
            }
            checkState(!gate.isInput() || gate.operation().isIdentity(), "Input gate %s is not an identity", gate);
            checkState(!gate.isOutput() || gate.operation().isIdentity(), "Output gate %s is not an identity", gate);
            for (Gate input : gate.inputs()) {
                if (input == null) {
                    continue;
                }
                checkState(!input.isOutput(), "Output gate %s is input of %s", input, gate);
                checkState(input.outputs().contains(gate), "Gate %s is not registered as output of %s", gate, input);
                int inputIndex = indexOf(input);
                checkState(inputIndex < index, "Input %s of %s does not precede it", input, gate);
            }
            for (Gate output : gate.outputs()) {
                checkState(output.inputs().contains(gate), "Gate %s lists %s as output but is not its input", gate,
                        output);
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(8 * gates.size() + 2);
        builder.append('(');
        Iterator<Gate> iterator = gates.iterator();
        while (iterator.hasNext()) {
            Gate gate = iterator.next();
            List<Object> entry = describe(gate, gate.operation().name(), false);
            builder.append('(');
            for (int i = 0; i < entry.size(); i++) {
                if (i > 0) {
                    builder.append(", ");
                }
                builder.append(entry.get(i));
            }
            builder.append(')');
            if (iterator.hasNext()) {
                builder.append(", ");
            }
        }
        return builder.append(')').toString();
    }

    private static final class ZeroIterator implements Iterator<Integer> {
        int count = 0;

        @Override
        public boolean hasNext() {
            return true;
        }

        @Override
        public Integer next() {
            if (count == Integer.MAX_VALUE) {
                throw new NoSuchElementException();
            }
            count += 1;
            return 0;
        }
    }
}
