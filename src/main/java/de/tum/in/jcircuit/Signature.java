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
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/**
 * The input and output bit vector formats of a circuit.
 *
 * <p>Each format is a list of group lengths. A circuit with input format {@code [2, 1]} is
 * evaluated on inputs like {@code [[0, 1], [1]]} instead of the flat {@code [0, 1, 1]}. An absent
 * format means that the corresponding side is a flat list of bits.</p>
 */
@Value.Immutable
public abstract class Signature {
    public abstract Optional<List<Integer>> inputFormat();

    public abstract Optional<List<Integer>> outputFormat();

    public static Signature flat() {
        return ImmutableSignature.builder().build();
    }

    public static Signature of(@Nullable List<Integer> inputFormat, @Nullable List<Integer> outputFormat) {
        return ImmutableSignature.builder()
                .inputFormat(Optional.ofNullable(inputFormat).map(List::copyOf))
                .outputFormat(Optional.ofNullable(outputFormat).map(List::copyOf))
                .build();
    }

    @Value.Check
    protected void checkFormats() {
        inputFormat().ifPresent(format -> checkFormat(format, "input"));
        outputFormat().ifPresent(format -> checkFormat(format, "output"));
    }

    private static void checkFormat(List<Integer> format, String side) {
        for (Integer length : format) {
            if (length == null || length < 0) {
                throw new IllegalArgumentException(
                        "signature " + side + " format must be a list of non-negative integers, got " + format);
            }
        }
    }

    /**
     * Converts an input matching the input format into a flat bit vector.
     *
     * @param input Either a list of bits (no input format) or a list of bit lists.
     * @return The flattened bits.
     * @throws CircuitException.ShapeMismatch If the input is not a (grouped) list of bits.
     * @throws CircuitException.ArityMismatch If the group lengths do not match the input format.
     */
    public int[] input(List<?> input) {
        if (inputFormat().isEmpty()) {
            return bits(input, "input must be a list of integers");
        }

        List<Integer> format = inputFormat().get();
        List<int[]> groups = new ArrayList<>(input.size());
        int total = 0;
        for (Object group : input) {
            if (!(group instanceof List)) {
                throw new CircuitException.ShapeMismatch("input must be a list of integer lists");
            }
            int[] bits = bits((List<?>) group, "input must be a list of integer lists");
            groups.add(bits);
            total += bits.length;
        }

        boolean matches = groups.size() == format.size();
        for (int i = 0; matches && i < groups.size(); i++) {
            matches = groups.get(i).length == format.get(i);
        }
        if (!matches) {
            throw new CircuitException.ArityMismatch("input format does not match signature");
        }

        int[] flat = new int[total];
        int pos = 0;
        for (int[] group : groups) {
            System.arraycopy(group, 0, flat, pos, group.length);
            pos += group.length;
        }
        return flat;
    }

    /**
     * Converts a flat input bit vector into the input format, the inverse of {@link #input(List)}.
     *
     * @throws CircuitException.ArityMismatch If the length does not match the input format.
     */
    public List<?> formatInput(int[] input) {
        return split(input, inputFormat(), "input");
    }

    /**
     * Converts a flat output bit vector into the output format.
     *
     * @param output The flat bits.
     * @return A list of bits (no output format) or a list of bit lists.
     * @throws CircuitException.ArityMismatch If the length does not match the output format.
     */
    public List<?> output(int[] output) {
        return split(output, outputFormat(), "output");
    }

    private static List<?> split(int[] bits, Optional<List<Integer>> format, String side) {
        if (format.isEmpty()) {
            return boxed(bits, 0, bits.length);
        }

        List<Integer> lengths = format.get();
        int total = lengths.stream().mapToInt(Integer::intValue).sum();
        if (total != bits.length) {
            throw new CircuitException.ArityMismatch(String.format(
                    "%s of %d bits does not match signature %s", side, bits.length, lengths));
        }
        List<List<Integer>> groups = new ArrayList<>(lengths.size());
        int pos = 0;
        for (int length : lengths) {
            groups.add(boxed(bits, pos, pos + length));
            pos += length;
        }
        return groups;
    }

    private static int[] bits(List<?> values, String shapeError) {
        int[] bits = new int[values.size()];
        int pos = 0;
        for (Object value : values) {
            if (!(value instanceof Integer)) {
                throw new CircuitException.ShapeMismatch(shapeError);
            }
            int bit = (Integer) value;
            if (bit != 0 && bit != 1) {
                throw new CircuitException.ShapeMismatch("each bit must be represented by 0 or 1");
            }
            bits[pos] = bit;
            pos += 1;
        }
        return bits;
    }

    private static List<Integer> boxed(int[] bits, int from, int to) {
        return List.of(Arrays.stream(bits, from, to).boxed().toArray(Integer[]::new));
    }
}
