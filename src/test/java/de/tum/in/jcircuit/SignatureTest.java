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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class SignatureTest {
    @Test
    public void testGrouped() {
        Signature signature = Signature.of(List.of(2, 2), List.of(3, 1));
        assertThat(signature.input(List.of(List.of(1, 0), List.of(0, 1))), is(new int[] {1, 0, 0, 1}));
        assertThat(signature.output(new int[] {1, 1, 0, 0}), is(List.of(List.of(1, 1, 0), List.of(0))));
    }

    @Test
    public void testOnlyInputFormat() {
        Signature signature = Signature.of(List.of(2, 3), null);
        assertThat(signature.input(List.of(List.of(1, 0), List.of(0, 1, 1))), is(new int[] {1, 0, 0, 1, 1}));
        assertThat(signature.output(new int[] {1, 0}), is(List.of(1, 0)));
    }

    @Test
    public void testOnlyOutputFormat() {
        Signature signature = Signature.of(null, List.of(2, 3));
        assertThat(signature.output(new int[] {1, 0, 0, 1, 1}), is(List.of(List.of(1, 0), List.of(0, 1, 1))));
    }

    @Test
    public void testFlat() {
        Signature signature = Signature.flat();
        assertThat(signature.inputFormat(), is(Optional.empty()));
        assertThat(signature.input(List.of(1, 0, 1)), is(new int[] {1, 0, 1}));
        assertThat(signature.output(new int[] {1, 0, 1}), is(List.of(1, 0, 1)));
        assertThat(signature.input(List.of()), is(new int[0]));
    }

    @Test
    public void testFlatRejectsMalformedInput() {
        Signature signature = Signature.flat();
        assertThrows(CircuitException.ShapeMismatch.class,
                () -> signature.input(List.of(List.of(1), List.of(1), List.of(1))));
        assertThrows(CircuitException.ShapeMismatch.class, () -> signature.input(List.of(2, 3, 4)));
        assertThrows(CircuitException.ShapeMismatch.class, () -> signature.input(List.of("1")));
    }

    @Test
    public void testGroupedRejectsMalformedInput() {
        Signature signature = Signature.of(List.of(2), List.of(1));
        assertThrows(CircuitException.ShapeMismatch.class,
                () -> signature.input(List.of(List.of(2), List.of(3), List.of(4))));
        assertThrows(CircuitException.ShapeMismatch.class, () -> signature.input(List.of(1, 0)));
        assertThrows(CircuitException.ArityMismatch.class, () -> signature.input(List.of(List.of(1))));
        assertThrows(CircuitException.ArityMismatch.class,
                () -> signature.input(List.of(List.of(1), List.of(0))));
    }

    @Test
    public void testOutputLengthMismatch() {
        Signature signature = Signature.of(null, List.of(2, 1));
        assertThrows(CircuitException.ArityMismatch.class, () -> signature.output(new int[] {1, 0}));
    }

    @Test
    public void testEmptyGroup() {
        Signature signature = Signature.of(List.of(0), List.of(1));
        assertThat(signature.input(List.of(List.of())), is(new int[0]));
        assertThat(signature.output(new int[] {1}), is(List.of(List.of(1))));
    }

    @Test
    public void testNegativeLength() {
        assertThrows(IllegalArgumentException.class, () -> Signature.of(List.of(-1), null));
        assertThrows(IllegalArgumentException.class, () -> Signature.of(null, List.of(1, -2)));
    }

    @Test
    public void testRoundTrip() {
        Signature signature = Signature.of(List.of(1, 3), List.of(2, 2));
        List<?> input = List.of(List.of(1), List.of(0, 1, 1));
        assertThat(signature.output(signature.input(input)), is(List.of(List.of(1, 0), List.of(1, 1))));
    }

    @Test
    public void testValueSemantics() {
        assertThat(Signature.of(List.of(1), null), is(Signature.of(List.of(1), null)));
        assertThat(Signature.flat(), is(Signature.of(null, null)));
    }

    @Test
    public void testFormatInput() {
        Signature grouped = Signature.of(List.of(1, 2), null);
        List<?> formatted = grouped.formatInput(new int[] {1, 0, 1});
        assertThat(formatted, is(List.of(List.of(1), List.of(0, 1))));
        assertThat(grouped.input(formatted), is(new int[] {1, 0, 1}));
        assertThat(Signature.flat().formatInput(new int[] {0, 1}), is(List.of(0, 1)));
        assertThrows(CircuitException.ArityMismatch.class, () -> grouped.formatInput(new int[] {1, 0}));
    }
}
