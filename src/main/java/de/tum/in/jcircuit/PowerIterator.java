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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterates all bit vectors of a fixed length in lexicographic order, i.e. in the order of the rows
 * of a truth table. The returned array is re-used between calls.
 */
final class PowerIterator implements Iterator<int[]> {
    private final int[] iteration;
    private int numSetBits = -1;

    PowerIterator(int size) {
        iteration = new int[size];
    }

    @Override
    public boolean hasNext() {
        return numSetBits < iteration.length;
    }

    @Override
    public int[] next() {
        if (numSetBits == -1) {
            numSetBits = 0;
            return iteration;
        }

        if (numSetBits == iteration.length) {
            throw new NoSuchElementException("No next element");
        }

        for (int index = iteration.length - 1; index >= 0; index--) {
            if (iteration[index] == 1) {
                iteration[index] = 0;
                numSetBits -= 1;
            } else {
                iteration[index] = 1;
                numSetBits += 1;
                break;
            }
        }

        return iteration;
    }
}
