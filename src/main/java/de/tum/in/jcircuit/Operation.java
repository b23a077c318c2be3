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
import java.util.List;
import java.util.Set;

/**
 * A boolean function of fixed arity, represented by its truth table.
 *
 * <p>The table lists the result for every argument vector in lexicographic order, the first
 * argument being the most significant bit. For example, {@link #AND} has the table
 * {@code (0, 0, 0, 1)} and {@link #IMPLIES} has {@code (1, 1, 0, 1)}. Two operations are equal iff
 * their tables are equal, the name is only used for display.</p>
 */
public final class Operation {
    public static final Operation FALSE = new Operation("nf", 0);
    public static final Operation TRUE = new Operation("nt", 1);

    public static final Operation UNARY_FALSE = new Operation("uf", 0, 0);
    public static final Operation IDENTITY = new Operation("id", 0, 1);
    public static final Operation NOT = new Operation("not", 1, 0);
    public static final Operation UNARY_TRUE = new Operation("ut", 1, 1);

    public static final Operation BINARY_FALSE = new Operation("bf", 0, 0, 0, 0);
    public static final Operation AND = new Operation("and", 0, 0, 0, 1);
    public static final Operation NOT_IMPLIES = new Operation("nimp", 0, 0, 1, 0);
    public static final Operation FIRST = new Operation("fst", 0, 0, 1, 1);
    public static final Operation NOT_IF = new Operation("nif", 0, 1, 0, 0);
    public static final Operation SECOND = new Operation("snd", 0, 1, 0, 1);
    public static final Operation XOR = new Operation("xor", 0, 1, 1, 0);
    public static final Operation OR = new Operation("or", 0, 1, 1, 1);
    public static final Operation NOR = new Operation("nor", 1, 0, 0, 0);
    public static final Operation XNOR = new Operation("xnor", 1, 0, 0, 1);
    public static final Operation NOT_SECOND = new Operation("nsnd", 1, 0, 1, 0);
    public static final Operation IF = new Operation("if", 1, 0, 1, 1);
    public static final Operation NOT_FIRST = new Operation("nfst", 1, 1, 0, 0);
    public static final Operation IMPLIES = new Operation("imp", 1, 1, 0, 1);
    public static final Operation NAND = new Operation("nand", 1, 1, 1, 0);
    public static final Operation BINARY_TRUE = new Operation("bt", 1, 1, 1, 1);

    private static final List<Operation> NAMED = List.of(
            FALSE, TRUE,
            UNARY_FALSE, IDENTITY, NOT, UNARY_TRUE,
            BINARY_FALSE, AND, NOT_IMPLIES, FIRST, NOT_IF, SECOND, XOR, OR,
            NOR, XNOR, NOT_SECOND, IF, NOT_FIRST, IMPLIES, NAND, BINARY_TRUE);
    private static final Set<Operation> NULLARY = Set.of(FALSE, TRUE);

    private final String name;
    private final int[] table;
    private final int arity;

    private Operation(String name, int... table) {
        this.name = name;
        this.table = table;
        this.arity = Integer.numberOfTrailingZeros(table.length);
    }

    /**
     * Returns the operation with the given truth table. If one of the named operations has this
     * table, that instance is returned.
     *
     * @param table The truth table, its length has to be a power of two.
     * @return The operation.
     * @throws IllegalArgumentException If the table is malformed.
     */
    public static Operation of(int... table) {
        if (table.length == 0 || Integer.bitCount(table.length) != 1) {
            throw new IllegalArgumentException("Truth table length " + table.length + " is not a power of two");
        }
        StringBuilder bits = new StringBuilder(table.length);
        for (int value : table) {
            if (value != 0 && value != 1) {
                throw new IllegalArgumentException("Truth table " + Arrays.toString(table) + " contains non-bits");
            }
            bits.append(value);
        }
        for (Operation operation : NAMED) {
            if (Arrays.equals(operation.table, table)) {
                return operation;
            }
        }
        return new Operation(bits.toString(), table.clone());
    }

    /**
     * Looks up a named operation such as {@code and} or {@code nt}.
     *
     * @throws IllegalArgumentException If no operation has this name.
     */
    public static Operation named(String name) {
        for (Operation operation : NAMED) {
            if (operation.name.equals(name)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown operation " + name);
    }

    /**
     * The constant operations, i.e. the two operations of arity zero.
     */
    public static Set<Operation> nullary() {
        return NULLARY;
    }

    public int arity() {
        return arity;
    }

    public String name() {
        return name;
    }

    public boolean isIdentity() {
        return equals(IDENTITY);
    }

    public boolean isNullary() {
        return arity == 0;
    }

    /**
     * Returns a copy of the truth table.
     */
    public int[] table() {
        return table.clone();
    }

    /**
     * Applies this operation.
     *
     * @param bits The arguments, exactly {@link #arity()} values which are each 0 or 1.
     * @return The result bit.
     */
    public int apply(int... bits) {
        if (bits.length != arity) {
            throw new CircuitException.ArityMismatch(String.format(
                    "Operation %s expects %d arguments, got %d", name, arity, bits.length));
        }
        int index = 0;
        for (int bit : bits) {
            if (bit != 0 && bit != 1) {
                throw new CircuitException.ShapeMismatch("each bit must be represented by 0 or 1");
            }
            index = (index << 1) | bit;
        }
        return table[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Operation)) {
            return false;
        }
        return Arrays.equals(table, ((Operation) o).table);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(table);
    }

    @Override
    public String toString() {
        return name;
    }
}
