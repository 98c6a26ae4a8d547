package org.stackmac.runtime.model;

import java.util.Iterator;
import java.util.List;

/**
 * An immutable, ordered sequence of instructions. The index of an instruction is its address.
 */
public final class Program implements Iterable<Instruction> {

    private final List<Instruction> instructions;

    public Program(List<Instruction> instructions) {
        this.instructions = List.copyOf(instructions);
    }

    public static Program of(Instruction... instructions) {
        return new Program(List.of(instructions));
    }

    /**
     * Returns the instruction at the given address.
     * @param address An address in {@code [0, size())}.
     * @return The instruction.
     */
    public Instruction get(int address) {
        return instructions.get(address);
    }

    public int size() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    /**
     * Checks whether an address refers to an instruction of this program.
     * @param address The address to check.
     * @return true if {@code 0 <= address < size()}.
     */
    public boolean contains(int address) {
        return address >= 0 && address < instructions.size();
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    @Override
    public Iterator<Instruction> iterator() {
        return instructions.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Program other && instructions.equals(other.instructions);
    }

    @Override
    public int hashCode() {
        return instructions.hashCode();
    }

    @Override
    public String toString() {
        return "Program" + instructions;
    }
}
