package org.stackmac.runtime.model;

import java.util.Objects;

/**
 * A single machine instruction: an opcode mnemonic and its optional operand.
 *
 * @param opcode The upper-case opcode mnemonic.
 * @param operand The operand, or {@code null} if the instruction carries none.
 *                A {@code null} operand is distinct from an operand of zero.
 */
public record Instruction(String opcode, Integer operand) {

    public Instruction {
        Objects.requireNonNull(opcode, "opcode");
    }

    /**
     * Creates an instruction without an operand.
     * @param opcode The opcode mnemonic.
     * @return The instruction.
     */
    public static Instruction of(String opcode) {
        return new Instruction(opcode, null);
    }

    /**
     * Creates an instruction with an operand.
     * @param opcode The opcode mnemonic.
     * @param operand The operand value.
     * @return The instruction.
     */
    public static Instruction of(String opcode, int operand) {
        return new Instruction(opcode, operand);
    }

    public boolean hasOperand() {
        return operand != null;
    }

    /**
     * Renders the instruction in source form, e.g. {@code PUSH 5} or {@code ADD}.
     */
    @Override
    public String toString() {
        return operand != null ? opcode + " " + operand : opcode;
    }
}
