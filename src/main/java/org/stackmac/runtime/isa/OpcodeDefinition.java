package org.stackmac.runtime.isa;

/**
 * A registry entry describing one opcode.
 *
 * @param name The upper-case mnemonic.
 * @param code The numeric opcode written to bytecode (0-255).
 * @param hasOperand Whether instructions with this opcode carry an operand.
 * @param cycleCost The simulated cycle cost added per execution.
 * @param behavior What the opcode does when executed.
 * @param extension Whether the opcode was registered as an extension rather than being part of the base set.
 */
public record OpcodeDefinition(
        String name,
        int code,
        boolean hasOperand,
        int cycleCost,
        InstructionBehavior behavior,
        boolean extension
) {
    @Override
    public String toString() {
        return String.format("%s (0x%02x)", name, code);
    }
}
