package org.stackmac.runtime.isa;

import org.stackmac.runtime.ExecutionContext;

/**
 * The execution behavior of an opcode.
 */
@FunctionalInterface
public interface InstructionBehavior {

    /**
     * Executes the opcode against the running machine.
     *
     * @param context The running machine.
     * @param operand The instruction's operand, or {@code null} if it carries none.
     */
    void execute(ExecutionContext context, Integer operand);
}
