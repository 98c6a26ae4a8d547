package org.stackmac.runtime.isa.instructions;

import org.stackmac.runtime.ExecutionContext;
import org.stackmac.runtime.isa.InstructionBehavior;

/**
 * Handles PRINT: pops the top value and emits it as an output event.
 */
public class OutputInstruction implements InstructionBehavior {

    @Override
    public void execute(ExecutionContext context, Integer operand) {
        context.emit(context.getStack().pop());
    }
}
