package org.stackmac.runtime.isa.instructions;

import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;
import org.stackmac.runtime.ExecutionContext;
import org.stackmac.runtime.isa.InstructionBehavior;

/**
 * Handles control flow instructions: JUMP, JZ and HALT.
 * <p>
 * A taken jump sets the next program counter to the operand itself; the machine does not
 * advance it afterwards.
 */
public class ControlFlowInstruction implements InstructionBehavior {

    private final String name;

    /**
     * Constructs a new ControlFlowInstruction.
     * @param name The opcode this behavior is registered for.
     */
    public ControlFlowInstruction(String name) {
        this.name = name;
    }

    @Override
    public void execute(ExecutionContext context, Integer operand) {
        switch (name) {
            case "JUMP" -> context.jumpTo(requireTarget(operand));
            case "JZ" -> {
                int target = requireTarget(operand);
                if (context.getStack().pop() == 0) {
                    context.jumpTo(target);
                }
            }
            case "HALT" -> context.halt();
            default -> throw new IllegalStateException("Unknown control flow instruction: " + name);
        }
    }

    private int requireTarget(Integer operand) {
        if (operand == null) {
            throw new StackMachineException(ErrorCode.INVALID_OPERAND, name + " requires a target address");
        }
        return operand;
    }
}
