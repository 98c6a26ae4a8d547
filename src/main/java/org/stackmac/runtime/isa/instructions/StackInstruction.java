package org.stackmac.runtime.isa.instructions;

import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;
import org.stackmac.runtime.ExecutionContext;
import org.stackmac.runtime.isa.InstructionBehavior;
import org.stackmac.runtime.model.OperandStack;

/**
 * Handles stack manipulation instructions: PUSH, POP, DUP and SWAP.
 */
public class StackInstruction implements InstructionBehavior {

    private final String name;

    /**
     * Constructs a new StackInstruction.
     * @param name The opcode this behavior is registered for.
     */
    public StackInstruction(String name) {
        this.name = name;
    }

    @Override
    public void execute(ExecutionContext context, Integer operand) {
        OperandStack stack = context.getStack();

        switch (name) {
            case "PUSH" -> {
                if (operand == null) {
                    throw new StackMachineException(ErrorCode.INVALID_OPERAND, "PUSH requires an operand");
                }
                stack.push(operand);
            }
            case "POP" -> stack.pop();
            case "DUP" -> stack.push(stack.peek());
            case "SWAP" -> {
                stack.requireDepth(2, name);
                int b = stack.pop();
                int a = stack.pop();
                stack.push(b);
                stack.push(a);
            }
            default -> throw new IllegalStateException("Unknown stack instruction: " + name);
        }
    }
}
