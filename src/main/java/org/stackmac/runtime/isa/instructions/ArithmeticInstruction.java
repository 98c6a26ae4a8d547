package org.stackmac.runtime.isa.instructions;

import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;
import org.stackmac.runtime.ExecutionContext;
import org.stackmac.runtime.isa.InstructionBehavior;
import org.stackmac.runtime.model.OperandStack;

/**
 * Handles the binary arithmetic instructions ADD, SUB, MUL and DIV.
 * <p>
 * Pops {@code b}, then {@code a}, and pushes {@code a op b}. Results wrap on 32-bit overflow.
 * DIV rounds toward negative infinity.
 */
public class ArithmeticInstruction implements InstructionBehavior {

    private final String name;

    /**
     * Constructs a new ArithmeticInstruction.
     * @param name The opcode this behavior is registered for.
     */
    public ArithmeticInstruction(String name) {
        this.name = name;
    }

    @Override
    public void execute(ExecutionContext context, Integer operand) {
        OperandStack stack = context.getStack();
        stack.requireDepth(2, name);

        // Checked before popping so a failed DIV leaves both operands in place.
        if ("DIV".equals(name) && stack.peek() == 0) {
            throw new StackMachineException(ErrorCode.DIVISION_BY_ZERO, "Division by zero");
        }

        int b = stack.pop();
        int a = stack.pop();
        int result = switch (name) {
            case "ADD" -> a + b;
            case "SUB" -> a - b;
            case "MUL" -> a * b;
            case "DIV" -> Math.floorDiv(a, b);
            default -> throw new IllegalStateException("Unknown arithmetic instruction: " + name);
        };
        stack.push(result);
    }
}
