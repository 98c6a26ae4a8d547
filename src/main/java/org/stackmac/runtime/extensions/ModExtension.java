package org.stackmac.runtime.extensions;

import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;
import org.stackmac.runtime.ExecutionContext;
import org.stackmac.runtime.model.OperandStack;
import org.stackmac.runtime.spi.OpcodeExtension;

/**
 * MOD (0x10): pops b, then a, pushes {@code a mod b}. The result takes the sign of the divisor,
 * matching the floor semantics of DIV.
 */
public class ModExtension implements OpcodeExtension {

    @Override
    public String getName() {
        return "MOD";
    }

    @Override
    public int getCode() {
        return 0x10;
    }

    @Override
    public boolean hasOperand() {
        return false;
    }

    @Override
    public void execute(ExecutionContext context, Integer operand) {
        OperandStack stack = context.getStack();
        stack.requireDepth(2, getName());
        if (stack.peek() == 0) {
            throw new StackMachineException(ErrorCode.DIVISION_BY_ZERO, "Modulo by zero");
        }
        int b = stack.pop();
        int a = stack.pop();
        stack.push(Math.floorMod(a, b));
    }
}
