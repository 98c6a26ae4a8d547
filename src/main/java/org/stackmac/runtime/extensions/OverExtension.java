package org.stackmac.runtime.extensions;

import org.stackmac.runtime.ExecutionContext;
import org.stackmac.runtime.model.OperandStack;
import org.stackmac.runtime.spi.OpcodeExtension;

/**
 * OVER (0x19): copies the second value to the top. {@code [a b] -> [a b a]}
 */
public class OverExtension implements OpcodeExtension {

    @Override
    public String getName() {
        return "OVER";
    }

    @Override
    public int getCode() {
        return 0x19;
    }

    @Override
    public boolean hasOperand() {
        return false;
    }

    @Override
    public void execute(ExecutionContext context, Integer operand) {
        OperandStack stack = context.getStack();
        stack.requireDepth(2, getName());
        int b = stack.pop();
        int a = stack.peek();
        stack.push(b);
        stack.push(a);
    }
}
