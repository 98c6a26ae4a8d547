package org.stackmac.runtime.extensions;

import org.stackmac.runtime.ExecutionContext;
import org.stackmac.runtime.model.OperandStack;
import org.stackmac.runtime.spi.OpcodeExtension;

/**
 * ROT (0x1A): moves the third value to the top. {@code [a b c] -> [b c a]}
 */
public class RotExtension implements OpcodeExtension {

    @Override
    public String getName() {
        return "ROT";
    }

    @Override
    public int getCode() {
        return 0x1A;
    }

    @Override
    public boolean hasOperand() {
        return false;
    }

    @Override
    public void execute(ExecutionContext context, Integer operand) {
        OperandStack stack = context.getStack();
        stack.requireDepth(3, getName());
        int c = stack.pop();
        int b = stack.pop();
        int a = stack.pop();
        stack.push(b);
        stack.push(c);
        stack.push(a);
    }
}
