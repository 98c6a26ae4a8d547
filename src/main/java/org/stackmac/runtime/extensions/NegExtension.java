package org.stackmac.runtime.extensions;

import org.stackmac.runtime.ExecutionContext;
import org.stackmac.runtime.model.OperandStack;
import org.stackmac.runtime.spi.OpcodeExtension;

/**
 * NEG (0x11): replaces the top value with its negation. Negating {@link Integer#MIN_VALUE}
 * wraps to itself.
 */
public class NegExtension implements OpcodeExtension {

    @Override
    public String getName() {
        return "NEG";
    }

    @Override
    public int getCode() {
        return 0x11;
    }

    @Override
    public boolean hasOperand() {
        return false;
    }

    @Override
    public void execute(ExecutionContext context, Integer operand) {
        OperandStack stack = context.getStack();
        stack.push(-stack.pop());
    }
}
