package org.stackmac.runtime.extensions;

import org.stackmac.runtime.ExecutionContext;
import org.stackmac.runtime.spi.OpcodeExtension;

/**
 * PEEK (0x1B): emits the top value as output without removing it.
 */
public class PeekExtension implements OpcodeExtension {

    @Override
    public String getName() {
        return "PEEK";
    }

    @Override
    public int getCode() {
        return 0x1B;
    }

    @Override
    public boolean hasOperand() {
        return false;
    }

    @Override
    public void execute(ExecutionContext context, Integer operand) {
        context.emit(context.getStack().peek());
    }
}
