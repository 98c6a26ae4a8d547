package org.stackmac.runtime.extensions;

import org.stackmac.runtime.ExecutionContext;
import org.stackmac.runtime.spi.OpcodeExtension;

/**
 * DEPTH (0x18): pushes the number of values on the stack before the push.
 */
public class DepthExtension implements OpcodeExtension {

    @Override
    public String getName() {
        return "DEPTH";
    }

    @Override
    public int getCode() {
        return 0x18;
    }

    @Override
    public boolean hasOperand() {
        return false;
    }

    @Override
    public void execute(ExecutionContext context, Integer operand) {
        context.getStack().push(context.getStack().size());
    }
}
