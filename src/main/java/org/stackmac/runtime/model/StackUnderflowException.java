package org.stackmac.runtime.model;

import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;

/**
 * Thrown when an instruction needs more values than the operand stack holds.
 */
public class StackUnderflowException extends StackMachineException {

    public StackUnderflowException(String message) {
        super(ErrorCode.STACK_UNDERFLOW, message);
    }
}
