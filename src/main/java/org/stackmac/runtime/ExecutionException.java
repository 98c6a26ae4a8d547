package org.stackmac.runtime;

import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;
import org.stackmac.runtime.model.Instruction;

/**
 * Thrown when an instruction fails at runtime. The run is aborted and the machine keeps the
 * state it had at the failing instruction.
 */
public class ExecutionException extends StackMachineException {

    private final int programCounter;
    private final Instruction instruction;

    public ExecutionException(ErrorCode errorCode, int programCounter, Instruction instruction, String message, Throwable cause) {
        super(errorCode, String.format("%s at PC %d (%s)", message, programCounter, instruction), cause);
        this.programCounter = programCounter;
        this.instruction = instruction;
    }

    public int getProgramCounter() {
        return programCounter;
    }

    public Instruction getInstruction() {
        return instruction;
    }
}
