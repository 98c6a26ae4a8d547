package org.stackmac.runtime;

import org.stackmac.runtime.model.Instruction;
import org.stackmac.runtime.model.OperandStack;

/**
 * The view of a running machine that an instruction behavior gets while it executes.
 * <p>
 * A context is only valid during the {@code execute} call it was passed to.
 */
public interface ExecutionContext {

    /**
     * @return The operand stack of the running machine.
     */
    OperandStack getStack();

    /**
     * @return The address of the instruction being executed.
     */
    int getProgramCounter();

    /**
     * @return The instruction being executed.
     */
    Instruction getCurrentInstruction();

    /**
     * Emits a value as a program output event.
     * @param value The value to emit.
     */
    void emit(int value);

    /**
     * Sets the address of the next instruction. The program counter is not advanced afterwards.
     * @param address The target address. Targets outside the program end the run normally.
     */
    void jumpTo(int address);

    /**
     * Stops the machine after the current instruction.
     */
    void halt();
}
