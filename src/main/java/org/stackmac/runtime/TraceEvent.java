package org.stackmac.runtime;

import org.stackmac.runtime.model.Instruction;

import java.util.List;

/**
 * A read-only snapshot of the machine taken just before an instruction executes.
 *
 * @param programCounter The address of the instruction about to execute.
 * @param instruction The instruction about to execute.
 * @param stackTop The top values of the stack, bottom to top (the top of the stack is last).
 * @param stackDepth The full depth of the stack, which may exceed {@code stackTop.size()}.
 */
public record TraceEvent(int programCounter, Instruction instruction, List<Integer> stackTop, int stackDepth) {

    public TraceEvent {
        stackTop = List.copyOf(stackTop);
    }

    /**
     * Formats the event as a single trace line, e.g. {@code PC:  3 PUSH 1       Stack: [5, 5]}.
     */
    @Override
    public String toString() {
        return String.format("PC:%3d %-12s Stack: %s", programCounter, instruction, stackTop);
    }
}
