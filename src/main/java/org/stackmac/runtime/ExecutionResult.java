package org.stackmac.runtime;

/**
 * The outcome of a run that ended without an error.
 *
 * @param reason Why the run ended.
 * @param programCounter The program counter when the run ended.
 * @param stats The execution counters.
 */
public record ExecutionResult(TerminationReason reason, int programCounter, ExecutionStats stats) {

    public boolean isCancelled() {
        return reason == TerminationReason.CANCELLED;
    }
}
