package org.stackmac.runtime;

/**
 * Execution counters of a run. They are observational only and never affect control flow.
 *
 * @param instructions The number of dispatched instructions.
 * @param cycles The sum of the cycle costs of the dispatched instructions.
 */
public record ExecutionStats(long instructions, long cycles) {

    public static final ExecutionStats EMPTY = new ExecutionStats(0, 0);
}
