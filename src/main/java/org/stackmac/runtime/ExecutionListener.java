package org.stackmac.runtime;

/**
 * Observes a running machine. All methods are called on the thread that runs the machine.
 */
public interface ExecutionListener {

    /**
     * Called before each instruction when trace mode is on.
     * @param event The snapshot.
     */
    default void onTrace(TraceEvent event) {
    }

    /**
     * Called for each value emitted by PRINT (or by an extension).
     * @param value The emitted value.
     */
    default void onOutput(int value) {
    }

    /**
     * Called when a HALT instruction ends the run.
     */
    default void onHalt() {
    }

    /**
     * Called once when a run ends without an error.
     * @param result The outcome.
     */
    default void onFinished(ExecutionResult result) {
    }
}
