package org.stackmac.runtime;

/**
 * Drives step mode: the machine asks the controller before each instruction whether to go on.
 * This is the only place where a run may block.
 */
@FunctionalInterface
public interface StepController {

    /**
     * The decision taken at a suspension point.
     */
    enum Decision {
        /** Execute the pending instruction. */
        CONTINUE,
        /** End the run now, like HALT, without executing the pending instruction. */
        INTERRUPT
    }

    /**
     * Called after the trace event of the pending instruction has been emitted.
     *
     * @param event The snapshot of the pending instruction.
     * @return Whether to continue or to interrupt the run.
     */
    Decision awaitStep(TraceEvent event);
}
