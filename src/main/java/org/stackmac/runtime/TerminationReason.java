package org.stackmac.runtime;

/**
 * Why a run ended without an error.
 */
public enum TerminationReason {
    /** The program counter left the program. */
    COMPLETED,
    /** A HALT instruction was executed. */
    HALTED,
    /** The run was interrupted by the user between two instructions. */
    CANCELLED
}
