package org.stackmac.runtime;

/**
 * The two states of the virtual machine.
 */
public enum MachineState {
    /** No program loaded, halted, finished, or failed. */
    IDLE,
    /** Inside {@link VirtualMachine#execute()}. */
    RUNNING
}
