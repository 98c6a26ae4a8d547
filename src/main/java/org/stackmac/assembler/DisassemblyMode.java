package org.stackmac.assembler;

/**
 * How much detail the {@link Disassembler} adds after each instruction.
 */
public enum DisassemblyMode {
    /** Instructions only. */
    PLAIN,
    /** Appends the byte offset of each record. */
    ADDRESSES,
    /** Appends the byte offset, the raw record bytes and the opcode number. */
    VERBOSE
}
