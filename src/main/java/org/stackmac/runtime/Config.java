package org.stackmac.runtime;

/**
 * Provides the fixed constants of the stack machine.
 * Values that users may tune are read from HOCON configuration instead; the constants here
 * are their defaults. This class is not meant to be instantiated.
 */
public final class Config {

    private Config() {}

    /**
     * The cycle cost of an extension opcode that does not declare one.
     */
    public static final int DEFAULT_CYCLE_COST = 1;

    /**
     * The default number of stack values shown in a trace event.
     */
    public static final int TRACE_STACK_LIMIT = 10;

    /**
     * The largest opcode number that fits the one-byte opcode field of the bytecode format.
     */
    public static final int MAX_OPCODE_NUMBER = 0xFF;

    /**
     * Maximum number of opcode names offered as suggestions for an unknown mnemonic.
     */
    public static final int MAX_SUGGESTIONS = 3;

    /**
     * Minimum similarity ratio (0.0 - 1.0) for an opcode name to be suggested.
     */
    public static final double SUGGESTION_THRESHOLD = 0.6;
}
