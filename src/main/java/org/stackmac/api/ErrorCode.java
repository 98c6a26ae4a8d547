package org.stackmac.api;

/**
 * Defines unique, testable error codes for every failure the toolchain can report.
 * This decouples the test logic from the translated error messages.
 */
public enum ErrorCode {
    // region Runtime Errors
    /** A pop or peek was attempted on an empty stack. */
    STACK_UNDERFLOW,
    /** DIV or MOD with a zero divisor. */
    DIVISION_BY_ZERO,
    /** An unknown mnemonic was used, in source or in a loaded program. */
    UNKNOWN_OPCODE,
    /** An extension behavior failed with something other than a toolchain error. */
    EXTENSION_FAILURE,
    // endregion

    // region Assembler Errors
    /** A label was declared twice. */
    DUPLICATE_LABEL,
    /** A label line had no name before the colon. */
    EMPTY_LABEL_NAME,
    /** A JUMP or JZ referenced a label that was never declared. */
    UNDEFINED_LABEL,
    /** An operand was not a signed 32-bit integer literal, or was missing. */
    INVALID_OPERAND,
    /** The source file could not be read. */
    SOURCE_NOT_FOUND,
    // endregion

    // region Bytecode Errors
    /** The file does not start with the STKM magic. */
    BAD_MAGIC,
    /** The format version byte is not supported. */
    UNSUPPORTED_VERSION,
    /** A record carries an opcode number that is not registered. */
    UNKNOWN_OPCODE_NUMBER,
    /** The input ended before the number of records promised by the header. */
    TRUNCATED_BYTECODE,
    /** Bytes follow the last record promised by the header. */
    TRAILING_DATA,
    /** A bytecode file could not be read or written. */
    IO_ERROR,
    // endregion

    // region Registry Errors
    /** An extension tried to reuse an existing opcode name. */
    NAME_CONFLICT,
    /** An extension tried to reuse an existing opcode number. */
    CODE_CONFLICT
    // endregion
}
