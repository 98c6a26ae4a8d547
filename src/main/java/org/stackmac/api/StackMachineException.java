package org.stackmac.api;

import java.util.List;

/**
 * Base class of every error raised by the assembler, the bytecode codec, the registry
 * and the virtual machine.
 * <p>
 * All of them are fatal to the operation in progress; none is retried internally.
 */
public class StackMachineException extends RuntimeException {

    private final ErrorCode errorCode;

    /**
     * Constructs a new exception.
     * @param errorCode The machine-readable error code.
     * @param message The detail message.
     */
    public StackMachineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Constructs a new exception with a cause.
     * @param errorCode The machine-readable error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public StackMachineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Returns similarly spelled opcode names that the caller may have meant.
     * Only unknown-opcode errors carry suggestions; wrappers report those of their cause.
     *
     * @return Up to three suggestions, best match first, possibly empty.
     */
    public List<String> getSuggestions() {
        if (getCause() instanceof StackMachineException cause) {
            return cause.getSuggestions();
        }
        return List.of();
    }

    /**
     * Returns a message suitable for console output. Subclasses with source context override this.
     * @return The formatted message.
     */
    public String getFormattedMessage() {
        return getMessage();
    }
}
