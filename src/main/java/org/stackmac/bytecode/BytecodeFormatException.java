package org.stackmac.bytecode;

import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;

/**
 * Thrown when a byte sequence is not a valid bytecode file. Carries the byte offset at which the
 * problem was detected.
 */
public class BytecodeFormatException extends StackMachineException {

    private final long offset;

    public BytecodeFormatException(ErrorCode errorCode, long offset, String message) {
        super(errorCode, message);
        this.offset = offset;
    }

    /**
     * @return The byte offset of the offending data.
     */
    public long getOffset() {
        return offset;
    }
}
