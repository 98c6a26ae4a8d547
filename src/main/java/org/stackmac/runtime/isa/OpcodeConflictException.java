package org.stackmac.runtime.isa;

import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;

/**
 * Thrown when an extension opcode reuses the name or the number of a registered opcode.
 * The registry is left unchanged.
 */
public class OpcodeConflictException extends StackMachineException {

    private final OpcodeDefinition existing;

    public OpcodeConflictException(ErrorCode errorCode, String message, OpcodeDefinition existing) {
        super(errorCode, message);
        this.existing = existing;
    }

    /**
     * @return The entry that already holds the contested name or number.
     */
    public OpcodeDefinition getExisting() {
        return existing;
    }
}
