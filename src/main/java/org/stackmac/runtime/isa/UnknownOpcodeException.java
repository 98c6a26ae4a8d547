package org.stackmac.runtime.isa;

import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;

import java.util.List;

/**
 * Thrown when a mnemonic or opcode number is not registered.
 * Carries the names of similarly spelled opcodes for "did you mean" hints.
 */
public class UnknownOpcodeException extends StackMachineException {

    private final String opcode;
    private final List<String> suggestions;

    public UnknownOpcodeException(String opcode, List<String> suggestions) {
        super(ErrorCode.UNKNOWN_OPCODE, buildMessage(opcode, suggestions));
        this.opcode = opcode;
        this.suggestions = List.copyOf(suggestions);
    }

    public String getOpcode() {
        return opcode;
    }

    @Override
    public List<String> getSuggestions() {
        return suggestions;
    }

    private static String buildMessage(String opcode, List<String> suggestions) {
        String msg = "Unknown opcode: " + opcode;
        if (!suggestions.isEmpty()) {
            msg += " (did you mean " + String.join(", ", suggestions) + "?)";
        }
        return msg;
    }
}
