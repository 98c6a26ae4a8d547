package org.stackmac.assembler;

import org.stackmac.Messages;
import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;

/**
 * Thrown when a source program cannot be assembled. Carries the program name, file name,
 * line number and the text of the offending line.
 */
public class AssemblerException extends StackMachineException {

    public final String programName;
    public final String fileName;
    public final int lineNumber;
    public final String lineContent;

    public AssemblerException(ErrorCode errorCode, String programName, String fileName, int lineNumber,
                              String message, String lineContent) {
        this(errorCode, programName, fileName, lineNumber, message, lineContent, null);
    }

    public AssemblerException(ErrorCode errorCode, String programName, String fileName, int lineNumber,
                              String message, String lineContent, Throwable cause) {
        super(errorCode, message, cause);
        this.programName = programName;
        this.fileName = fileName;
        this.lineNumber = lineNumber;
        this.lineContent = lineContent;
    }

    /**
     * Renders the error for the user: a location line followed, if known, by the offending source line.
     * @return The localized multi-line message.
     */
    @Override
    public String getFormattedMessage() {
        String location = lineNumber > 0
                ? Messages.get("assembler.error.location", programName, fileName, lineNumber, getMessage())
                : Messages.get("assembler.error.location.noLine", programName, fileName, getMessage());
        if (lineContent == null || lineContent.isBlank()) {
            return location;
        }
        return location + System.lineSeparator() + Messages.get("assembler.error.sourceLine", lineContent.strip());
    }
}
