package org.stackmac.assembler;

import org.stackmac.Messages;
import org.stackmac.api.ErrorCode;
import org.stackmac.runtime.isa.OpcodeRegistry;
import org.stackmac.runtime.isa.UnknownOpcodeException;
import org.stackmac.runtime.model.Instruction;
import org.stackmac.runtime.model.Program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Runs the two assembler passes over a list of source lines.
 * <p>
 * Pass 1 strips comments, records every label at the address of the next instruction and
 * validates mnemonics. Pass 2 resolves operands: for jumps a token that is not an integer literal
 * is a label reference, everything else must be a signed 32-bit integer.
 */
public class PassManager {

    private static final Pattern INTEGER_LITERAL = Pattern.compile("[+-]?\\d+");
    private static final Set<String> LABEL_OPCODES = Set.of("JUMP", "JZ");

    private final String programName;
    private final OpcodeRegistry registry;

    private final Map<String, Integer> labelMap = new LinkedHashMap<>();
    private final List<PendingInstruction> pending = new ArrayList<>();
    private final List<Instruction> instructions = new ArrayList<>();
    private final Map<Integer, AnnotatedLine> sourceMap = new LinkedHashMap<>();

    /** An instruction accepted by pass 1, operand still unresolved. */
    private record PendingInstruction(String opcode, String operandToken, AnnotatedLine line) {}

    public PassManager(String programName, OpcodeRegistry registry) {
        this.programName = programName;
        this.registry = registry;
    }

    /**
     * Runs both passes.
     * @param lines The source lines.
     * @throws AssemblerException on the first error found.
     */
    public void runPasses(List<AnnotatedLine> lines) {
        for (AnnotatedLine line : lines) {
            firstPass(line);
        }
        for (PendingInstruction instruction : pending) {
            secondPass(instruction);
        }
    }

    private void firstPass(AnnotatedLine line) {
        String code = line.content().split("#", 2)[0].strip();
        if (code.isEmpty()) {
            return;
        }

        if (code.endsWith(":")) {
            String label = code.substring(0, code.length() - 1).strip();
            if (label.isEmpty()) {
                throw error(ErrorCode.EMPTY_LABEL_NAME, line, Messages.get("assembler.error.emptyLabelName"));
            }
            if (labelMap.containsKey(label)) {
                throw error(ErrorCode.DUPLICATE_LABEL, line, Messages.get("assembler.error.duplicateLabel", label));
            }
            labelMap.put(label, pending.size());
            return;
        }

        String[] parts = code.split("\\s+", 2);
        String opcode = parts[0].toUpperCase(Locale.ROOT);
        if (!registry.contains(opcode)) {
            List<String> suggestions = registry.suggest(opcode);
            String message = suggestions.isEmpty()
                    ? Messages.get("assembler.error.unknownOpcode", opcode)
                    : Messages.get("assembler.error.unknownOpcode.suggestions", opcode, String.join(", ", suggestions));
            throw new AssemblerException(ErrorCode.UNKNOWN_OPCODE, programName, line.fileName(), line.lineNumber(),
                    message, line.content(), new UnknownOpcodeException(opcode, suggestions));
        }
        String operandToken = parts.length == 2 ? parts[1].strip() : null;
        pending.add(new PendingInstruction(opcode, operandToken, line));
    }

    private void secondPass(PendingInstruction instruction) {
        String opcode = instruction.opcode();
        String token = instruction.operandToken();
        AnnotatedLine line = instruction.line();

        Integer operand = null;
        if (token != null) {
            if (LABEL_OPCODES.contains(opcode) && !INTEGER_LITERAL.matcher(token).matches()) {
                operand = Optional.ofNullable(labelMap.get(token))
                        .orElseThrow(() -> error(ErrorCode.UNDEFINED_LABEL, line,
                                Messages.get("assembler.error.undefinedLabel", token)));
            } else {
                operand = parseOperand(opcode, token, line);
            }
        } else if (registry.hasOperand(opcode)) {
            throw error(ErrorCode.INVALID_OPERAND, line, Messages.get("assembler.error.missingOperand", opcode));
        }

        sourceMap.put(instructions.size(), line);
        instructions.add(new Instruction(opcode, operand));
    }

    private int parseOperand(String opcode, String token, AnnotatedLine line) {
        String key = LABEL_OPCODES.contains(opcode) ? "assembler.error.invalidOperand.orLabel" : "assembler.error.invalidOperand";
        if (!INTEGER_LITERAL.matcher(token).matches()) {
            throw error(ErrorCode.INVALID_OPERAND, line, Messages.get(key, token));
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw error(ErrorCode.INVALID_OPERAND, line, Messages.get("assembler.error.operandOutOfRange", token));
        }
    }

    private AssemblerException error(ErrorCode code, AnnotatedLine line, String message) {
        return new AssemblerException(code, programName, line.fileName(), line.lineNumber(), message, line.content());
    }

    public Program getProgram() {
        return new Program(instructions);
    }

    /**
     * @return Label name to instruction address, in declaration order.
     */
    public Map<String, Integer> getLabelMap() {
        return Collections.unmodifiableMap(labelMap);
    }

    /**
     * @return Instruction address to the source line it was assembled from.
     */
    public Map<Integer, AnnotatedLine> getSourceMap() {
        return Collections.unmodifiableMap(sourceMap);
    }
}
