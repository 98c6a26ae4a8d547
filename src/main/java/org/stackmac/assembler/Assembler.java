package org.stackmac.assembler;

import org.stackmac.Messages;
import org.stackmac.api.ErrorCode;
import org.stackmac.runtime.isa.OpcodeRegistry;
import org.stackmac.runtime.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles source text into a {@link Program}.
 * <p>
 * Source format: one instruction, label or comment per line. {@code #} starts a comment,
 * {@code NAME:} declares a label at the address of the next instruction, and an instruction is a
 * mnemonic (case-insensitive) optionally followed by an operand. JUMP and JZ accept a label name
 * in place of an address.
 */
public class Assembler {

    private static final Logger LOG = LoggerFactory.getLogger(Assembler.class);

    private final OpcodeRegistry registry;

    public Assembler(OpcodeRegistry registry) {
        this.registry = registry;
    }

    /**
     * Assembles the given lines.
     *
     * @param lines The source lines.
     * @param programName The name used in error messages, usually the file name.
     * @return The program.
     * @throws AssemblerException if the source is invalid.
     */
    public Program assemble(List<String> lines, String programName) {
        List<AnnotatedLine> annotated = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            annotated.add(new AnnotatedLine(lines.get(i), i + 1, programName));
        }
        return assembleLines(annotated, programName).getProgram();
    }

    /**
     * Runs both passes and returns the pass state, which also holds the label table and the
     * source map.
     *
     * @param lines The annotated source lines.
     * @param programName The name used in error messages.
     * @return The completed passes.
     * @throws AssemblerException if the source is invalid.
     */
    public PassManager assembleLines(List<AnnotatedLine> lines, String programName) {
        PassManager passManager = new PassManager(programName, registry);
        passManager.runPasses(lines);
        LOG.debug("Assembled '{}': {} instructions, {} labels",
                programName, passManager.getProgram().size(), passManager.getLabelMap().size());
        return passManager;
    }

    /**
     * Reads and assembles a source file.
     *
     * @param source The source file.
     * @return The program.
     * @throws AssemblerException with {@link ErrorCode#SOURCE_NOT_FOUND} if the file cannot be read,
     *         or another code if the source is invalid.
     */
    public Program assembleFile(Path source) {
        String fileName = source.getFileName().toString();
        List<String> lines;
        try {
            lines = Files.readAllLines(source, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new AssemblerException(ErrorCode.SOURCE_NOT_FOUND, fileName, source.toString(), -1,
                    Messages.get("assembler.error.sourceNotFound", source), null, e);
        } catch (IOException e) {
            throw new AssemblerException(ErrorCode.SOURCE_NOT_FOUND, fileName, source.toString(), -1,
                    Messages.get("assembler.error.sourceUnreadable", source, e.getMessage()), null, e);
        }
        return assemble(lines, fileName);
    }

    public OpcodeRegistry getRegistry() {
        return registry;
    }
}
