package org.stackmac.toolchain;

import com.typesafe.config.Config;
import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;
import org.stackmac.assembler.Assembler;
import org.stackmac.assembler.Disassembler;
import org.stackmac.assembler.DisassemblyMode;
import org.stackmac.bytecode.BytecodeCodec;
import org.stackmac.runtime.ExecutionListener;
import org.stackmac.runtime.ExecutionResult;
import org.stackmac.runtime.VirtualMachine;
import org.stackmac.runtime.isa.OpcodeRegistry;
import org.stackmac.runtime.model.Program;
import org.stackmac.runtime.spi.ExtensionLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File-level entry points: compile a source file to bytecode, run a bytecode file, and
 * disassemble a bytecode file.
 * <p>
 * All operations share one sealed {@link OpcodeRegistry}. Files are written atomically (temporary
 * file in the target directory, then a move), so a failed operation never leaves a partial file.
 */
public class Toolchain {

    private static final Logger LOG = LoggerFactory.getLogger(Toolchain.class);

    public static final String BYTECODE_SUFFIX = ".stkm";

    private static final String TRACE_STACK_LIMIT_PATH = "stackmac.runtime.trace-stack-limit";
    private static final String EXTENSIONS_PATH = "stackmac.extensions";

    private final OpcodeRegistry registry;
    private final int traceStackLimit;
    private final Assembler assembler;
    private final BytecodeCodec codec;
    private final Disassembler disassembler;

    public Toolchain(OpcodeRegistry registry) {
        this(registry, org.stackmac.runtime.Config.TRACE_STACK_LIMIT);
    }

    public Toolchain(OpcodeRegistry registry, int traceStackLimit) {
        this.registry = registry;
        this.traceStackLimit = traceStackLimit;
        this.assembler = new Assembler(registry);
        this.codec = new BytecodeCodec(registry);
        this.disassembler = new Disassembler(codec);
    }

    /**
     * Builds a toolchain from the application configuration: loads extensions from
     * {@code stackmac.extensions} and reads the trace stack limit from {@code stackmac.runtime}.
     *
     * @param config The resolved application configuration.
     * @return The toolchain, with a sealed registry.
     */
    public static Toolchain fromConfig(Config config) {
        OpcodeRegistry registry = ExtensionLoader.createRegistry(config.getConfig(EXTENSIONS_PATH));
        int limit = config.hasPath(TRACE_STACK_LIMIT_PATH)
                ? config.getInt(TRACE_STACK_LIMIT_PATH)
                : org.stackmac.runtime.Config.TRACE_STACK_LIMIT;
        return new Toolchain(registry, limit);
    }

    /**
     * Returns the default bytecode path for a source file: the same path with its extension
     * replaced by {@value #BYTECODE_SUFFIX}.
     *
     * @param source The source file.
     * @return The bytecode file path.
     */
    public static Path defaultOutput(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return source.resolveSibling(base + BYTECODE_SUFFIX);
    }

    /**
     * Compiles a source file.
     *
     * @param source The source file.
     * @param output The bytecode file, or {@code null} for {@link #defaultOutput(Path)}.
     * @return The path written.
     * @throws org.stackmac.assembler.AssemblerException if the source cannot be read or is invalid.
     * @throws StackMachineException with {@link ErrorCode#IO_ERROR} if the output cannot be written.
     */
    public Path compile(Path source, Path output) {
        Path target = output != null ? output : defaultOutput(source);
        Program program = assembler.assembleFile(source);
        byte[] bytecode = codec.encode(program);
        writeAtomically(target, bytecode);
        LOG.info("Compiled {} instructions from '{}' to '{}'", program.size(), source, target);
        return target;
    }

    /**
     * Reads and decodes a bytecode file.
     *
     * @param bytecode The bytecode file.
     * @return The program.
     * @throws StackMachineException with {@link ErrorCode#IO_ERROR} if the file cannot be read.
     * @throws org.stackmac.bytecode.BytecodeFormatException if the bytes are invalid.
     */
    public Program load(Path bytecode) {
        Program program = codec.decode(readBytes(bytecode));
        LOG.debug("Loaded {} instructions from '{}'", program.size(), bytecode);
        return program;
    }

    /**
     * Creates a machine with the given program loaded. Callers configure trace and step mode
     * before calling {@link VirtualMachine#execute()}.
     *
     * @param program The program.
     * @return An idle machine.
     */
    public VirtualMachine createMachine(Program program) {
        VirtualMachine vm = new VirtualMachine(registry, traceStackLimit);
        vm.load(program);
        return vm;
    }

    /**
     * Decodes and runs a bytecode file to completion.
     *
     * @param bytecode The bytecode file.
     * @param listeners Listeners registered before the run.
     * @return The outcome.
     * @throws org.stackmac.runtime.ExecutionException if an instruction fails.
     */
    public ExecutionResult run(Path bytecode, ExecutionListener... listeners) {
        VirtualMachine vm = createMachine(load(bytecode));
        for (ExecutionListener listener : listeners) {
            vm.addListener(listener);
        }
        return vm.execute();
    }

    /**
     * Disassembles a bytecode file.
     *
     * @param bytecode The bytecode file.
     * @param mode The annotation mode.
     * @return The source text.
     */
    public String disassemble(Path bytecode, DisassemblyMode mode) {
        return disassembler.disassemble(readBytes(bytecode), bytecode.getFileName().toString(), mode);
    }

    /**
     * Disassembles a bytecode file into a text file.
     *
     * @param bytecode The bytecode file.
     * @param mode The annotation mode.
     * @param output The text file to write.
     * @return The path written.
     */
    public Path disassemble(Path bytecode, DisassemblyMode mode, Path output) {
        String text = disassemble(bytecode, mode);
        writeAtomically(output, text.getBytes(StandardCharsets.UTF_8));
        LOG.info("Disassembled '{}' to '{}'", bytecode, output);
        return output;
    }

    private byte[] readBytes(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new StackMachineException(ErrorCode.IO_ERROR, "Bytecode file '" + file + "' not found", e);
        } catch (IOException e) {
            throw new StackMachineException(ErrorCode.IO_ERROR, "Cannot read '" + file + "': " + e.getMessage(), e);
        }
    }

    private void writeAtomically(Path target, byte[] content) {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + absolute.getFileName(), ".tmp");
            Files.write(temp, content);
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new StackMachineException(ErrorCode.IO_ERROR, "Cannot write '" + target + "': " + e.getMessage(), e);
        }
    }

    public OpcodeRegistry getRegistry() {
        return registry;
    }

    public Assembler getAssembler() {
        return assembler;
    }

    public BytecodeCodec getCodec() {
        return codec;
    }

    public Disassembler getDisassembler() {
        return disassembler;
    }
}
