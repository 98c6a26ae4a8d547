package org.stackmac.toolchain;

import com.typesafe.config.ConfigFactory;
import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;
import org.stackmac.assembler.AssemblerException;
import org.stackmac.assembler.DisassemblyMode;
import org.stackmac.bytecode.BytecodeFormatException;
import org.stackmac.runtime.ExecutionException;
import org.stackmac.runtime.ExecutionListener;
import org.stackmac.runtime.ExecutionResult;
import org.stackmac.runtime.TerminationReason;
import org.stackmac.runtime.VirtualMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class ToolchainTest {

    @TempDir
    Path dir;

    private Toolchain toolchain;
    private final List<Integer> output = new ArrayList<>();
    private final ExecutionListener collector = new ExecutionListener() {
        @Override
        public void onOutput(int value) {
            output.add(value);
        }
    };

    @BeforeEach
    void setUp() {
        toolchain = Toolchain.fromConfig(ConfigFactory.load());
    }

    private Path copyFixture(String name) throws IOException {
        Path target = dir.resolve(name);
        try (InputStream in = ToolchainTest.class.getResourceAsStream("/programs/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void defaultOutputReplacesExtension() {
        assertThat(Toolchain.defaultOutput(Path.of("src", "prog.asm"))).isEqualTo(Path.of("src", "prog.stkm"));
        assertThat(Toolchain.defaultOutput(Path.of("a.b.asm"))).isEqualTo(Path.of("a.b.stkm"));
        assertThat(Toolchain.defaultOutput(Path.of("noext"))).isEqualTo(Path.of("noext.stkm"));
        assertThat(Toolchain.defaultOutput(Path.of(".hidden"))).isEqualTo(Path.of(".hidden.stkm"));
    }

    @Test
    void fromConfigLoadsStandardExtensions() {
        assertThat(toolchain.getRegistry().isSealed()).isTrue();
        assertThat(toolchain.getRegistry().contains("MOD")).isTrue();
        assertThat(toolchain.getRegistry().contains("PEEK")).isTrue();
    }

    @Test
    void fromConfigHonoursDisabledExtensions() {
        Toolchain plain = Toolchain.fromConfig(
                ConfigFactory.parseString("stackmac.extensions.enabled = false").withFallback(ConfigFactory.load()));

        assertThat(plain.getRegistry().contains("MOD")).isFalse();
    }

    @Test
    void compileWritesBytecodeNextToSource() throws IOException {
        Path source = copyFixture("arithmetic.asm");

        Path written = toolchain.compile(source, null);

        assertThat(written).isEqualTo(dir.resolve("arithmetic.stkm"));
        byte[] bytes = Files.readAllBytes(written);
        assertThat(bytes).hasSize(9 + 7 * 5).startsWith('S', 'T', 'K', 'M', 1, 7, 0, 0, 0);
    }

    @Test
    void compileCreatesMissingOutputDirectories() throws IOException {
        Path source = copyFixture("arithmetic.asm");
        Path target = dir.resolve("out/nested/arith.bin");

        toolchain.compile(source, target);

        assertThat(target).isRegularFile();
    }

    @Test
    void compileAndRunArithmetic() throws IOException {
        Path bytecode = toolchain.compile(copyFixture("arithmetic.asm"), null);

        ExecutionResult result = toolchain.run(bytecode, collector);

        assertThat(output).containsExactly(16);
        assertThat(result.reason()).isEqualTo(TerminationReason.HALTED);
        assertThat(result.programCounter()).isEqualTo(6);
        // PUSH, PUSH, ADD, PUSH, MUL, PRINT, HALT
        assertThat(result.stats().instructions()).isEqualTo(7);
        assertThat(result.stats().cycles()).isEqualTo(1 + 1 + 1 + 1 + 3 + 5 + 1);
    }

    @Test
    void compileAndRunCountdown() throws IOException {
        Path bytecode = toolchain.compile(copyFixture("countdown.asm"), null);

        ExecutionResult result = toolchain.run(bytecode, collector);

        assertThat(output).containsExactly(5, 4, 3, 2, 1);
        assertThat(result.reason()).isEqualTo(TerminationReason.HALTED);
    }

    @Test
    void compileAndRunWithExtensions() throws IOException {
        Path bytecode = toolchain.compile(copyFixture("fizz.asm"), null);
        VirtualMachine vm = toolchain.createMachine(toolchain.load(bytecode));
        vm.addListener(collector);

        ExecutionResult result = vm.execute();

        assertThat(output).containsExactly(3, 6, 9);
        assertThat(vm.getStack().toList()).containsExactly(11);
        assertThat(result.reason()).isEqualTo(TerminationReason.HALTED);
    }

    @Test
    void failedCompileLeavesNoFile() throws IOException {
        Path source = dir.resolve("broken.asm");
        Files.writeString(source, "PUSH 1\nJUMP NOWHERE\n");

        assertThatThrownBy(() -> toolchain.compile(source, null))
                .isInstanceOfSatisfying(AssemblerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.UNDEFINED_LABEL));
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).containsExactly(source);
        }
    }

    @Test
    void compileReplacesExistingOutput() throws IOException {
        Path source = copyFixture("arithmetic.asm");
        Path target = dir.resolve("arithmetic.stkm");
        Files.writeString(target, "stale");

        toolchain.compile(source, target);

        assertThat(Files.readAllBytes(target)).startsWith('S', 'T', 'K', 'M');
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).noneMatch(p -> p.getFileName().toString().endsWith(".tmp"));
        }
    }

    @Test
    void unwritableOutputIsIoError() throws IOException {
        Path source = copyFixture("arithmetic.asm");
        Path blocked = dir.resolve("blocked");
        Files.createDirectories(blocked.resolve("child"));

        assertThatThrownBy(() -> toolchain.compile(source, blocked))
                .isInstanceOfSatisfying(StackMachineException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.IO_ERROR));
    }

    @Test
    void missingBytecodeIsIoError() {
        assertThatThrownBy(() -> toolchain.run(dir.resolve("missing.stkm")))
                .isInstanceOfSatisfying(StackMachineException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.IO_ERROR);
                    assertThat(e.getMessage()).contains("not found");
                });
    }

    @Test
    void invalidBytecodeIsRejectedBeforeExecution() throws IOException {
        Path bytecode = dir.resolve("junk.stkm");
        Files.writeString(bytecode, "definitely not bytecode");

        assertThatThrownBy(() -> toolchain.run(bytecode, collector))
                .isInstanceOfSatisfying(BytecodeFormatException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.BAD_MAGIC));
        assertThat(output).isEmpty();
    }

    @Test
    void runtimeFailurePropagatesAfterEarlierOutput() throws IOException {
        Path source = dir.resolve("div.asm");
        Files.writeString(source, "PUSH 7\nPRINT\nPUSH 1\nPUSH 0\nDIV\n");
        Path bytecode = toolchain.compile(source, null);

        assertThatThrownBy(() -> toolchain.run(bytecode, collector))
                .isInstanceOfSatisfying(ExecutionException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.DIVISION_BY_ZERO);
                    assertThat(e.getProgramCounter()).isEqualTo(4);
                });
        assertThat(output).containsExactly(7);
    }

    @Test
    void disassembleToFileRoundTrips() throws IOException {
        Path bytecode = toolchain.compile(copyFixture("countdown.asm"), null);
        Path listing = dir.resolve("countdown.dis.asm");

        toolchain.disassemble(bytecode, DisassemblyMode.VERBOSE, listing);
        Path again = toolchain.compile(listing, dir.resolve("again.stkm"));

        assertThat(Files.readString(listing)).startsWith("# Disassembled from countdown.stkm\n# 10 instructions\n");
        assertThat(Files.readAllBytes(again)).isEqualTo(Files.readAllBytes(bytecode));
    }
}
