package org.stackmac.assembler;

import org.stackmac.api.ErrorCode;
import org.stackmac.bytecode.BytecodeCodec;
import org.stackmac.bytecode.BytecodeFormatException;
import org.stackmac.runtime.extensions.NegExtension;
import org.stackmac.runtime.isa.OpcodeRegistry;
import org.stackmac.runtime.model.Program;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.stackmac.runtime.model.Instruction.of;

@Tag("unit")
class DisassemblerTest {

    private BytecodeCodec codec;
    private Disassembler disassembler;
    private Assembler assembler;

    @BeforeEach
    void setUp() {
        OpcodeRegistry registry = new OpcodeRegistry();
        registry.registerExtension(new NegExtension());
        registry.seal();
        codec = new BytecodeCodec(registry);
        disassembler = new Disassembler(codec);
        assembler = new Assembler(registry);
    }

    @Test
    void plainModeWritesHeaderAndOneInstructionPerLine() {
        byte[] bytes = codec.encode(Program.of(of("PUSH", 5), of("NEG"), of("PRINT"), of("HALT")));

        String text = disassembler.disassemble(bytes, "neg.stkm", DisassemblyMode.PLAIN);

        assertThat(text).isEqualTo("""
                # Disassembled from neg.stkm
                # 4 instructions

                PUSH 5
                NEG
                PRINT
                HALT
                """);
    }

    @Test
    void addressModeAnnotatesByteOffsets() {
        byte[] bytes = codec.encode(Program.of(of("PUSH", 5), of("HALT")));

        List<String> lines = disassembler.disassemble(bytes, "a.stkm", DisassemblyMode.ADDRESSES).lines().toList();

        assertThat(lines).endsWith(
                "PUSH 5               # @0x0009",
                "HALT                 # @0x000e");
    }

    @Test
    void verboseModeAddsRawBytesAndOpcodeNumber() {
        byte[] bytes = codec.encode(Program.of(of("PUSH", -1), of("HALT")));

        List<String> lines = disassembler.disassemble(bytes, "v.stkm", DisassemblyMode.VERBOSE).lines().toList();

        assertThat(lines).endsWith(
                "PUSH -1              # @0x0009: 01 ff ff ff ff (op=0x01)",
                "HALT                 # @0x000e: ff 00 00 00 00 (op=0xff)");
    }

    @Test
    void emptyProgramHasOnlyHeader() {
        String text = disassembler.disassemble(codec.encode(Program.of()), "empty.stkm", DisassemblyMode.VERBOSE);

        assertThat(text).isEqualTo("# Disassembled from empty.stkm\n# 0 instructions\n\n");
    }

    @ParameterizedTest
    @EnumSource(DisassemblyMode.class)
    void reassemblingTheOutputReproducesTheBytes(DisassemblyMode mode) {
        byte[] bytes = codec.encode(Program.of(
                of("PUSH", 10), of("DUP"), of("JZ", 6), of("PUSH", 1), of("SUB"),
                of("JUMP", 1), of("POP", 0), of("SWAP", 3), of("NEG"), of("HALT")));

        String text = disassembler.disassemble(bytes, "loop.stkm", mode);
        byte[] reassembled = codec.encode(assembler.assemble(Arrays.asList(text.split("\n")), "loop.asm"));

        assertThat(reassembled).isEqualTo(bytes);
    }

    @Test
    void unknownOpcodeNumberFails() {
        byte[] bytes = codec.encode(Program.of(of("PUSH", 1), of("HALT")));
        bytes[BytecodeCodec.recordOffset(0)] = 0x55;

        assertThatThrownBy(() -> disassembler.disassemble(bytes, "bad.stkm", DisassemblyMode.PLAIN))
                .isInstanceOfSatisfying(BytecodeFormatException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_OPCODE_NUMBER));
    }
}
