package org.stackmac.assembler;

import org.stackmac.bytecode.BytecodeCodec;
import org.stackmac.bytecode.BytecodeRecord;
import org.stackmac.runtime.model.Instruction;

import java.util.List;

/**
 * Turns bytecode back into source text that reassembles to the same bytes.
 * <p>
 * Output starts with a comment header naming the source and the instruction count, followed by
 * a blank line and one instruction per line. Annotations are written as comments, so they do not
 * change the reassembled program.
 */
public class Disassembler {

    private static final int INSTRUCTION_COLUMN_WIDTH = 20;

    private final BytecodeCodec codec;

    public Disassembler(BytecodeCodec codec) {
        this.codec = codec;
    }

    /**
     * Disassembles bytecode.
     *
     * @param bytecode The bytecode.
     * @param sourceName The name shown in the header, usually the bytecode file name.
     * @param mode The annotation mode.
     * @return The source text, one line per instruction, each terminated by a newline.
     * @throws org.stackmac.bytecode.BytecodeFormatException if the bytecode is invalid.
     */
    public String disassemble(byte[] bytecode, String sourceName, DisassemblyMode mode) {
        List<BytecodeRecord> records = codec.decodeRecords(bytecode);

        StringBuilder sb = new StringBuilder();
        sb.append("# Disassembled from ").append(sourceName).append('\n');
        sb.append("# ").append(records.size()).append(" instructions").append('\n');
        sb.append('\n');

        for (BytecodeRecord record : records) {
            Instruction instruction = codec.toInstruction(record);
            sb.append(formatLine(instruction, record, mode)).append('\n');
        }
        return sb.toString();
    }

    private String formatLine(Instruction instruction, BytecodeRecord record, DisassemblyMode mode) {
        String text = instruction.toString();
        return switch (mode) {
            case PLAIN -> text;
            case ADDRESSES -> String.format("%-" + INSTRUCTION_COLUMN_WIDTH + "s # @0x%04x", text, record.offset());
            case VERBOSE -> String.format("%-" + INSTRUCTION_COLUMN_WIDTH + "s # @0x%04x: %s (op=0x%02x)",
                    text, record.offset(), record.hex(), record.opcodeNumber());
        };
    }
}
