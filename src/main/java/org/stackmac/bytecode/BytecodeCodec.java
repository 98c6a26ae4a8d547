package org.stackmac.bytecode;

import org.stackmac.api.ErrorCode;
import org.stackmac.runtime.isa.OpcodeDefinition;
import org.stackmac.runtime.isa.OpcodeRegistry;
import org.stackmac.runtime.model.Instruction;
import org.stackmac.runtime.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts programs to and from the binary bytecode format.
 * <pre>
 *   offset 0  4 bytes  magic "STKM"
 *   offset 4  1 byte   format version (1)
 *   offset 5  4 bytes  instruction count, unsigned little-endian
 *   offset 9  count * 5-byte records: opcode byte, signed little-endian operand
 * </pre>
 * An absent operand is written as 0. The file must end exactly after the last record.
 */
public class BytecodeCodec {

    private static final Logger LOG = LoggerFactory.getLogger(BytecodeCodec.class);

    public static final byte[] MAGIC = "STKM".getBytes(StandardCharsets.US_ASCII);
    public static final int VERSION = 1;
    public static final int HEADER_SIZE = 9;
    public static final int RECORD_SIZE = 5;

    private final OpcodeRegistry registry;

    public BytecodeCodec(OpcodeRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param index An instruction address.
     * @return The byte offset of that instruction's record.
     */
    public static int recordOffset(int index) {
        return HEADER_SIZE + RECORD_SIZE * index;
    }

    /**
     * Encodes a program.
     *
     * @param program The program; every opcode must be registered.
     * @return The bytecode.
     * @throws org.stackmac.runtime.isa.UnknownOpcodeException if an opcode is not registered.
     */
    public byte[] encode(Program program) {
        ByteBuffer buffer = ByteBuffer.allocate(recordOffset(program.size())).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(MAGIC);
        buffer.put((byte) VERSION);
        buffer.putInt(program.size());
        for (Instruction instruction : program) {
            OpcodeDefinition definition = registry.lookupByName(instruction.opcode());
            buffer.put((byte) definition.code());
            buffer.putInt(instruction.hasOperand() ? instruction.operand() : 0);
        }
        LOG.debug("Encoded {} instructions into {} bytes", program.size(), buffer.capacity());
        return buffer.array();
    }

    /**
     * Decodes bytecode into a program.
     *
     * @param bytes The bytecode.
     * @return The program.
     * @throws BytecodeFormatException if the bytes are malformed or use an unregistered opcode number.
     */
    public Program decode(byte[] bytes) {
        List<BytecodeRecord> records = decodeRecords(bytes);
        List<Instruction> instructions = new ArrayList<>(records.size());
        for (BytecodeRecord record : records) {
            instructions.add(toInstruction(record));
        }
        return new Program(instructions);
    }

    /**
     * Converts one record to an instruction. A zero operand on an opcode without operand means
     * "no operand"; any other value is kept.
     *
     * @param record The raw record.
     * @return The instruction.
     * @throws BytecodeFormatException if the opcode number is not registered.
     */
    public Instruction toInstruction(BytecodeRecord record) {
        Optional<OpcodeDefinition> definition = registry.findByCode(record.opcodeNumber());
        if (definition.isEmpty()) {
            throw new BytecodeFormatException(ErrorCode.UNKNOWN_OPCODE_NUMBER, record.offset(), String.format(
                    "Unknown opcode number 0x%02x at offset %d", record.opcodeNumber(), record.offset()));
        }
        OpcodeDefinition opcode = definition.get();
        if (!opcode.hasOperand() && record.operand() == 0) {
            return Instruction.of(opcode.name());
        }
        return Instruction.of(opcode.name(), record.operand());
    }

    /**
     * Validates the header and the length of the bytecode and splits it into raw records.
     * Opcode numbers are not resolved.
     *
     * @param bytes The bytecode.
     * @return The records, in address order.
     * @throws BytecodeFormatException if the header is invalid or the length does not match the
     *         instruction count.
     */
    public List<BytecodeRecord> decodeRecords(byte[] bytes) {
        for (int i = 0; i < MAGIC.length && i < bytes.length; i++) {
            if (bytes[i] != MAGIC[i]) {
                throw new BytecodeFormatException(ErrorCode.BAD_MAGIC, 0, "Not a bytecode file: bad magic number");
            }
        }
        if (bytes.length < HEADER_SIZE) {
            if (bytes.length > MAGIC.length && Byte.toUnsignedInt(bytes[MAGIC.length]) != VERSION) {
                throw unsupportedVersion(bytes[MAGIC.length]);
            }
            throw new BytecodeFormatException(ErrorCode.TRUNCATED_BYTECODE, bytes.length, String.format(
                    "Truncated bytecode: header needs %d bytes, got %d", HEADER_SIZE, bytes.length));
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position(MAGIC.length);
        byte version = buffer.get();
        if (Byte.toUnsignedInt(version) != VERSION) {
            throw unsupportedVersion(version);
        }
        long count = Integer.toUnsignedLong(buffer.getInt());
        long expected = HEADER_SIZE + RECORD_SIZE * count;
        if (bytes.length < expected) {
            throw new BytecodeFormatException(ErrorCode.TRUNCATED_BYTECODE, bytes.length, String.format(
                    "Truncated bytecode: header declares %d instructions (%d bytes), got %d bytes",
                    count, expected, bytes.length));
        }
        if (bytes.length > expected) {
            throw new BytecodeFormatException(ErrorCode.TRAILING_DATA, expected, String.format(
                    "Trailing data: %d byte(s) after the last of %d instructions",
                    bytes.length - expected, count));
        }

        List<BytecodeRecord> records = new ArrayList<>((int) count);
        for (int i = 0; i < count; i++) {
            int offset = buffer.position();
            byte[] raw = new byte[RECORD_SIZE];
            buffer.get(raw);
            int operand = ByteBuffer.wrap(raw, 1, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
            records.add(new BytecodeRecord(i, offset, Byte.toUnsignedInt(raw[0]), operand, raw));
        }
        LOG.debug("Decoded {} records from {} bytes", count, bytes.length);
        return records;
    }

    private static BytecodeFormatException unsupportedVersion(byte version) {
        return new BytecodeFormatException(ErrorCode.UNSUPPORTED_VERSION, MAGIC.length, String.format(
                "Unsupported bytecode version %d (expected %d)", Byte.toUnsignedInt(version), VERSION));
    }

    public OpcodeRegistry getRegistry() {
        return registry;
    }
}
