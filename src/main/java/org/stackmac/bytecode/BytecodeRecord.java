package org.stackmac.bytecode;

import java.util.Arrays;

/**
 * One raw instruction record of a bytecode file, before opcode resolution.
 *
 * @param index The instruction address.
 * @param offset The byte offset of the record in the file.
 * @param opcodeNumber The opcode byte, 0-255.
 * @param operand The operand as stored (0 when the opcode has none).
 * @param raw The five bytes of the record.
 */
public record BytecodeRecord(int index, int offset, int opcodeNumber, int operand, byte[] raw) {

    public BytecodeRecord {
        raw = raw.clone();
    }

    @Override
    public byte[] raw() {
        return raw.clone();
    }

    /**
     * @return The record bytes as lower-case hex pairs separated by spaces, e.g. {@code 01 05 00 00 00}.
     */
    public String hex() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < raw.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(String.format("%02x", raw[i] & 0xFF));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BytecodeRecord other)) return false;
        return index == other.index && offset == other.offset && opcodeNumber == other.opcodeNumber
                && operand == other.operand && Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(raw) + index;
    }

    @Override
    public String toString() {
        return "BytecodeRecord[" + index + " @" + offset + ": " + hex() + "]";
    }
}
