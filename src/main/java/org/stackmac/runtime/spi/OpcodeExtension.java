package org.stackmac.runtime.spi;

import org.stackmac.runtime.Config;
import org.stackmac.runtime.isa.InstructionBehavior;

/**
 * Service provider interface for extension opcodes.
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader} (list them in
 * {@code META-INF/services/org.stackmac.runtime.spi.OpcodeExtension}) and need a public
 * no-argument constructor. An extension must not reuse the name or number of another opcode;
 * if it does, it is rejected at load time and the existing opcode stays in place.
 */
public interface OpcodeExtension extends InstructionBehavior {

    /**
     * @return The upper-case mnemonic, e.g. {@code MOD}.
     */
    String getName();

    /**
     * @return The opcode number written to bytecode, 0-255.
     */
    int getCode();

    /**
     * @return Whether instructions with this opcode carry an operand.
     */
    boolean hasOperand();

    /**
     * @return The simulated cycle cost per execution.
     */
    default int getCycleCost() {
        return Config.DEFAULT_CYCLE_COST;
    }
}
