package org.stackmac.runtime.isa;

import org.stackmac.api.ErrorCode;
import org.stackmac.runtime.Config;
import org.stackmac.runtime.isa.instructions.ArithmeticInstruction;
import org.stackmac.runtime.isa.instructions.ControlFlowInstruction;
import org.stackmac.runtime.isa.instructions.OutputInstruction;
import org.stackmac.runtime.isa.instructions.StackInstruction;
import org.stackmac.runtime.spi.OpcodeExtension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * The instruction set of the machine: the fixed base opcodes merged with registered extensions.
 * <p>
 * A registry is built once at start-up (base set in the constructor, then extensions) and is
 * then {@linkplain #seal() sealed}. A sealed registry is read-only and may be shared by any
 * number of assemblers, codecs and virtual machines without synchronization.
 */
public class OpcodeRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(OpcodeRegistry.class);

    private static final Map<String, Integer> BASE_CYCLE_COSTS = Map.ofEntries(
            Map.entry("PUSH", 1), Map.entry("POP", 1), Map.entry("DUP", 1), Map.entry("SWAP", 1),
            Map.entry("ADD", 1), Map.entry("SUB", 1),
            Map.entry("MUL", 3),
            Map.entry("DIV", 10),
            Map.entry("JUMP", 2), Map.entry("JZ", 2),
            Map.entry("PRINT", 5),
            Map.entry("HALT", 1));

    private final Map<String, OpcodeDefinition> byName = new LinkedHashMap<>();
    private final Map<Integer, OpcodeDefinition> byCode = new HashMap<>();
    private volatile boolean sealed;

    /**
     * Creates a registry holding the base instruction set.
     */
    public OpcodeRegistry() {
        // Arithmetic-Family
        registerFamily(Map.of(0x03, "ADD", 0x04, "SUB", 0x05, "MUL", 0x06, "DIV"), false, ArithmeticInstruction::new);

        // Stack-Family
        registerFamily(Map.of(0x01, "PUSH"), true, StackInstruction::new);
        registerFamily(Map.of(0x02, "POP", 0x07, "DUP", 0x08, "SWAP"), false, StackInstruction::new);

        // Output
        registerFamily(Map.of(0x09, "PRINT"), false, name -> new OutputInstruction());

        // ControlFlow-Family
        registerFamily(Map.of(0x0A, "JUMP", 0x0B, "JZ"), true, ControlFlowInstruction::new);
        registerFamily(Map.of(0xFF, "HALT"), false, ControlFlowInstruction::new);
    }

    private void registerFamily(Map<Integer, String> variants, boolean hasOperand,
                                Function<String, InstructionBehavior> factory) {
        for (Map.Entry<Integer, String> entry : variants.entrySet()) {
            String name = entry.getValue();
            add(new OpcodeDefinition(name, entry.getKey(), hasOperand,
                    BASE_CYCLE_COSTS.get(name), factory.apply(name), false));
        }
    }

    /**
     * Registers an extension opcode with the default cycle cost.
     *
     * @param name The mnemonic; normalized to upper case.
     * @param code The opcode number, 0-255.
     * @param hasOperand Whether the opcode carries an operand.
     * @param behavior What the opcode does.
     * @return The new entry.
     * @throws OpcodeConflictException with {@link ErrorCode#NAME_CONFLICT} or {@link ErrorCode#CODE_CONFLICT}
     *         if the name or number is taken.
     */
    public OpcodeDefinition registerExtension(String name, int code, boolean hasOperand, InstructionBehavior behavior) {
        return registerExtension(name, code, hasOperand, Config.DEFAULT_CYCLE_COST, behavior);
    }

    /**
     * Registers an extension opcode.
     *
     * @param name The mnemonic; normalized to upper case.
     * @param code The opcode number, 0-255.
     * @param hasOperand Whether the opcode carries an operand.
     * @param cycleCost The simulated cycle cost per execution.
     * @param behavior What the opcode does.
     * @return The new entry.
     * @throws OpcodeConflictException if the name or number is taken.
     * @throws IllegalArgumentException if the name is blank or the number does not fit one byte.
     * @throws IllegalStateException if the registry is sealed.
     */
    public synchronized OpcodeDefinition registerExtension(String name, int code, boolean hasOperand,
                                                           int cycleCost, InstructionBehavior behavior) {
        if (sealed) {
            throw new IllegalStateException("Opcode registry is sealed; cannot register " + name);
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Extension opcode name must not be blank.");
        }
        if (code < 0 || code > Config.MAX_OPCODE_NUMBER) {
            throw new IllegalArgumentException(String.format(
                    "Opcode number of %s must be between 0x00 and 0x%02x, got %d", name, Config.MAX_OPCODE_NUMBER, code));
        }
        if (behavior == null) {
            throw new IllegalArgumentException("Extension opcode " + name + " has no behavior.");
        }
        String upperCaseName = name.strip().toUpperCase(Locale.ROOT);

        OpcodeDefinition nameHolder = byName.get(upperCaseName);
        if (nameHolder != null) {
            throw new OpcodeConflictException(ErrorCode.NAME_CONFLICT,
                    String.format("Opcode name %s is already registered as %s", upperCaseName, nameHolder), nameHolder);
        }
        OpcodeDefinition codeHolder = byCode.get(code);
        if (codeHolder != null) {
            throw new OpcodeConflictException(ErrorCode.CODE_CONFLICT,
                    String.format("Opcode number 0x%02x of %s is already used by %s", code, upperCaseName, codeHolder), codeHolder);
        }

        OpcodeDefinition definition = new OpcodeDefinition(upperCaseName, code, hasOperand, cycleCost, behavior, true);
        add(definition);
        LOG.debug("Registered extension opcode {}", definition);
        return definition;
    }

    /**
     * Registers an extension discovered through the service provider interface.
     * @param extension The extension.
     * @return The new entry.
     * @throws OpcodeConflictException if the name or number is taken.
     */
    public OpcodeDefinition registerExtension(OpcodeExtension extension) {
        return registerExtension(extension.getName(), extension.getCode(), extension.hasOperand(),
                extension.getCycleCost(), extension);
    }

    private void add(OpcodeDefinition definition) {
        byName.put(definition.name(), definition);
        byCode.put(definition.code(), definition);
    }

    /**
     * Makes the registry read-only. Idempotent.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Looks up an opcode by mnemonic.
     * @param name The mnemonic (case-sensitive; mnemonics are upper case).
     * @return The entry.
     * @throws UnknownOpcodeException if no such opcode exists; the exception carries suggestions.
     */
    public OpcodeDefinition lookupByName(String name) {
        OpcodeDefinition definition = byName.get(name);
        if (definition == null) {
            throw new UnknownOpcodeException(name, suggest(name));
        }
        return definition;
    }

    /**
     * Looks up an opcode by number.
     * @param code The opcode number.
     * @return The entry.
     * @throws UnknownOpcodeException if no opcode has this number.
     */
    public OpcodeDefinition lookupByCode(int code) {
        OpcodeDefinition definition = byCode.get(code);
        if (definition == null) {
            throw new UnknownOpcodeException(String.format("0x%02x", code), List.of());
        }
        return definition;
    }

    public Optional<OpcodeDefinition> findByName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<OpcodeDefinition> findByCode(int code) {
        return Optional.ofNullable(byCode.get(code));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /**
     * @param name A mnemonic.
     * @return true if the opcode exists and was registered as an extension.
     */
    public boolean isExtension(String name) {
        OpcodeDefinition definition = byName.get(name);
        return definition != null && definition.extension();
    }

    /**
     * @param name A mnemonic.
     * @return true if the opcode exists and carries an operand.
     */
    public boolean hasOperand(String name) {
        OpcodeDefinition definition = byName.get(name);
        return definition != null && definition.hasOperand();
    }

    /**
     * Returns up to three registered names similar to the given one.
     * @param name An unknown mnemonic.
     * @return Suggestions, best first.
     */
    public List<String> suggest(String name) {
        return OpcodeSuggester.suggest(name, byName.keySet(), Config.MAX_SUGGESTIONS, Config.SUGGESTION_THRESHOLD);
    }

    /**
     * @return All mnemonics in registration order.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(byName.keySet());
    }

    /**
     * @return All entries in registration order.
     */
    public Collection<OpcodeDefinition> definitions() {
        return Collections.unmodifiableCollection(byName.values());
    }
}
