package org.stackmac.runtime.extensions;

import org.stackmac.runtime.ExecutionContext;
import org.stackmac.runtime.model.OperandStack;
import org.stackmac.runtime.spi.OpcodeExtension;

import java.util.function.BiPredicate;

/**
 * Base class for the comparison opcodes. Pops b, then a, and pushes 1 if the comparison of
 * {@code a} with {@code b} holds, otherwise 0.
 */
public abstract class ComparisonExtension implements OpcodeExtension {

    private final String name;
    private final int code;
    private final BiPredicate<Integer, Integer> comparison;

    protected ComparisonExtension(String name, int code, BiPredicate<Integer, Integer> comparison) {
        this.name = name;
        this.code = code;
        this.comparison = comparison;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getCode() {
        return code;
    }

    @Override
    public boolean hasOperand() {
        return false;
    }

    @Override
    public void execute(ExecutionContext context, Integer operand) {
        OperandStack stack = context.getStack();
        stack.requireDepth(2, name);
        int b = stack.pop();
        int a = stack.pop();
        stack.push(comparison.test(a, b) ? 1 : 0);
    }

    /** EQ (0x12). */
    public static class Eq extends ComparisonExtension {
        public Eq() {
            super("EQ", 0x12, (a, b) -> a.intValue() == b.intValue());
        }
    }

    /** NEQ (0x13). */
    public static class Neq extends ComparisonExtension {
        public Neq() {
            super("NEQ", 0x13, (a, b) -> a.intValue() != b.intValue());
        }
    }

    /** LT (0x14). */
    public static class Lt extends ComparisonExtension {
        public Lt() {
            super("LT", 0x14, (a, b) -> a < b);
        }
    }

    /** GT (0x15). */
    public static class Gt extends ComparisonExtension {
        public Gt() {
            super("GT", 0x15, (a, b) -> a > b);
        }
    }

    /** LTE (0x16). */
    public static class Lte extends ComparisonExtension {
        public Lte() {
            super("LTE", 0x16, (a, b) -> a <= b);
        }
    }

    /** GTE (0x17). */
    public static class Gte extends ComparisonExtension {
        public Gte() {
            super("GTE", 0x17, (a, b) -> a >= b);
        }
    }
}
