package org.stackmac.runtime.isa.instructions;

import org.stackmac.api.ErrorCode;
import org.stackmac.runtime.ExecutionException;
import org.stackmac.runtime.ExecutionListener;
import org.stackmac.runtime.VirtualMachine;
import org.stackmac.runtime.isa.OpcodeRegistry;
import org.stackmac.runtime.model.Instruction;
import org.stackmac.runtime.model.Program;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.stackmac.runtime.model.Instruction.of;

@Tag("unit")
class VMStackInstructionTest {

    private VirtualMachine vm;
    private final List<Integer> output = new ArrayList<>();

    @BeforeEach
    void setUp() {
        vm = new VirtualMachine(new OpcodeRegistry());
        vm.addListener(new ExecutionListener() {
            @Override
            public void onOutput(int value) {
                output.add(value);
            }
        });
    }

    private void run(Instruction... instructions) {
        vm.load(Program.of(instructions));
        vm.execute();
    }

    @Test
    void pushAndPop() {
        run(of("PUSH", 1), of("PUSH", 2), of("POP"));
        assertThat(vm.getStack().toList()).containsExactly(1);
    }

    @Test
    void dupDuplicatesTop() {
        run(of("PUSH", 123), of("DUP"));
        assertThat(vm.getStack().toList()).containsExactly(123, 123);
    }

    @Test
    void swapExchangesTopTwo() {
        run(of("PUSH", 1), of("PUSH", 2), of("SWAP"));
        assertThat(vm.getStack().toList()).containsExactly(2, 1);
    }

    @Test
    void printPopsAndEmits() {
        run(of("PUSH", 5), of("PUSH", 3), of("ADD"), of("PRINT"), of("HALT"));

        assertThat(output).containsExactly(8);
        assertThat(vm.getStack().isEmpty()).isTrue();
    }

    @Test
    void popOnEmptyStackUnderflows() {
        vm.load(Program.of(of("POP")));

        assertThatThrownBy(vm::execute)
                .isInstanceOf(ExecutionException.class)
                .extracting(e -> ((ExecutionException) e).getErrorCode())
                .isEqualTo(ErrorCode.STACK_UNDERFLOW);
    }

    @Test
    void swapWithOneValueLeavesStackUntouched() {
        vm.load(Program.of(of("PUSH", 9), of("SWAP")));

        assertThatThrownBy(vm::execute).isInstanceOf(ExecutionException.class);
        assertThat(vm.getStack().toList()).containsExactly(9);
    }

    @Test
    void pushWithoutOperandIsInvalid() {
        vm.load(Program.of(of("PUSH")));

        assertThatThrownBy(vm::execute)
                .isInstanceOf(ExecutionException.class)
                .extracting(e -> ((ExecutionException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_OPERAND);
    }
}
