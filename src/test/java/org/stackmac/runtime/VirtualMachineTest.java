package org.stackmac.runtime;

import org.stackmac.api.ErrorCode;
import org.stackmac.runtime.isa.OpcodeRegistry;
import org.stackmac.runtime.model.Instruction;
import org.stackmac.runtime.model.Program;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.stackmac.runtime.model.Instruction.of;

/**
 * Tests the interpreter loop: tracing, step mode, interruption, counters and failure state.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class VirtualMachineTest {

    @Mock
    private ExecutionListener listener;

    @Mock
    private StepController stepController;

    private OpcodeRegistry registry;
    private VirtualMachine vm;

    @BeforeEach
    void setUp() {
        registry = new OpcodeRegistry();
        vm = new VirtualMachine(registry);
        vm.addListener(listener);
    }

    @Test
    void runsProgramAndNotifiesListener() {
        vm.load(Program.of(of("PUSH", 5), of("PUSH", 3), of("ADD"), of("PRINT"), of("HALT")));

        ExecutionResult result = vm.execute();

        assertThat(result.reason()).isEqualTo(TerminationReason.HALTED);
        InOrder order = inOrder(listener);
        order.verify(listener).onOutput(8);
        order.verify(listener).onHalt();
        order.verify(listener).onFinished(result);
        verify(listener, never()).onTrace(any());
        assertThat(vm.getState()).isEqualTo(MachineState.IDLE);
    }

    @Test
    void countsInstructionsAndCycles() {
        vm.load(Program.of(of("PUSH", 6), of("PUSH", 3), of("MUL"), of("PUSH", 2), of("DIV"), of("PRINT"), of("HALT")));

        ExecutionResult result = vm.execute();

        // PUSH 1 + PUSH 1 + MUL 3 + PUSH 1 + DIV 10 + PRINT 5 + HALT 1
        assertThat(result.stats()).isEqualTo(new ExecutionStats(7, 22));
        assertThat(vm.getStats()).isEqualTo(result.stats());
    }

    @Test
    void takenJumpsCostTwoCycles() {
        vm.load(Program.of(of("PUSH", 0), of("JZ", 3), of("PUSH", 1), of("JUMP", 5)));

        assertThat(vm.execute().stats()).isEqualTo(new ExecutionStats(3, 5));
    }

    @Test
    void traceEmitsSnapshotBeforeEachInstruction() {
        vm.setTraceEnabled(true);
        vm.load(Program.of(of("PUSH", 5), of("DUP"), of("ADD")));

        vm.execute();

        ArgumentCaptor<TraceEvent> events = ArgumentCaptor.forClass(TraceEvent.class);
        verify(listener, times(3)).onTrace(events.capture());
        List<TraceEvent> trace = events.getAllValues();
        assertThat(trace).extracting(TraceEvent::programCounter).containsExactly(0, 1, 2);
        assertThat(trace.get(0).stackTop()).isEmpty();
        assertThat(trace.get(2).stackTop()).containsExactly(5, 5);
        assertThat(trace.get(2).instruction()).isEqualTo(Instruction.of("ADD"));
        assertThat(trace.get(1)).hasToString("PC:  1 DUP          Stack: [5]");
    }

    @Test
    void traceShowsOnlyTopOfDeepStack() {
        vm = new VirtualMachine(registry, 2);
        vm.addListener(listener);
        vm.setTraceEnabled(true);
        vm.load(Program.of(of("PUSH", 1), of("PUSH", 2), of("PUSH", 3), of("POP")));

        vm.execute();

        ArgumentCaptor<TraceEvent> events = ArgumentCaptor.forClass(TraceEvent.class);
        verify(listener, times(4)).onTrace(events.capture());
        TraceEvent last = events.getValue();
        assertThat(last.stackTop()).containsExactly(2, 3);
        assertThat(last.stackDepth()).isEqualTo(3);
    }

    @Test
    void stepInterruptDoesNotExecutePendingInstruction() {
        when(stepController.awaitStep(any()))
                .thenReturn(StepController.Decision.CONTINUE)
                .thenReturn(StepController.Decision.INTERRUPT);
        vm.setStepController(stepController);
        vm.load(Program.of(of("PUSH", 1), of("PRINT"), of("HALT")));

        ExecutionResult result = vm.execute();

        assertThat(result.reason()).isEqualTo(TerminationReason.CANCELLED);
        assertThat(result.isCancelled()).isTrue();
        assertThat(result.programCounter()).isEqualTo(1);
        assertThat(vm.getStack().toList()).containsExactly(1);
        assertThat(vm.getState()).isEqualTo(MachineState.IDLE);
        verify(listener, never()).onOutput(anyInt());
        verify(listener, times(2)).onTrace(any());
        verify(listener).onFinished(result);
    }

    @Test
    void stepControllerSeesEveryInstruction() {
        when(stepController.awaitStep(any())).thenReturn(StepController.Decision.CONTINUE);
        vm.setStepController(stepController);
        vm.load(Program.of(of("PUSH", 1), of("POP"), of("HALT")));

        vm.execute();

        verify(stepController, times(3)).awaitStep(any());
    }

    @Test
    void interruptRequestStopsNonTerminatingProgram() throws InterruptedException {
        CountDownLatch running = new CountDownLatch(100);
        vm.addListener(new ExecutionListener() {
            @Override
            public void onOutput(int value) {
                running.countDown();
            }
        });
        vm.load(Program.of(of("PUSH", 1), of("PRINT"), of("JUMP", 0)));

        Thread runner = new Thread(vm::execute);
        runner.start();
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();
        vm.requestInterrupt();
        runner.join(5000);

        assertThat(runner.isAlive()).isFalse();
        ArgumentCaptor<ExecutionResult> result = ArgumentCaptor.forClass(ExecutionResult.class);
        verify(listener).onFinished(result.capture());
        assertThat(result.getValue().reason()).isEqualTo(TerminationReason.CANCELLED);
    }

    @Test
    void interruptArrivingAfterLastInstructionDoesNotCancelNextRun() {
        vm.addListener(new ExecutionListener() {
            @Override
            public void onHalt() {
                vm.requestInterrupt();
            }
        });
        vm.load(Program.of(of("PUSH", 1), of("PRINT"), of("HALT")));
        assertThat(vm.execute().reason()).isEqualTo(TerminationReason.HALTED);

        ExecutionResult second = vm.execute();

        assertThat(second.reason()).isEqualTo(TerminationReason.HALTED);
        assertThat(second.programCounter()).isEqualTo(2);
        verify(listener, times(2)).onHalt();
    }

    @Test
    void failureFreezesStateAtFailingInstruction() {
        vm.load(Program.of(of("PUSH", 4), of("PUSH", 0), of("DIV"), of("PRINT")));

        assertThatThrownBy(vm::execute).isInstanceOf(ExecutionException.class);

        ExecutionException failure = vm.getLastFailure();
        assertThat(failure).isNotNull();
        assertThat(failure.getErrorCode()).isEqualTo(ErrorCode.DIVISION_BY_ZERO);
        assertThat(failure).hasMessage("Division by zero at PC 2 (DIV)");
        assertThat(vm.getProgramCounter()).isEqualTo(2);
        assertThat(vm.getState()).isEqualTo(MachineState.IDLE);
        verify(listener, never()).onFinished(any());
    }

    @Test
    void unknownOpcodeFailsWithSuggestions() {
        vm.load(Program.of(of("ADDD")));

        assertThatThrownBy(vm::execute)
                .isInstanceOf(ExecutionException.class)
                .satisfies(e -> {
                    ExecutionException failure = (ExecutionException) e;
                    assertThat(failure.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_OPCODE);
                    assertThat(failure.getSuggestions()).containsExactly("ADD");
                });
        assertThat(vm.getStats().instructions()).isZero();
    }

    @Test
    void extensionFailureIsWrapped() {
        OpcodeRegistry custom = new OpcodeRegistry();
        custom.registerExtension("BOOM", 0x60, false, (context, operand) -> {
            throw new IllegalStateException("kaboom");
        });
        VirtualMachine machine = new VirtualMachine(custom);
        machine.load(Program.of(of("BOOM")));

        assertThatThrownBy(machine::execute)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .extracting(e -> ((ExecutionException) e).getErrorCode())
                .isEqualTo(ErrorCode.EXTENSION_FAILURE);
    }

    @Test
    void extensionUsesDeclaredCycleCost() {
        OpcodeRegistry custom = new OpcodeRegistry();
        custom.registerExtension("SQUARE", 0x61, false, 4, (context, operand) -> {
            int v = context.getStack().pop();
            context.getStack().push(v * v);
        });
        VirtualMachine machine = new VirtualMachine(custom);
        machine.load(Program.of(of("PUSH", 7), of("SQUARE")));

        ExecutionResult result = machine.execute();

        assertThat(machine.getStack().toList()).containsExactly(49);
        assertThat(result.stats()).isEqualTo(new ExecutionStats(2, 5));
    }

    @Test
    void loadResetsMachine() {
        vm.load(Program.of(of("PUSH", 1), of("PUSH", 2)));
        vm.execute();

        vm.load(Program.of(of("PUSH", 3)));

        assertThat(vm.getProgramCounter()).isZero();
        assertThat(vm.getStack().isEmpty()).isTrue();
        assertThat(vm.getStats()).isEqualTo(ExecutionStats.EMPTY);
        assertThat(vm.getLastFailure()).isNull();
    }

    @Test
    void emptyProgramCompletesImmediately() {
        vm.load(Program.of());

        ExecutionResult result = vm.execute();

        assertThat(result.reason()).isEqualTo(TerminationReason.COMPLETED);
        assertThat(result.stats()).isEqualTo(ExecutionStats.EMPTY);
    }

    @Test
    void executeWithoutProgramFails() {
        assertThatThrownBy(vm::execute).isInstanceOf(IllegalStateException.class);
    }
}
