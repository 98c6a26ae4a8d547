package org.stackmac.runtime;

import org.stackmac.api.ErrorCode;
import org.stackmac.api.StackMachineException;
import org.stackmac.runtime.isa.OpcodeDefinition;
import org.stackmac.runtime.isa.OpcodeRegistry;
import org.stackmac.runtime.isa.UnknownOpcodeException;
import org.stackmac.runtime.model.Instruction;
import org.stackmac.runtime.model.OperandStack;
import org.stackmac.runtime.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The interpreter core: a fetch-decode-execute loop over a loaded {@link Program}.
 * <p>
 * Every opcode, base or extension, is dispatched through the {@link OpcodeRegistry}. The program
 * counter advances by one after each instruction unless the instruction jumped (the target
 * becomes the next address as is) or halted. A program counter outside the program ends the run
 * normally.
 * <p>
 * A machine is single-threaded. Each instance owns its stack, program and counters; only
 * {@link #requestInterrupt()} may be called from another thread.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final OpcodeRegistry registry;
    private final int traceStackLimit;
    private final OperandStack stack = new OperandStack();
    private final List<ExecutionListener> listeners = new ArrayList<>();
    private final RunningContext context = new RunningContext();

    private Program program;
    private int pc;
    private MachineState state = MachineState.IDLE;
    private long instructionCount;
    private long cycleCount;
    private boolean traceEnabled;
    private StepController stepController;
    private volatile boolean interruptRequested;
    private ExecutionException lastFailure;

    // Per-instruction dispatch state
    private int nextPc;
    private boolean haltRequested;

    /**
     * Creates a VM that shows {@link Config#TRACE_STACK_LIMIT} stack values per trace event.
     * @param registry The instruction set, fully initialized.
     */
    public VirtualMachine(OpcodeRegistry registry) {
        this(registry, Config.TRACE_STACK_LIMIT);
    }

    /**
     * Creates a VM.
     * @param registry The instruction set, fully initialized.
     * @param traceStackLimit The number of stack values included in each trace event.
     */
    public VirtualMachine(OpcodeRegistry registry, int traceStackLimit) {
        if (traceStackLimit < 0) {
            throw new IllegalArgumentException("traceStackLimit must not be negative: " + traceStackLimit);
        }
        this.registry = registry;
        this.traceStackLimit = traceStackLimit;
    }

    /**
     * Loads a program and resets the machine: program counter 0, empty stack, zero counters.
     * The machine stays idle until {@link #execute()} is called.
     *
     * @param program The program to run.
     */
    public void load(Program program) {
        if (state == MachineState.RUNNING) {
            throw new IllegalStateException("Cannot load a program while the machine is running.");
        }
        this.program = program;
        this.pc = 0;
        this.stack.clear();
        this.instructionCount = 0;
        this.cycleCount = 0;
        this.lastFailure = null;
        this.interruptRequested = false;
        this.state = MachineState.IDLE;
        LOG.debug("Loaded program with {} instructions", program.size());
    }

    /**
     * Runs the loaded program from the current program counter until it halts, leaves the
     * program, is interrupted, or fails.
     *
     * @return The outcome of a run that ended without an error.
     * @throws ExecutionException if an instruction fails; the machine keeps its state at the failing instruction.
     * @throws IllegalStateException if no program is loaded.
     */
    public ExecutionResult execute() {
        if (program == null) {
            throw new IllegalStateException("No program loaded.");
        }
        state = MachineState.RUNNING;
        TerminationReason reason = TerminationReason.COMPLETED;

        while (program.contains(pc)) {
            if (interruptRequested) {
                interruptRequested = false;
                reason = TerminationReason.CANCELLED;
                break;
            }
            Instruction instruction = program.get(pc);

            if (traceEnabled || stepController != null) {
                TraceEvent event = new TraceEvent(pc, instruction, stack.snapshotTop(traceStackLimit), stack.size());
                listeners.forEach(l -> l.onTrace(event));
                if (stepController != null && stepController.awaitStep(event) == StepController.Decision.INTERRUPT) {
                    reason = TerminationReason.CANCELLED;
                    break;
                }
            }

            if (dispatch(instruction)) {
                reason = TerminationReason.HALTED;
                listeners.forEach(ExecutionListener::onHalt);
                break;
            }
        }

        interruptRequested = false;
        state = MachineState.IDLE;
        ExecutionResult result = new ExecutionResult(reason, pc, getStats());
        if (reason == TerminationReason.CANCELLED) {
            LOG.info("Execution interrupted by user at PC {}", pc);
        }
        LOG.debug("Run finished: {}", result);
        listeners.forEach(l -> l.onFinished(result));
        return result;
    }

    /**
     * Executes one instruction and moves the program counter.
     * @return true if the instruction halted the machine.
     */
    private boolean dispatch(Instruction instruction) {
        Optional<OpcodeDefinition> definition = registry.findByName(instruction.opcode());
        if (definition.isEmpty()) {
            throw fail(ErrorCode.UNKNOWN_OPCODE, instruction,
                    new UnknownOpcodeException(instruction.opcode(), registry.suggest(instruction.opcode())));
        }
        OpcodeDefinition opcode = definition.get();

        instructionCount++;
        cycleCount += opcode.cycleCost();
        nextPc = pc + 1;
        haltRequested = false;

        try {
            opcode.behavior().execute(context, instruction.operand());
        } catch (StackMachineException e) {
            throw fail(e.getErrorCode(), instruction, e);
        } catch (RuntimeException e) {
            throw fail(ErrorCode.EXTENSION_FAILURE, instruction, e);
        }

        if (haltRequested) {
            return true;
        }
        pc = nextPc;
        return false;
    }

    private ExecutionException fail(ErrorCode errorCode, Instruction instruction, Exception cause) {
        interruptRequested = false;
        state = MachineState.IDLE;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        lastFailure = new ExecutionException(errorCode, pc, instruction, message, cause);
        return lastFailure;
    }

    /**
     * Asks a running machine to stop before its next instruction. The run then ends with
     * {@link TerminationReason#CANCELLED}. Safe to call from any thread.
     */
    public void requestInterrupt() {
        interruptRequested = true;
    }

    /**
     * Turns trace mode on or off. In trace mode every listener receives a {@link TraceEvent}
     * before each instruction.
     * @param traceEnabled The new mode.
     */
    public void setTraceEnabled(boolean traceEnabled) {
        this.traceEnabled = traceEnabled;
    }

    /**
     * Turns step mode on (non-null controller) or off ({@code null}). Step mode implies trace mode.
     * @param stepController The controller consulted before each instruction.
     */
    public void setStepController(StepController stepController) {
        this.stepController = stepController;
    }

    public void addListener(ExecutionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ExecutionListener listener) {
        listeners.remove(listener);
    }

    public OperandStack getStack() {
        return stack;
    }

    public Program getProgram() {
        return program;
    }

    public int getProgramCounter() {
        return pc;
    }

    public MachineState getState() {
        return state;
    }

    public boolean isRunning() {
        return state == MachineState.RUNNING;
    }

    public ExecutionStats getStats() {
        return new ExecutionStats(instructionCount, cycleCount);
    }

    /**
     * @return The failure that aborted the last run, or {@code null} if it ended normally.
     */
    public ExecutionException getLastFailure() {
        return lastFailure;
    }

    public OpcodeRegistry getRegistry() {
        return registry;
    }

    private final class RunningContext implements ExecutionContext {

        @Override
        public OperandStack getStack() {
            return stack;
        }

        @Override
        public int getProgramCounter() {
            return pc;
        }

        @Override
        public Instruction getCurrentInstruction() {
            return program.get(pc);
        }

        @Override
        public void emit(int value) {
            listeners.forEach(l -> l.onOutput(value));
        }

        @Override
        public void jumpTo(int address) {
            nextPc = address;
        }

        @Override
        public void halt() {
            haltRequested = true;
        }
    }
}
