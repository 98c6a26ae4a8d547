package org.stackmac.cli.commands;

import org.stackmac.cli.CommandLineInterface;
import org.stackmac.cli.ConsoleStepController;
import org.stackmac.runtime.ExecutionListener;
import org.stackmac.runtime.ExecutionResult;
import org.stackmac.runtime.ExecutionStats;
import org.stackmac.runtime.TraceEvent;
import org.stackmac.runtime.VirtualMachine;
import org.stackmac.toolchain.Toolchain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "run", mixinStandardHelpOptions = true,
        description = "Runs a bytecode file on the virtual machine.")
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    @Parameters(index = "0", paramLabel = "BYTECODE", description = "The bytecode file.")
    private Path bytecode;

    @Option(names = "--trace", description = "Print the program counter, instruction and stack before each instruction.")
    private boolean trace;

    @Option(names = "--step", description = "Trace and wait for Enter before each instruction.")
    private boolean step;

    @Option(names = "--stats", description = "Print instruction and cycle counts after the run.")
    private boolean stats;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        Toolchain toolchain = parent.getToolchain();
        PrintWriter out = spec.commandLine().getOut();

        VirtualMachine vm = toolchain.createMachine(toolchain.load(bytecode));
        vm.setTraceEnabled(trace || step);
        vm.addListener(new ConsoleListener(out));

        InterruptHook hook = new InterruptHook(vm, InterruptHook.DEFAULT_GRACE_MILLIS);
        Thread hookThread = new Thread(hook, "stackmac-interrupt");
        Runtime.getRuntime().addShutdownHook(hookThread);
        try {
            ExecutionResult result;
            if (step) {
                try (ConsoleStepController controller = ConsoleStepController.open()) {
                    vm.setStepController(controller);
                    result = vm.execute();
                }
            } else {
                result = vm.execute();
            }

            if (result.isCancelled()) {
                out.println("Execution interrupted by user.");
            }
            if (stats) {
                printStats(out, result.stats());
            }
            out.flush();
        } finally {
            hook.runFinished();
            removeHook(hookThread);
        }
        return 0;
    }

    private static void printStats(PrintWriter out, ExecutionStats stats) {
        out.printf("Instructions executed: %,d%n", stats.instructions());
        out.printf("Total cycles (cost):   %,d%n", stats.cycles());
        if (stats.instructions() > 0) {
            out.printf("Average cycles per instruction: %.2f%n", (double) stats.cycles() / stats.instructions());
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM is shutting down, interrupt hook stays registered.");
        }
    }

    /**
     * Writes program output, trace lines and the halt notice to the console.
     */
    private static final class ConsoleListener implements ExecutionListener {

        private final PrintWriter out;

        ConsoleListener(PrintWriter out) {
            this.out = out;
        }

        @Override
        public void onTrace(TraceEvent event) {
            out.println(event);
            out.flush();
        }

        @Override
        public void onOutput(int value) {
            out.println("Output: " + value);
            out.flush();
        }

        @Override
        public void onHalt() {
            out.println("Program halted.");
        }
    }
}
