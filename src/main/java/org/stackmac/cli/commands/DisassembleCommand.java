package org.stackmac.cli.commands;

import org.stackmac.assembler.DisassemblyMode;
import org.stackmac.cli.CommandLineInterface;
import org.stackmac.toolchain.Toolchain;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "disassemble", mixinStandardHelpOptions = true,
        description = "Converts a bytecode file back to assembly source.")
public class DisassembleCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "BYTECODE", description = "The bytecode file.")
    private Path bytecode;

    @Option(names = {"-o", "--output"}, paramLabel = "OUTPUT", description = "Write to this file instead of stdout.")
    private Path output;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    private Annotation annotation;

    static class Annotation {
        @Option(names = {"-a", "--addresses"}, description = "Annotate each instruction with its byte offset.")
        boolean addresses;

        @Option(names = {"-v", "--verbose"}, description = "Annotate with byte offset, raw bytes and opcode number.")
        boolean verbose;
    }

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Toolchain toolchain = parent.getToolchain();
        DisassemblyMode mode = mode();
        PrintWriter out = spec.commandLine().getOut();
        if (output != null) {
            toolchain.disassemble(bytecode, mode, output);
            out.printf("Disassembled '%s' to '%s'%n", bytecode, output);
        } else {
            out.print(toolchain.disassemble(bytecode, mode));
        }
        out.flush();
        return 0;
    }

    private DisassemblyMode mode() {
        if (annotation == null) {
            return DisassemblyMode.PLAIN;
        }
        if (annotation.verbose) {
            return DisassemblyMode.VERBOSE;
        }
        return annotation.addresses ? DisassemblyMode.ADDRESSES : DisassemblyMode.PLAIN;
    }
}
