package org.stackmac.cli.commands;

import org.stackmac.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "compile", mixinStandardHelpOptions = true,
        description = "Compiles an assembly source file to bytecode.")
public class CompileCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "SOURCE", description = "The assembly source file.")
    private Path source;

    @Option(names = {"-o", "--output"}, paramLabel = "OUTPUT",
            description = "The bytecode file (default: SOURCE with extension .stkm).")
    private Path output;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Path written = parent.getToolchain().compile(source, output);
        spec.commandLine().getOut().printf("Compiled '%s' to '%s'%n", source, written);
        return 0;
    }
}
