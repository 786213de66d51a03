package org.minimips.cli.commands;

import org.minimips.cli.CommandLineInterface;
import org.minimips.compiler.ProgramLoader;
import org.minimips.compiler.api.Program;
import org.minimips.compiler.api.ProgramLoadException;
import org.minimips.runtime.services.Disassembler;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "check", description = "Loads an assembly file and prints the decoded program.")
public class CheckCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the assembly file.")
    private File file;

    @Option(names = "--eager", description = "Rejects undecodable instructions, regardless of configuration.")
    private boolean eager;

    @Override
    public Integer call() {
        boolean eagerValidation = eager || parent.getSettings().eagerValidation();
        String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_LOAD_ERROR;
        }
        PrintWriter out = spec.commandLine().getOut();

        Program program;
        try {
            program = new ProgramLoader(eagerValidation).load(source, file.getName());
        } catch (ProgramLoadException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return CommandLineInterface.EXIT_LOAD_ERROR;
        }

        new Disassembler().listing(program).forEach(out::println);
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}
