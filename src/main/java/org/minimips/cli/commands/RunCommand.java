package org.minimips.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.minimips.cli.CommandLineInterface;
import org.minimips.cli.rendering.StateReport;
import org.minimips.cli.rendering.TraceListener;
import org.minimips.compiler.ProgramLoader;
import org.minimips.compiler.api.Program;
import org.minimips.compiler.api.ProgramLoadException;
import org.minimips.compiler.util.NumericParser;
import org.minimips.config.MinimipsSettings;
import org.minimips.runtime.VirtualMachine;
import org.minimips.runtime.model.MachineState;
import org.minimips.runtime.model.MachineStatus;
import org.minimips.runtime.model.Register;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "run", description = "Loads an assembly file and runs it to completion.")
public class RunCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the assembly file.")
    private File file;

    @Option(names = {"-r", "--reg"}, description = "Initial register value, e.g. --reg '$t0=5'. Repeatable.")
    private Map<String, String> registers = new LinkedHashMap<>();

    @Option(names = {"-m", "--mem"}, description = "Initial memory word, e.g. --mem 0x1000=42. Repeatable.")
    private Map<String, String> memory = new LinkedHashMap<>();

    @Option(names = "--max-steps", description = "Overrides minimips.runtime.max-steps.")
    private Integer maxSteps;

    @Option(names = "--trace", description = "Prints every executed instruction to stderr.")
    private boolean trace;

    @Option(names = "--json", description = "Prints the final machine state as JSON instead of the program output.")
    private boolean json;

    @Override
    public Integer call() {
        MinimipsSettings settings = parent.getSettings();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_LOAD_ERROR;
        }
        ProgramLoader loader = settings.newLoader();
        Program program;
        try {
            program = loader.load(source, file.getName());
        } catch (ProgramLoadException e) {
            err.println(e.getMessage());
            return CommandLineInterface.EXIT_LOAD_ERROR;
        }

        if (maxSteps != null && maxSteps < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--max-steps must be positive, was " + maxSteps);
        }
        VirtualMachine vm = maxSteps != null ? new VirtualMachine(maxSteps) : settings.newVirtualMachine();
        if (trace) {
            vm.addListener(new TraceListener(err));
        }
        MachineState initial = MachineState.initialize(source, program, parseRegisters(), parseMemory());
        MachineState result = vm.runToEnd(initial);

        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            out.println(gson.toJson(StateReport.of(result)));
        } else {
            out.print(result.getOutput());
        }
        out.flush();

        if (result.getStatus() == MachineStatus.ERROR) {
            err.println("error: " + result.getError());
            return CommandLineInterface.EXIT_RUNTIME_ERROR;
        }
        return CommandLineInterface.EXIT_OK;
    }

    private Map<String, Integer> parseRegisters() {
        Map<String, Integer> values = new LinkedHashMap<>();
        registers.forEach((name, value) -> {
            if (Register.fromName(name).isEmpty()) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Unknown register: " + name);
            }
            values.put(name, parseValue(value));
        });
        return values;
    }

    private Map<String, Integer> parseMemory() {
        Map<String, Integer> values = new LinkedHashMap<>();
        memory.forEach((address, value) -> {
            if (NumericParser.parseInt(address).isEmpty()) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Invalid memory address: " + address);
            }
            values.put(address, parseValue(value));
        });
        return values;
    }

    private int parseValue(String value) {
        return NumericParser.parseInt(value).orElseThrow(() ->
                new CommandLine.ParameterException(spec.commandLine(), "Invalid value: " + value));
    }
}
