package org.minimips.compiler;

import org.minimips.compiler.api.Program;
import org.minimips.compiler.api.ProgramLoadException;
import org.minimips.compiler.api.SourceInfo;
import org.minimips.compiler.diagnostics.DiagnosticsEngine;
import org.minimips.compiler.diagnostics.LoaderLogger;
import org.minimips.compiler.frontend.ScanResult;
import org.minimips.compiler.frontend.SegmentScanner;
import org.minimips.runtime.isa.Instruction;
import org.minimips.runtime.isa.SymbolTable;
import org.minimips.runtime.isa.instructions.InvalidInstruction;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns assembly source text into an immutable {@link Program}.
 * <p>
 * Loading runs in two passes: the {@link SegmentScanner} collects instruction lines,
 * labels and the data segment, then every instruction line is decoded against the
 * complete symbol tables. By default malformed instructions are kept as
 * {@link InvalidInstruction}s and only fail when executed; with eager validation they
 * abort the load instead.
 */
public class ProgramLoader {

    /**
     * The message of the load failure for sources without instructions.
     */
    public static final String NO_INSTRUCTIONS = "No instructions found in .text section.";

    private final boolean eagerValidation;

    /**
     * Creates a loader that defers instruction errors to run time.
     */
    public ProgramLoader() {
        this(false);
    }

    /**
     * Creates a loader.
     * @param eagerValidation Whether undecodable instructions fail the load.
     */
    public ProgramLoader(boolean eagerValidation) {
        Instruction.init();
        this.eagerValidation = eagerValidation;
    }

    /**
     * Loads a program from an anonymous source.
     *
     * @param source The assembly source.
     * @return The loaded program.
     * @throws ProgramLoadException if the source contains no instructions, or contains
     *         invalid instructions while eager validation is enabled.
     */
    public Program load(String source) throws ProgramLoadException {
        return load(source, "<memory>");
    }

    /**
     * Loads a program.
     *
     * @param source The assembly source.
     * @param sourceName The logical name used in diagnostics, e.g. a file name.
     * @return The loaded program.
     * @throws ProgramLoadException if the source contains no instructions, or contains
     *         invalid instructions while eager validation is enabled.
     */
    public Program load(String source, String sourceName) throws ProgramLoadException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(sourceName);
        ScanResult scan = new SegmentScanner(source, diagnostics).scan();
        LoaderLogger.reportWarnings(diagnostics);

        if (scan.textLines().isEmpty()) {
            throw new ProgramLoadException(NO_INSTRUCTIONS, diagnostics.getDiagnostics());
        }

        SymbolTable symbols = new SymbolTable(scan.labels(), scan.dataAddresses());
        List<Instruction> instructions = new ArrayList<>(scan.textLines().size());
        for (SourceInfo line : scan.textLines()) {
            Instruction instruction = Instruction.decode(line, symbols);
            if (eagerValidation && instruction instanceof InvalidInstruction invalid) {
                diagnostics.reportError(invalid.getMessage(), line.lineNumber());
            }
            instructions.add(instruction);
        }

        if (diagnostics.hasErrors()) {
            throw new ProgramLoadException("Program contains invalid instructions:\n" + diagnostics.summary(),
                    diagnostics.getDiagnostics());
        }

        LoaderLogger.debug(String.format("Loaded %s: %d instructions, %d labels, %d data symbols",
                sourceName, instructions.size(), scan.labels().size(), scan.dataAddresses().size()));
        return new Program(instructions, scan.labels(), scan.dataAddresses(), scan.dataContents());
    }

    /**
     * Checks whether this loader rejects undecodable instructions.
     * @return true if eager validation is enabled.
     */
    public boolean isEagerValidation() {
        return eagerValidation;
    }
}
