package org.minimips.compiler.frontend;

import org.minimips.compiler.api.SourceInfo;
import org.minimips.compiler.diagnostics.DiagnosticsEngine;
import org.minimips.runtime.Config;
import org.minimips.runtime.isa.Instruction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * First loader pass. Walks the source line by line, tracks the current segment,
 * records labels, allocates the data segment and collects the instruction lines.
 * Instructions are not interpreted here; forward label references make decoding a
 * separate pass.
 */
public class SegmentScanner {

    private static final Pattern LABEL_DEFINITION = Pattern.compile("^(" + Instruction.LABEL_PATTERN + "):\\s*(.*)$");
    private static final Pattern GLOBL = Pattern.compile("^\\.globl\\b.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ASCIIZ = Pattern.compile("^\\.asciiz\\s+\"(.*)\"$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern WORD = Pattern.compile("^\\.word\\s+(.+)$", Pattern.CASE_INSENSITIVE);

    private enum Segment { TEXT, DATA }

    private final String source;
    private final DiagnosticsEngine diagnostics;

    private final List<SourceInfo> textLines = new ArrayList<>();
    private final Map<String, Integer> labels = new LinkedHashMap<>();
    private final Map<String, Integer> dataAddresses = new LinkedHashMap<>();
    private final Map<Integer, String> dataContents = new LinkedHashMap<>();
    private Segment segment = Segment.TEXT;
    private int nextDataAddress = Config.DATA_SEGMENT_BASE;

    /**
     * Creates a scanner.
     * @param source The assembly source.
     * @param diagnostics The engine receiving warnings.
     */
    public SegmentScanner(String source, DiagnosticsEngine diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics;
    }

    /**
     * Scans the whole source.
     * @return The collected lines and tables.
     */
    public ScanResult scan() {
        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = stripComment(lines[i]).trim();
            if (!line.isEmpty()) {
                scanLine(line, i + 1);
            }
        }
        return new ScanResult(textLines, labels, dataAddresses, dataContents);
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }

    private void scanLine(String rawLine, int lineNumber) {
        if (".text".equals(rawLine)) {
            segment = Segment.TEXT;
            return;
        }
        if (".data".equals(rawLine)) {
            segment = Segment.DATA;
            return;
        }
        if (GLOBL.matcher(rawLine).matches()) {
            return;
        }

        String line = rawLine;
        Matcher label = LABEL_DEFINITION.matcher(line);
        if (label.matches()) {
            defineLabel(label.group(1));
            line = label.group(2).trim();
            if (line.isEmpty()) {
                return;
            }
        }

        if (segment == Segment.DATA) {
            scanDataDirective(line, lineNumber);
        } else {
            textLines.add(new SourceInfo(lineNumber, line));
        }
    }

    private void defineLabel(String name) {
        if (segment == Segment.TEXT) {
            labels.put(name, textLines.size());
        } else {
            dataAddresses.putIfAbsent(name, nextDataAddress);
        }
    }

    private void scanDataDirective(String line, int lineNumber) {
        Matcher asciiz = ASCIIZ.matcher(line);
        if (asciiz.matches()) {
            String text = asciiz.group(1).replace("\\n", "\n").replace("\\\"", "\"");
            dataContents.put(nextDataAddress, text);
            nextDataAddress += text.length() + 1;
            return;
        }
        Matcher word = WORD.matcher(line);
        if (word.matches()) {
            long count = Arrays.stream(word.group(1).split(","))
                    .map(String::trim)
                    .filter(part -> !part.isEmpty())
                    .count();
            nextDataAddress += (int) Math.max(1, count) * Config.WORD_SIZE;
            return;
        }
        diagnostics.reportWarning("Unsupported data directive ignored: " + line, lineNumber);
    }
}
