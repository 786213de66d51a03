package org.minimips.compiler.api;

/**
 * A position in the assembly source.
 *
 * @param lineNumber The 1-based line number.
 * @param lineContent The instruction text of the line, with comments and labels removed.
 */
public record SourceInfo(int lineNumber, String lineContent) {}
