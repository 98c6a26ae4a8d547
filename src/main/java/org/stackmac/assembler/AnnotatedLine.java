package org.stackmac.assembler;

/**
 * A single source line together with where it came from. Passed through both assembler passes
 * so that every error can point at the offending line.
 *
 * @param content The raw line text.
 * @param lineNumber The 1-based line number in the source file.
 * @param fileName The source file name.
 */
public record AnnotatedLine(
        String content,
        int lineNumber,
        String fileName
) {}
