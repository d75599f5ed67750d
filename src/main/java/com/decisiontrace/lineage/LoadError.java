package com.decisiontrace.lineage;

/**
 * A sink line that was excluded from the graph because it could not be decoded.
 *
 * @param lineNumber 1-based line in the source
 */
public record LoadError(
    String source,
    int lineNumber,
    String message,
    String rawLine
) {}
