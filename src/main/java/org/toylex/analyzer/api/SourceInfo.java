package org.toylex.analyzer.api;

/**
 * A pure data class representing a position in the source text.
 * It is part of the public analyzer API and free of implementation details.
 *
 * @param fileName The logical name of the source.
 * @param offset The 0-based character offset from the start of the source.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int offset, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, lineNumber, columnNumber);
    }
}
