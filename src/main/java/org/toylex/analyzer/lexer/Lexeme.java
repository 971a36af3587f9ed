package org.toylex.analyzer.lexer;

import org.toylex.analyzer.api.SourceInfo;

/**
 * A raw lexeme cut out of the source by the {@link Scanner}.
 *
 * @param text The exact text, never empty and never containing whitespace.
 * @param source Where the lexeme starts in the source.
 */
public record Lexeme(String text, SourceInfo source) {
}
