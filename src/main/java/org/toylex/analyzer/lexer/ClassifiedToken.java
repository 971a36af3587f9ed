package org.toylex.analyzer.lexer;

import java.util.Optional;

/**
 * A lexeme after classification.
 *
 * @param kind The kind of the token.
 * @param value The symbol-table value: the lexeme text for identifiers and constants,
 *              {@code null} for every reserved kind.
 * @param lexeme The raw lexeme the token was classified from.
 */
public record ClassifiedToken(TokenKind kind, String value, Lexeme lexeme) {

    public ClassifiedToken {
        if (kind.isSymbolic() != (value != null)) {
            throw new IllegalArgumentException("Kind " + kind + " does not match value " + value);
        }
    }

    /**
     * @return {@code true} if the token goes into the symbol table.
     */
    public boolean hasValue() {
        return value != null;
    }

    /**
     * @return The value, or empty for reserved kinds.
     */
    public Optional<String> optionalValue() {
        return Optional.ofNullable(value);
    }
}
