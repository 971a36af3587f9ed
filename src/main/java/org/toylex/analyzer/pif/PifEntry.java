package org.toylex.analyzer.pif;

import org.toylex.analyzer.lexer.TokenKind;

/**
 * One slot of the program internal form.
 *
 * @param kind The kind of the token at this position.
 * @param index The rank of the token's symbol in the final symbol table, or {@link #NO_SYMBOL}
 *              for reserved kinds.
 */
public record PifEntry(TokenKind kind, long index) {

    /** Index used by entries that do not refer to the symbol table. */
    public static final long NO_SYMBOL = -1L;

    public PifEntry {
        if (kind.isSymbolic() ? index < 0 : index != NO_SYMBOL) {
            throw new IllegalArgumentException("Invalid index " + index + " for kind " + kind);
        }
    }

    /**
     * Creates the entry of a reserved token.
     * @param kind A reserved kind.
     * @return An entry without symbol reference.
     */
    public static PifEntry reserved(TokenKind kind) {
        return new PifEntry(kind, NO_SYMBOL);
    }

    /**
     * @return The numeric code of the kind.
     */
    public int code() {
        return kind.code();
    }

    /**
     * @return {@code true} if the entry points into the symbol table.
     */
    public boolean refersToSymbol() {
        return index != NO_SYMBOL;
    }

    @Override
    public String toString() {
        return "(" + kind.code() + ", " + index + ")";
    }
}
