package org.toylex.analyzer.api;

/**
 * Thrown when a lexeme is neither a reserved lexeme nor a valid identifier or constant.
 * <p>
 * It is part of the public API. The analysis stops at the first such lexeme and no partial
 * symbol table or program internal form is returned.
 */
public class InvalidTokenException extends Exception {

    private final String lexeme;
    private final transient SourceInfo sourceInfo;

    /**
     * Constructs a new exception for the given lexeme and position.
     * @param lexeme The offending lexeme.
     * @param sourceInfo Where the lexeme starts.
     */
    public InvalidTokenException(String lexeme, SourceInfo sourceInfo) {
        super(String.format("Invalid token '%s' at %s", lexeme, sourceInfo));
        this.lexeme = lexeme;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The offending lexeme.
     */
    public String lexeme() {
        return lexeme;
    }

    /**
     * @return The position of the offending lexeme.
     */
    public SourceInfo sourceInfo() {
        return sourceInfo;
    }
}
