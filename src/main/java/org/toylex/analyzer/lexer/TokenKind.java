package org.toylex.analyzer.lexer;

/**
 * Defines the kinds of tokens recognized by the analyzer.
 * <p>
 * Every kind carries the numeric code written into the program internal form. The two open
 * kinds {@link #IDENTIFIER} and {@link #CONSTANT} have no fixed lexeme; every other kind stands
 * for exactly one reserved word, operator or punctuation character.
 */
public enum TokenKind {
    // Open kinds.
    /** A user-defined name, such as a variable. */
    IDENTIFIER(null, 0),
    /** An integer, character or string literal. */
    CONSTANT(null, 1),

    // Keywords.
    INT("int", 2),
    CHAR("char", 3),
    STRING("string", 4),
    BOOL("bool", 5),
    CONST("const", 6),
    FOR("for", 7),
    WHILE("while", 8),
    DO("do", 9),
    IF("if", 10),
    ELSE("else", 11),
    CIN("cin", 12),
    COUT("cout", 13),
    RETURN("return", 14),
    MAIN("main", 15),

    // Punctuation.
    SEMICOLON(";", 16),
    COMMA(",", 17),
    DOT(".", 18),

    // Operators and brackets.
    PLUS("+", 19),
    STAR("*", 20),
    LEFT_PAREN("(", 21),
    RIGHT_PAREN(")", 22),
    LEFT_BRACKET("[", 23),
    RIGHT_BRACKET("]", 24),
    LEFT_BRACE("{", 25),
    RIGHT_BRACE("}", 26),
    MINUS("-", 27),
    LESS("<", 28),
    GREATER(">", 29),
    ASSIGN("=", 30),
    EQUAL_EQUAL("==", 31),
    COLON(":", 32),
    LESS_EQUAL("<=", 33),
    GREATER_EQUAL(">=", 34),
    NOT_EQUAL("!=", 35),
    AND_AND("&&", 36),
    OR_OR("||", 37);

    private final String lexeme;
    private final int code;

    TokenKind(String lexeme, int code) {
        this.lexeme = lexeme;
        this.code = code;
    }

    /**
     * Returns the fixed lexeme of this kind.
     * @return The reserved lexeme, or {@code null} for {@link #IDENTIFIER} and {@link #CONSTANT}.
     */
    public String lexeme() {
        return lexeme;
    }

    /**
     * Returns the numeric code of this kind as written into the program internal form.
     * @return The token code.
     */
    public int code() {
        return code;
    }

    /**
     * Checks whether tokens of this kind carry a value that goes into the symbol table.
     * @return {@code true} for identifiers and constants.
     */
    public boolean isSymbolic() {
        return lexeme == null;
    }
}
