package org.toylex.analyzer.lexer;

import org.toylex.analyzer.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * The Scanner splits a source text into raw lexemes using longest-match rules.
 * <p>
 * At every position the first matching rule wins: whitespace (dropped), two-character operators,
 * identifiers, integer literals, character literals, string literals and finally any single
 * character. The scanner never rejects input; judging a lexeme is left to the {@link Classifier}.
 * Columns count code points, so a character outside the BMP is one lexeme and one column.
 */
public class Scanner {

    private final String source;
    private final String logicalFileName;
    private final List<Lexeme> lexemes = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Scanner.
     * @param source The source text as a single string.
     */
    public Scanner(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Scanner with an explicit logical file name.
     * @param source The source text as a single string.
     * @param logicalFileName The name of the source, for error reporting.
     */
    public Scanner(String source, String logicalFileName) {
        this.source = source;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Scans the entire source.
     * @return The raw lexemes in source order, without whitespace.
     */
    public List<Lexeme> scan() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanLexeme();
        }
        return lexemes;
    }

    private void scanLexeme() {
        char c = peek();

        if (isWhitespace(c)) {
            while (!isAtEnd() && isWhitespace(peek())) advance();
            return;
        }
        if (isTwoCharOperator(c, peekNext())) {
            advance();
            advance();
            addLexeme();
            return;
        }
        if (isAlpha(c)) {
            identifier();
            return;
        }
        if (isDigit(c)) {
            integer();
            return;
        }
        if (c == '\'' && isAlphaNumericLiteralChar(peekNext()) && peekAt(2) == '\'') {
            advance();
            advance();
            advance();
            addLexeme();
            return;
        }
        if (c == '"' && string()) {
            return;
        }

        // Anything else is a single-character lexeme, valid or not.
        advanceCodePoint();
        addLexeme();
    }

    private void identifier() {
        advance();
        while (isAlphaNumeric(peek())) advance();
        addLexeme();
    }

    private void integer() {
        while (isDigit(peek())) advance();
        addLexeme();
    }

    /**
     * Consumes a string literal if one starts at the current position.
     * @return {@code false} if the quote does not open a well-formed literal; nothing is consumed then.
     */
    private boolean string() {
        int end = current + 1;
        while (end < source.length() && isAlphaNumericLiteralChar(source.charAt(end))) end++;
        if (end >= source.length() || source.charAt(end) != '"') {
            return false;
        }
        while (current <= end) advance();
        addLexeme();
        return true;
    }

    private static boolean isTwoCharOperator(char first, char second) {
        return switch (first) {
            case '=', '!', '<', '>' -> second == '=';
            case '&' -> second == '&';
            case '|' -> second == '|';
            default -> false;
        };
    }

    private void addLexeme() {
        String text = source.substring(start, current);
        lexemes.add(new Lexeme(text, new SourceInfo(logicalFileName, start, startLine, startColumn)));
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    // Never a line break: those are whitespace.
    private void advanceCodePoint() {
        current += Character.charCount(source.codePointAt(current));
        column++;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int distance) {
        int index = current + distance;
        if (index >= source.length()) return '\0';
        return source.charAt(index);
    }

    /**
     * Whitespace in the Unicode sense: Java whitespace, space separators such as U+00A0 and U+202F,
     * and NEL (U+0085).
     */
    static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // Literal bodies exclude the underscore.
    static boolean isAlphaNumericLiteralChar(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                isDigit(c);
    }
}
