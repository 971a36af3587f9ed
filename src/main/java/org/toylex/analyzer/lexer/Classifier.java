package org.toylex.analyzer.lexer;

import org.toylex.analyzer.api.InvalidTokenException;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Assigns a {@link TokenKind} to raw lexemes.
 * <p>
 * The catalog is consulted first, so keywords never become identifiers. Lexemes that are neither
 * reserved, identifiers, nor integer, character or string constants are rejected.
 */
public class Classifier {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern INTEGER = Pattern.compile("[0-9]+");
    private static final Pattern CHARACTER = Pattern.compile("'[A-Za-z0-9]'");
    private static final Pattern STRING = Pattern.compile("\"[A-Za-z0-9]*\"");

    /**
     * Classifies a single lexeme.
     * @param lexeme The raw lexeme.
     * @return The classified token.
     * @throws InvalidTokenException if the lexeme matches no known token.
     */
    public ClassifiedToken classify(Lexeme lexeme) throws InvalidTokenException {
        String text = lexeme.text();

        Optional<TokenKind> reserved = TokenCatalog.lookup(text);
        if (reserved.isPresent()) {
            return new ClassifiedToken(reserved.get(), null, lexeme);
        }
        if (isIdentifier(text)) {
            return new ClassifiedToken(TokenKind.IDENTIFIER, text, lexeme);
        }
        if (isConstant(text)) {
            return new ClassifiedToken(TokenKind.CONSTANT, text, lexeme);
        }
        throw new InvalidTokenException(text, lexeme.source());
    }

    /**
     * Checks the identifier pattern only; reserved words match it too.
     * @param text The lexeme text.
     * @return {@code true} for a letter or underscore followed by letters, digits or underscores.
     */
    public static boolean isIdentifier(String text) {
        return IDENTIFIER.matcher(text).matches();
    }

    /**
     * Checks for an integer, character or string literal.
     * @param text The lexeme text.
     * @return {@code true} if the text is a constant.
     */
    public static boolean isConstant(String text) {
        return INTEGER.matcher(text).matches()
                || CHARACTER.matcher(text).matches()
                || STRING.matcher(text).matches();
    }
}
