package org.toylex.analyzer.lexer;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The static catalog of reserved lexemes.
 * <p>
 * Maps every keyword, operator and punctuation lexeme to its {@link TokenKind}. The catalog is
 * derived from the enum once and never changes afterwards.
 */
public final class TokenCatalog {

    private static final Map<String, TokenKind> BY_LEXEME;
    private static final Map<Integer, TokenKind> BY_CODE;

    static {
        Map<String, TokenKind> byLexeme = new LinkedHashMap<>();
        for (TokenKind kind : TokenKind.values()) {
            if (!kind.isSymbolic()) {
                byLexeme.put(kind.lexeme(), kind);
            }
        }
        BY_LEXEME = Collections.unmodifiableMap(byLexeme);
        BY_CODE = Collections.unmodifiableMap(Arrays.stream(TokenKind.values())
                .collect(Collectors.toMap(TokenKind::code, Function.identity(), (a, b) -> a, LinkedHashMap::new)));
    }

    private TokenCatalog() {}

    /**
     * Looks up the reserved kind of a lexeme.
     * @param lexeme The exact lexeme text.
     * @return The kind, or empty if the lexeme is not reserved.
     */
    public static Optional<TokenKind> lookup(String lexeme) {
        return Optional.ofNullable(BY_LEXEME.get(lexeme));
    }

    /**
     * Checks whether the given lexeme is a reserved word, operator or punctuation.
     * @param lexeme The exact lexeme text.
     * @return {@code true} if the catalog contains the lexeme.
     */
    public static boolean isReserved(String lexeme) {
        return BY_LEXEME.containsKey(lexeme);
    }

    /**
     * Resolves a numeric code back to its kind.
     * @param code The token code.
     * @return The kind, or empty for unknown codes.
     */
    public static Optional<TokenKind> byCode(int code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    /**
     * Returns all reserved lexemes in code order.
     * @return An unmodifiable map from lexeme to kind.
     */
    public static Map<String, TokenKind> reservedLexemes() {
        return BY_LEXEME;
    }

    /**
     * Returns all kinds, open and reserved, in code order.
     * @return The kinds ordered by code.
     */
    public static List<TokenKind> allKinds() {
        return List.copyOf(BY_CODE.values());
    }
}
