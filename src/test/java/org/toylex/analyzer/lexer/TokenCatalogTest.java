package org.toylex.analyzer.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link TokenCatalog} and the codes of {@link TokenKind}.
 */
@Tag("unit")
class TokenCatalogTest {

    @Test
    @DisplayName("The codes are the contiguous range 0..37 with identifiers and constants first")
    void codesAreContiguousAndUnique() {
        assertThat(TokenKind.IDENTIFIER.code()).isZero();
        assertThat(TokenKind.CONSTANT.code()).isEqualTo(1);
        assertThat(Arrays.stream(TokenKind.values()).mapToInt(TokenKind::code).sorted().toArray())
                .containsExactly(java.util.stream.IntStream.rangeClosed(0, 37).toArray());
    }

    @Test
    @DisplayName("Published codes of keywords, punctuation and operators")
    void publishedCodes() {
        assertThat(TokenCatalog.lookup("int")).contains(TokenKind.INT);
        assertThat(TokenKind.INT.code()).isEqualTo(2);
        assertThat(TokenKind.MAIN.code()).isEqualTo(15);
        assertThat(TokenCatalog.lookup(";").map(TokenKind::code)).contains(16);
        assertThat(TokenCatalog.lookup("=").map(TokenKind::code)).contains(30);
        assertThat(TokenCatalog.lookup("==").map(TokenKind::code)).contains(31);
        assertThat(TokenCatalog.lookup(":").map(TokenKind::code)).contains(32);
        assertThat(TokenCatalog.lookup("||").map(TokenKind::code)).contains(37);
    }

    @Test
    @DisplayName("The catalog holds exactly the 36 reserved lexemes and nothing else")
    void catalogContainsOnlyReservedLexemes() {
        assertThat(TokenCatalog.reservedLexemes()).hasSize(36);
        assertThat(TokenCatalog.isReserved("cout")).isTrue();
        assertThat(TokenCatalog.isReserved("<<")).isFalse();
        assertThat(TokenCatalog.isReserved("Int")).isFalse();
        assertThat(TokenCatalog.lookup("identifier")).isEmpty();
    }

    @Test
    @DisplayName("Kinds can be looked up by code")
    void lookupByCode() {
        assertThat(TokenCatalog.byCode(0)).contains(TokenKind.IDENTIFIER);
        assertThat(TokenCatalog.byCode(28)).contains(TokenKind.LESS);
        assertThat(TokenCatalog.byCode(38)).isEmpty();
        assertThat(TokenCatalog.allKinds()).hasSize(38).first().isEqualTo(TokenKind.IDENTIFIER);
    }
}
