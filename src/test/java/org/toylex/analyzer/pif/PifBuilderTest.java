package org.toylex.analyzer.pif;

import org.toylex.analyzer.api.SourceInfo;
import org.toylex.analyzer.lexer.ClassifiedToken;
import org.toylex.analyzer.lexer.Lexeme;
import org.toylex.analyzer.lexer.TokenKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link PifBuilder}.
 * These tests verify that indices are resolved against the final symbol table, so that symbols
 * inserted later but sorting earlier do not leave stale indices behind.
 */
@Tag("unit")
class PifBuilderTest {

    private static ClassifiedToken identifier(String name) {
        return new ClassifiedToken(TokenKind.IDENTIFIER, name, lexeme(name));
    }

    private static ClassifiedToken constant(String text) {
        return new ClassifiedToken(TokenKind.CONSTANT, text, lexeme(text));
    }

    private static ClassifiedToken reserved(TokenKind kind) {
        return new ClassifiedToken(kind, null, lexeme(kind.lexeme()));
    }

    private static Lexeme lexeme(String text) {
        return new Lexeme(text, new SourceInfo("<test>", 0, 1, 1));
    }

    @Test
    @DisplayName("An index emitted for an early token is corrected when a smaller symbol is inserted after it")
    void indicesUseFinalRanks() {
        // Arrange
        List<ClassifiedToken> tokens = List.of(
                identifier("banana"),
                reserved(TokenKind.ASSIGN),
                identifier("apple"),
                reserved(TokenKind.SEMICOLON),
                identifier("banana"));

        // Act
        ProgramInternalForm pif = new PifBuilder().build(tokens);

        // Assert
        assertThat(pif.symbolTable().inOrderKeys()).containsExactly("apple", "banana");
        assertThat(pif.entries()).containsExactly(
                new PifEntry(TokenKind.IDENTIFIER, 1),
                PifEntry.reserved(TokenKind.ASSIGN),
                new PifEntry(TokenKind.IDENTIFIER, 0),
                PifEntry.reserved(TokenKind.SEMICOLON),
                new PifEntry(TokenKind.IDENTIFIER, 1));
    }

    @Test
    @DisplayName("Repeating one symbol gives one table entry and identical indices")
    void repeatedSymbolSharesOneEntry() {
        List<ClassifiedToken> tokens = List.of(constant("7"), constant("7"), constant("7"), constant("7"));

        ProgramInternalForm pif = new PifBuilder().build(tokens);

        assertThat(pif.symbolTable().size()).isEqualTo(1);
        assertThat(pif.entries()).hasSize(4).allSatisfy(entry -> {
            assertThat(entry.kind()).isEqualTo(TokenKind.CONSTANT);
            assertThat(entry.index()).isZero();
        });
    }

    @Test
    @DisplayName("Reserved-only input yields an empty table and only sentinel indices")
    void reservedOnly() {
        ProgramInternalForm pif = new PifBuilder().build(List.of(reserved(TokenKind.RETURN), reserved(TokenKind.SEMICOLON)));

        assertThat(pif.symbolTable().isEmpty()).isTrue();
        assertThat(pif.entries()).extracting(PifEntry::code, PifEntry::index)
                .containsExactly(tuple(14, -1L), tuple(16, -1L));
    }

    @Test
    @DisplayName("An empty token list gives an empty result")
    void emptyInput() {
        ProgramInternalForm pif = new PifBuilder().build(List.of());

        assertThat(pif.entries()).isEmpty();
        assertThat(pif.symbolTable().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Entries reject indices that do not fit their kind")
    void entryValidatesIndex() {
        assertThatThrownBy(() -> new PifEntry(TokenKind.IDENTIFIER, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PifEntry(TokenKind.SEMICOLON, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new PifEntry(TokenKind.CONSTANT, 3)).hasToString("(1, 3)");
    }
}
