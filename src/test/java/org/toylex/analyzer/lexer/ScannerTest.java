package org.toylex.analyzer.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Scanner}.
 * These tests verify the longest-match rules, the handling of whitespace and the recorded
 * source positions. The scanner never rejects input, so unknown characters show up as lexemes.
 */
@Tag("unit")
class ScannerTest {

    private static List<String> texts(String source) {
        return new Scanner(source).scan().stream().map(Lexeme::text).toList();
    }

    @Test
    @DisplayName("A simple declaration and assignment is split at whitespace and punctuation")
    void simpleStatementIsSplitIntoLexemes() {
        assertThat(texts("int a ; a = 5 ;"))
                .containsExactly("int", "a", ";", "a", "=", "5", ";");
    }

    @Test
    @DisplayName("Lexemes are recognized without separating whitespace")
    void lexemesWithoutWhitespace() {
        assertThat(texts("if(x<10){cout<x;}"))
                .containsExactly("if", "(", "x", "<", "10", ")", "{", "cout", "<", "x", ";", "}");
    }

    @Test
    @DisplayName("All two-character operators win over their single-character prefixes")
    void twoCharacterOperators() {
        assertThat(texts("a==b<=c>=d!=e&&f||g"))
                .containsExactly("a", "==", "b", "<=", "c", ">=", "d", "!=", "e", "&&", "f", "||", "g");
    }

    @Test
    @DisplayName("A doubled less-than is not a single lexeme but two separate ones")
    void shiftOperatorIsTwoLessThanLexemes() {
        assertThat(texts("cout << a")).containsExactly("cout", "<", "<", "a");
    }

    @Test
    @DisplayName("\"===\" splits into \"==\" followed by \"=\"")
    void longestMatchIsLeftToRight() {
        assertThat(texts("a===b")).containsExactly("a", "==", "=", "b");
    }

    @Test
    @DisplayName("Identifiers may contain digits and underscores but do not start with a digit")
    void identifiersAndIntegers() {
        assertThat(texts("_tmp1 abc123 123abc 007"))
                .containsExactly("_tmp1", "abc123", "123", "abc", "007");
    }

    @Test
    @DisplayName("A character literal holds exactly one alphanumeric character")
    void characterLiterals() {
        assertThat(texts("'a' '7'")).containsExactly("'a'", "'7'");
        assertThat(texts("'ab'")).containsExactly("'", "ab", "'");
        assertThat(texts("'_'")).containsExactly("'", "_", "'");
        assertThat(texts("'a")).containsExactly("'", "a");
    }

    @Test
    @DisplayName("String literals accept alphanumeric bodies only; malformed strings fall back to a single quote lexeme")
    void stringLiterals() {
        assertThat(texts("\"abc\" \"\" \"A1\"")).containsExactly("\"abc\"", "\"\"", "\"A1\"");
        assertThat(texts("\"a b\"")).containsExactly("\"", "a", "b", "\"");
        assertThat(texts("\"abc")).containsExactly("\"", "abc");
    }

    @Test
    @DisplayName("Unknown characters become single-character lexemes instead of errors")
    void unknownCharactersAreEmitted() {
        assertThat(texts("a # b ! & |")).containsExactly("a", "#", "b", "!", "&", "|");
    }

    @Test
    @DisplayName("Sources consisting only of whitespace produce no lexemes")
    void whitespaceOnly() {
        assertThat(texts("")).isEmpty();
        assertThat(texts(" \t\r\n  \n")).isEmpty();
    }

    @Test
    @DisplayName("Unicode space separators and NEL separate lexemes like ordinary whitespace")
    void unicodeWhitespaceSeparatesLexemes() {
        assertThat(texts("int\u00A0a ;")).containsExactly("int", "a", ";");
        assertThat(texts("int\u0085a ;")).containsExactly("int", "a", ";");
        assertThat(texts("x\u2007=\u202F1\u3000;")).containsExactly("x", "=", "1", ";");
    }

    @Test
    @DisplayName("A character outside the BMP is one lexeme occupying one column")
    void supplementaryCharacterIsOneLexeme() {
        // Arrange
        String smiley = new String(Character.toChars(0x1F600));

        // Act
        List<Lexeme> lexemes = new Scanner("a " + smiley + " b").scan();

        // Assert
        assertThat(lexemes).extracting(Lexeme::text).containsExactly("a", smiley, "b");
        assertThat(lexemes.get(1).source().columnNumber()).isEqualTo(3);
        assertThat(lexemes.get(2).source().columnNumber()).isEqualTo(5);
        assertThat(lexemes.get(2).source().offset()).isEqualTo(5);
    }

    @Test
    @DisplayName("Offsets, lines and columns are recorded, also after a line break")
    void sourcePositions() {
        // Arrange
        String source = "int a;\n  b = 10;";

        // Act
        List<Lexeme> lexemes = new Scanner(source, "prog.txt").scan();

        // Assert
        assertThat(lexemes).hasSize(7);
        Lexeme b = lexemes.get(3);
        assertThat(b.text()).isEqualTo("b");
        assertThat(b.source().fileName()).isEqualTo("prog.txt");
        assertThat(b.source().offset()).isEqualTo(9);
        assertThat(b.source().lineNumber()).isEqualTo(2);
        assertThat(b.source().columnNumber()).isEqualTo(3);

        Lexeme ten = lexemes.get(5);
        assertThat(ten.text()).isEqualTo("10");
        assertThat(ten.source().offset()).isEqualTo(13);
        assertThat(ten.source().columnNumber()).isEqualTo(7);

        assertThat(lexemes.get(0).source().offset()).isZero();
        assertThat(lexemes.get(0).source().lineNumber()).isEqualTo(1);
        assertThat(lexemes.get(0).source().columnNumber()).isEqualTo(1);
    }
}
