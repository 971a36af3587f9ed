package org.toylex.analyzer.api;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Defines the public interface of the lexical analyzer.
 */
public interface ILexicalAnalyzer {

    /**
     * Analyzes the given source text.
     *
     * @param source The complete source text.
     * @param sourceName A logical name for the source, used in error positions.
     * @return The symbol table and program internal form of the source.
     * @throws InvalidTokenException at the first lexeme that is not a valid token.
     */
    AnalysisResult analyze(String source, String sourceName) throws InvalidTokenException;

    /**
     * Analyzes the given source text under the configured default source name.
     *
     * @param source The complete source text.
     * @return The symbol table and program internal form of the source.
     * @throws InvalidTokenException at the first lexeme that is not a valid token.
     */
    AnalysisResult analyze(String source) throws InvalidTokenException;

    /**
     * Analyzes the contents of a file.
     *
     * @param file The path to the source file.
     * @return The symbol table and program internal form of the file.
     * @throws InvalidTokenException at the first lexeme that is not a valid token.
     * @throws IOException if the file cannot be read.
     */
    AnalysisResult analyze(Path file) throws InvalidTokenException, IOException;

    /**
     * Sets the verbosity level for log output of this analyzer's runs; other analyzers are unaffected.
     * @param level The verbosity level (0=errors only ... 4=trace).
     */
    void setVerbosity(int level);
}
