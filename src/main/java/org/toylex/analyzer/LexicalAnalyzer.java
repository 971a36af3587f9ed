package org.toylex.analyzer;

import org.toylex.analyzer.api.AnalysisResult;
import org.toylex.analyzer.api.ILexicalAnalyzer;
import org.toylex.analyzer.api.InvalidTokenException;
import org.toylex.analyzer.diagnostics.AnalyzerLogger;
import org.toylex.analyzer.lexer.ClassifiedToken;
import org.toylex.analyzer.lexer.Classifier;
import org.toylex.analyzer.lexer.Lexeme;
import org.toylex.analyzer.lexer.Scanner;
import org.toylex.analyzer.pif.PifBuilder;
import org.toylex.analyzer.pif.ProgramInternalForm;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The main analyzer implementation. It runs the pipeline scan, classify and build for one source
 * at a time. Every call works on its own scanner and symbol table, so an instance can be reused
 * for any number of sources, one after the other.
 */
public class LexicalAnalyzer implements ILexicalAnalyzer {

    private final AnalyzerOptions options;
    private final Classifier classifier = new Classifier();
    private final PifBuilder pifBuilder = new PifBuilder();
    private int verbosity = -1;

    /**
     * Creates an analyzer with default options.
     */
    public LexicalAnalyzer() {
        this(AnalyzerOptions.defaults());
    }

    /**
     * Creates an analyzer with the given options.
     * @param options The analyzer options.
     */
    public LexicalAnalyzer(AnalyzerOptions options) {
        this.options = options;
    }

    @Override
    public AnalysisResult analyze(String source) throws InvalidTokenException {
        return analyze(source, options.defaultSourceName());
    }

    @Override
    public AnalysisResult analyze(Path file) throws InvalidTokenException, IOException {
        String source = Files.readString(file, options.charset());
        return analyze(source, file.toString().replace('\\', '/'));
    }

    @Override
    public AnalysisResult analyze(String source, String sourceName) throws InvalidTokenException {
        if (verbosity < 0) {
            return run(source, sourceName);
        }
        // The verbosity applies to this analysis only.
        int previous = AnalyzerLogger.setLevel(verbosity);
        try {
            return run(source, sourceName);
        } finally {
            AnalyzerLogger.setLevel(previous);
        }
    }

    private AnalysisResult run(String source, String sourceName) throws InvalidTokenException {
        // Phase 1: Scanning
        List<Lexeme> lexemes = new Scanner(source, sourceName).scan();
        AnalyzerLogger.debug("Analyzer: " + sourceName + " scanned " + lexemes.size() + " lexemes");

        // Phase 2: Classification, aborting at the first invalid lexeme
        List<ClassifiedToken> tokens = new ArrayList<>(lexemes.size());
        for (Lexeme lexeme : lexemes) {
            ClassifiedToken token = classifier.classify(lexeme);
            AnalyzerLogger.trace("{} '{}' -> {}", lexeme.source(), lexeme.text(), token.kind());
            tokens.add(token);
        }

        // Phase 3: Symbol table and PIF
        ProgramInternalForm pif = pifBuilder.build(tokens);

        return new AnalysisResult(sourceName, pif.symbolTable().inOrderKeys(), pif.entries());
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
